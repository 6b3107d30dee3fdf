package com.dfsoptimizer.unit;

import com.dfsoptimizer.constraint.ConstraintSet;
import com.dfsoptimizer.constraint.LineupConstraints;
import com.dfsoptimizer.constraint.RosterPreset;
import com.dfsoptimizer.domain.model.Lineup;
import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.domain.model.SlotAssignment;
import com.dfsoptimizer.pool.PlayerPool;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Shared test slate: a 20-player DraftKings NFL pool over two games (KC@BUF, DAL@PHI) and
 * helpers to build lineups by hand.
 */
public final class SlateFixtures {

    private SlateFixtures() {}

    public static List<Player> dkNflPlayers() {
        List<Player> players = new ArrayList<>();
        players.add(player("kc-qb", "QB", "KC", "BUF", 8000, 24.0, 0.20));
        players.add(player("kc-rb", "RB", "KC", "BUF", 7000, 18.0, 0.25));
        players.add(player("kc-wr1", "WR", "KC", "BUF", 8200, 20.0, 0.30));
        players.add(player("kc-wr2", "WR", "KC", "BUF", 5500, 13.0, 0.10));
        players.add(player("kc-te", "TE", "KC", "BUF", 6500, 15.0, 0.20));
        players.add(player("kc-dst", "DST", "KC", "BUF", 3000, 8.0, 0.10));

        players.add(player("buf-qb", "QB", "BUF", "KC", 8200, 25.0, 0.22));
        players.add(player("buf-rb", "RB", "BUF", "KC", 6200, 16.0, 0.20));
        players.add(player("buf-wr1", "WR", "BUF", "KC", 7500, 18.0, 0.25));
        players.add(player("buf-wr2", "WR", "BUF", "KC", 4800, 11.0, 0.08));
        players.add(player("buf-te", "TE", "BUF", "KC", 4000, 9.0, 0.06));
        players.add(player("buf-dst", "DST", "BUF", "KC", 2800, 7.0, 0.08));

        players.add(player("dal-rb", "RB", "DAL", "PHI", 5200, 13.0, 0.12));
        players.add(player("dal-wr", "WR", "DAL", "PHI", 6800, 16.0, 0.18));
        players.add(player("dal-te", "TE", "DAL", "PHI", 3500, 8.0, 0.05));
        players.add(player("dal-dst", "DST", "DAL", "PHI", 2500, 6.0, 0.05));

        players.add(player("phi-rb1", "RB", "PHI", "DAL", 7800, 19.0, 0.30));
        players.add(player("phi-rb2", "RB", "PHI", "DAL", 4200, 10.0, 0.07));
        players.add(player("phi-wr1", "WR", "PHI", "DAL", 6000, 14.0, 0.15));
        players.add(player("phi-wr2", "WR", "PHI", "DAL", 3800, 9.0, 0.04));
        return players;
    }

    public static PlayerPool dkNflPool() {
        return PlayerPool.load(dkNflPlayers());
    }

    public static ConstraintSet dkNflConstraints(PlayerPool pool, LineupConstraints.LineupConstraintsBuilder builder) {
        return ConstraintSet.of(pool, RosterPreset.DK_NFL_CLASSIC.slotSpec(), builder.build());
    }

    public static LineupConstraints.LineupConstraintsBuilder defaultRules() {
        return LineupConstraints.builder().salaryCap(RosterPreset.DK_NFL_CLASSIC.getDefaultSalaryCap());
    }

    public static Player player(
            String id, String position, String team, String opponent, int salary, double projection, double ownership) {
        return Player.builder()
                .id(id)
                .name(id.toUpperCase())
                .positions(Set.of(position))
                .team(team)
                .opponent(opponent)
                .salary(salary)
                .projection(projection)
                .ownership(ownership)
                .build();
    }

    /** Builds a lineup from players already in slot order; slot names are the player's first position. */
    public static Lineup lineup(String lineupId, int generationIndex, double objectiveValue, List<Player> players) {
        List<SlotAssignment> assignments = new ArrayList<>();
        for (int i = 0; i < players.size(); i++) {
            Player player = players.get(i);
            assignments.add(SlotAssignment.builder()
                    .slotIndex(i)
                    .slotName(player.getPositions().iterator().next())
                    .player(player)
                    .build());
        }
        return Lineup.builder()
                .lineupId(lineupId)
                .generationIndex(generationIndex)
                .assignments(assignments)
                .totalSalary(players.stream().mapToInt(Player::getSalary).sum())
                .totalProjection(players.stream().mapToDouble(Player::getEffectiveProjection).sum())
                .objectiveValue(objectiveValue)
                .build();
    }

    public static List<Player> byIds(PlayerPool pool, String... ids) {
        List<Player> players = new ArrayList<>();
        for (String id : ids) {
            players.add(pool.getById(id));
        }
        return players;
    }
}
