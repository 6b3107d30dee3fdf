package com.dfsoptimizer.optimizer;

import com.dfsoptimizer.constraint.ConstraintSet;
import com.dfsoptimizer.constraint.ConstraintSet.ResolvedStack;
import com.dfsoptimizer.domain.enums.InfeasibilityCause;
import com.dfsoptimizer.domain.model.Lineup;
import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.domain.model.RosterSlot;
import com.dfsoptimizer.domain.model.RosterSlotSpec;
import com.dfsoptimizer.pool.PlayerPool;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Encodes a {@link ConstraintSet} plus the prior lineups of a batch as a 0/1 selection program.
 *
 * <p>Variables: one x(p) per non-banned player that fits at least one slot, followed by one game
 * indicator g(j) per game when a minimum game count is set. Rows:
 * <ul>
 *   <li>exactly roster-size players selected, locked players fixed to 1</li>
 *   <li>position buckets: for every set T of slot kinds, the players that fit only slots of
 *       kinds in T number at most the slots of T (Hall's condition, so any selection can be
 *       seated)</li>
 *   <li>salary at most the cap, and at least the floor when set</li>
 *   <li>at most max-per-team players per team</li>
 *   <li>stack group count within [min, max], bring-back count at least its minimum</li>
 *   <li>g(j) &lt;= players selected from game j, sum of g &gt;= min games</li>
 *   <li>one uniqueness cut per prior lineup: players shared &lt;= roster size - U</li>
 * </ul>
 */
final class LineupProgramBuilder {

    /** Bucket rows grow as 2^kinds; real rosters have well under ten kinds. */
    private static final int MAX_SLOT_KINDS = 16;

    private LineupProgramBuilder() {}

    /**
     * @param constraints  validated constraint set
     * @param playerValues objective coefficient per pool index
     * @param priors       lineups already emitted in this batch
     */
    static LineupProgram build(ConstraintSet constraints, double[] playerValues, List<Lineup> priors) {
        PlayerPool pool = constraints.getPool();
        RosterSlotSpec slotSpec = constraints.getSlotSpec();
        int slotCount = slotSpec.getRosterSize();

        List<Set<String>> kinds = new ArrayList<>();
        List<Integer> slotsPerKind = new ArrayList<>();
        int[] kindMask = new int[pool.size()];
        for (RosterSlot slot : slotSpec.getSlots()) {
            int kind = kinds.indexOf(slot.getEligiblePositions());
            if (kind < 0) {
                kind = kinds.size();
                if (kind == MAX_SLOT_KINDS) {
                    throw new IllegalStateException("Roster has more than " + MAX_SLOT_KINDS + " distinct slot kinds");
                }
                kinds.add(slot.getEligiblePositions());
                slotsPerKind.add(0);
                for (Player player : pool.eligibleForSlot(slot)) {
                    kindMask[pool.indexOf(player.getId())] |= 1 << kind;
                }
            }
            slotsPerKind.set(kind, slotsPerKind.get(kind) + 1);
        }

        List<Integer> varPlayer = new ArrayList<>();
        for (int p = 0; p < pool.size(); p++) {
            if (kindMask[p] != 0 && !constraints.isBanned(pool.get(p).getId())) {
                varPlayer.add(p);
            }
        }
        int playerCount = varPlayer.size();

        Map<String, Integer> gameVars = new LinkedHashMap<>();
        boolean gameRows = constraints.getMinGames() != null && constraints.getMinGames() > 1;
        if (gameRows) {
            for (int p : varPlayer) {
                gameVars.computeIfAbsent(pool.get(p).getResolvedGameId(), g -> playerCount + gameVars.size());
            }
        }

        int variableCount = playerCount + gameVars.size();
        double[] objective = new double[variableCount];
        for (int v = 0; v < playerCount; v++) {
            objective[v] = playerValues[varPlayer.get(v)];
        }

        RowFactory rows = new RowFactory(variableCount);

        double[] total = rows.blank();
        for (int v = 0; v < playerCount; v++) {
            total[v] = 1.0;
            if (constraints.isLocked(pool.get(varPlayer.get(v)).getId())) {
                double[] lock = rows.blank();
                lock[v] = 1.0;
                rows.add(ProgramRow.exactly(lock, 1.0, InfeasibilityCause.LOCKED_PLAYERS));
            }
        }
        rows.add(ProgramRow.exactly(total, slotCount, InfeasibilityCause.ROSTER_SLOTS));

        int allKinds = (1 << kinds.size()) - 1;
        for (int subset = 1; subset < allKinds; subset++) {
            int capacity = 0;
            for (int k = 0; k < kinds.size(); k++) {
                if ((subset & (1 << k)) != 0) {
                    capacity += slotsPerKind.get(k);
                }
            }
            double[] row = rows.blank();
            int members = 0;
            for (int v = 0; v < playerCount; v++) {
                if ((kindMask[varPlayer.get(v)] & ~subset) == 0) {
                    row[v] = 1.0;
                    members++;
                }
            }
            if (members > capacity) {
                rows.add(ProgramRow.atMost(row, capacity, InfeasibilityCause.ROSTER_SLOTS));
            }
        }

        double[] salary = rows.blank();
        for (int v = 0; v < playerCount; v++) {
            salary[v] = pool.get(varPlayer.get(v)).getSalary();
        }
        rows.add(ProgramRow.atMost(salary, constraints.getSalaryCap(), InfeasibilityCause.SALARY_CAP));
        if (constraints.getMinSalary() != null && constraints.getMinSalary() > 0) {
            rows.add(ProgramRow.atLeast(salary.clone(), constraints.getMinSalary(), InfeasibilityCause.SALARY_FLOOR));
        }

        if (constraints.getMaxPlayersPerTeam() != null && constraints.getMaxPlayersPerTeam() < slotCount) {
            for (String team : pool.getTeams()) {
                double[] row = rows.blank();
                boolean any = false;
                for (int v = 0; v < playerCount; v++) {
                    if (pool.get(varPlayer.get(v)).getTeam().equals(team)) {
                        row[v] = 1.0;
                        any = true;
                    }
                }
                if (any) {
                    rows.add(ProgramRow.atMost(row, constraints.getMaxPlayersPerTeam(), InfeasibilityCause.TEAM_LIMIT));
                }
            }
        }

        for (ResolvedStack stack : constraints.getStacks()) {
            double[] group = rows.membership(pool, varPlayer, stack.groupIds());
            if (stack.minCount() > 0) {
                rows.add(ProgramRow.atLeast(group, stack.minCount(), InfeasibilityCause.STACK_RULE));
            }
            if (stack.maxCount() < slotCount) {
                rows.add(ProgramRow.atMost(group.clone(), stack.maxCount(), InfeasibilityCause.STACK_RULE));
            }
            if (stack.bringBackMin() > 0) {
                rows.add(ProgramRow.atLeast(rows.membership(pool, varPlayer, stack.bringBackIds()),
                        stack.bringBackMin(), InfeasibilityCause.STACK_RULE));
            }
        }

        if (gameRows) {
            double[] games = rows.blank();
            gameVars.forEach((game, g) -> {
                double[] link = rows.blank();
                link[g] = 1.0;
                for (int v = 0; v < playerCount; v++) {
                    if (pool.get(varPlayer.get(v)).getResolvedGameId().equals(game)) {
                        link[v] = -1.0;
                    }
                }
                rows.add(ProgramRow.atMost(link, 0.0, InfeasibilityCause.GAME_DIVERSITY));
                games[g] = 1.0;
            });
            rows.add(ProgramRow.atLeast(games, constraints.getMinGames(), InfeasibilityCause.GAME_DIVERSITY));
        }

        int maxShared = constraints.getMaxSharedPlayers();
        if (maxShared < slotCount) {
            for (Lineup prior : priors) {
                rows.add(ProgramRow.atMost(rows.membership(pool, varPlayer, prior.getPlayerIds()),
                        maxShared, InfeasibilityCause.UNIQUENESS));
            }
        }

        IntegerProgram program = new IntegerProgram(variableCount, objective, rows.rows);
        int[] players = new int[variableCount];
        for (int v = 0; v < variableCount; v++) {
            players[v] = v < playerCount ? varPlayer.get(v) : -1;
        }
        return new LineupProgram(program, pool, slotSpec, players);
    }

    private static final class RowFactory {

        private final int width;
        private final List<ProgramRow> rows = new ArrayList<>();

        RowFactory(int width) {
            this.width = width;
        }

        double[] blank() {
            return new double[width];
        }

        double[] membership(PlayerPool pool, List<Integer> varPlayer, Set<String> ids) {
            double[] row = blank();
            for (int v = 0; v < varPlayer.size(); v++) {
                if (ids.contains(pool.get(varPlayer.get(v)).getId())) {
                    row[v] = 1.0;
                }
            }
            return row;
        }

        void add(ProgramRow row) {
            rows.add(row);
        }
    }
}
