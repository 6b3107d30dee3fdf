package com.dfsoptimizer.constraint;

import com.dfsoptimizer.domain.model.Lineup;
import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.domain.model.RosterSlot;
import com.dfsoptimizer.domain.model.RosterSlotSpec;
import com.dfsoptimizer.exception.ConstraintConfigException;
import com.dfsoptimizer.pool.PlayerPool;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;

/**
 * Validated roster-construction rules bound to a player pool and slot layout.
 *
 * <p>Construction ({@link #of}) fails fast with {@link ConstraintConfigException} on malformed
 * definitions: negative limits, min above max in a stack rule, unknown or conflicting lock/ban
 * ids, a uniqueness requirement larger than the roster. Ordinary infeasibility of a candidate is
 * never an exception: {@link #evaluate} reports it as violations and {@link #isFeasible} as false.
 *
 * <p>Locks and bans combine the ids listed in {@link LineupConstraints} with the players' own
 * locked/banned flags. Team-and-position stack definitions are resolved to player ids here, once.
 *
 * <p>Immutable. The accumulating set of prior lineups is always passed in by the caller.
 */
@Getter
public final class ConstraintSet {

    private final PlayerPool pool;
    private final RosterSlotSpec slotSpec;
    private final int salaryCap;
    private final Integer minSalary;
    private final Integer maxPlayersPerTeam;
    private final Integer minGames;
    private final int minUniquePlayers;
    private final Set<String> lockedIds;
    private final Set<String> bannedIds;
    private final List<ResolvedStack> stacks;

    /**
     * A stack rule with both groups resolved to concrete player ids.
     */
    public record ResolvedStack(
            String name, Set<String> groupIds, int minCount, int maxCount, Set<String> bringBackIds, int bringBackMin) {}

    private ConstraintSet(
            PlayerPool pool,
            RosterSlotSpec slotSpec,
            LineupConstraints constraints,
            Set<String> lockedIds,
            Set<String> bannedIds,
            List<ResolvedStack> stacks) {
        this.pool = pool;
        this.slotSpec = slotSpec;
        this.salaryCap = constraints.getSalaryCap();
        this.minSalary = constraints.getMinSalary();
        this.maxPlayersPerTeam = constraints.getMaxPlayersPerTeam();
        this.minGames = constraints.getMinGames();
        this.minUniquePlayers = constraints.getMinUniquePlayers();
        this.lockedIds = Collections.unmodifiableSet(lockedIds);
        this.bannedIds = Collections.unmodifiableSet(bannedIds);
        this.stacks = List.copyOf(stacks);
    }

    public static ConstraintSet of(PlayerPool pool, RosterSlotSpec slotSpec, LineupConstraints constraints) {
        if (constraints == null) {
            throw new ConstraintConfigException("Constraints are required");
        }
        int rosterSize = slotSpec.getRosterSize();
        if (constraints.getSalaryCap() <= 0) {
            throw new ConstraintConfigException("Salary cap must be positive, was " + constraints.getSalaryCap());
        }
        if (constraints.getMinSalary() != null && constraints.getMinSalary() < 0) {
            throw new ConstraintConfigException("Minimum salary must not be negative");
        }
        if (constraints.getMaxPlayersPerTeam() != null && constraints.getMaxPlayersPerTeam() < 1) {
            throw new ConstraintConfigException("Max players per team must be at least 1");
        }
        if (constraints.getMinGames() != null && constraints.getMinGames() < 0) {
            throw new ConstraintConfigException("Minimum games must not be negative");
        }
        if (constraints.getMinUniquePlayers() < 0 || constraints.getMinUniquePlayers() > rosterSize) {
            throw new ConstraintConfigException("Minimum unique players must lie in [0, " + rosterSize + "], was "
                    + constraints.getMinUniquePlayers());
        }

        Set<String> locked = new LinkedHashSet<>();
        Set<String> banned = new LinkedHashSet<>();
        for (String id : nullSafe(constraints.getLockedPlayerIds())) {
            requireKnown(pool, id, "Locked");
            locked.add(id);
        }
        for (String id : nullSafe(constraints.getBannedPlayerIds())) {
            requireKnown(pool, id, "Banned");
            banned.add(id);
        }
        for (Player player : pool.getPlayers()) {
            if (player.isLocked()) {
                locked.add(player.getId());
            }
            if (player.isBanned()) {
                banned.add(player.getId());
            }
        }
        Set<String> overlap = new LinkedHashSet<>(locked);
        overlap.retainAll(banned);
        if (!overlap.isEmpty()) {
            throw new ConstraintConfigException("Players are both locked and banned: " + overlap);
        }

        List<ResolvedStack> resolved = new ArrayList<>();
        List<StackRule> rules = constraints.getStackRules() != null ? constraints.getStackRules() : List.of();
        for (StackRule rule : rules) {
            resolved.add(resolve(pool, rule, rosterSize));
        }
        return new ConstraintSet(pool, slotSpec, constraints, locked, banned, resolved);
    }

    public int getRosterSize() {
        return slotSpec.getRosterSize();
    }

    /** Most players a new lineup may share with any prior lineup in the batch. */
    public int getMaxSharedPlayers() {
        return slotSpec.getRosterSize() - minUniquePlayers;
    }

    public boolean isLocked(String playerId) {
        return lockedIds.contains(playerId);
    }

    public boolean isBanned(String playerId) {
        return bannedIds.contains(playerId);
    }

    public boolean isFeasible(LineupCandidate candidate) {
        return evaluate(candidate, List.of()).isFeasible();
    }

    public boolean isFeasible(LineupCandidate candidate, List<Lineup> priorLineups) {
        return evaluate(candidate, priorLineups).isFeasible();
    }

    /**
     * Checks a partial or complete candidate. For a partial candidate only rules that the filled
     * slots can already break are checked (cap, eligibility, duplicates, bans, team and stack
     * maxima, overlap with prior lineups, and whether the open slots can still take every lock).
     * Minimum-style rules (salary floor, stack minimum, bring-back, games) apply once complete.
     */
    public FeasibilityResult evaluate(LineupCandidate candidate, List<Lineup> priorLineups) {
        List<ConstraintViolation> violations = new ArrayList<>();
        boolean complete = candidate.isComplete();

        Set<String> ids = new HashSet<>();
        Map<String, Integer> perTeam = new HashMap<>();
        Set<String> games = new HashSet<>();
        int salary = 0;

        for (int i = 0; i < candidate.size(); i++) {
            Player player = candidate.get(i);
            RosterSlot slot = slotSpec.getSlot(i);
            if (player == null) {
                if (complete) {
                    violations.add(ConstraintViolation.of(ConstraintViolation.SLOT_EMPTY, "Slot " + slot + " is empty"));
                }
                continue;
            }
            if (!pool.contains(player.getId())) {
                violations.add(ConstraintViolation.of(
                        ConstraintViolation.UNKNOWN_PLAYER, player.getId() + " is not in the player pool"));
            }
            if (!slot.accepts(player)) {
                violations.add(ConstraintViolation.of(
                        ConstraintViolation.SLOT_INELIGIBLE, player + " cannot fill slot " + slot.getName()));
            }
            if (!ids.add(player.getId())) {
                violations.add(ConstraintViolation.of(
                        ConstraintViolation.DUPLICATE_PLAYER, player + " appears more than once"));
            }
            if (bannedIds.contains(player.getId())) {
                violations.add(ConstraintViolation.of(ConstraintViolation.BANNED_PLAYER, player + " is banned"));
            }
            salary += player.getSalary();
            perTeam.merge(player.getTeam(), 1, Integer::sum);
            games.add(player.getResolvedGameId());
        }

        if (salary > salaryCap) {
            violations.add(ConstraintViolation.of(
                    ConstraintViolation.SALARY_CAP_EXCEEDED, "Salary " + salary + " exceeds cap " + salaryCap));
        }
        if (maxPlayersPerTeam != null) {
            perTeam.forEach((team, count) -> {
                if (count > maxPlayersPerTeam) {
                    violations.add(ConstraintViolation.of(
                            ConstraintViolation.TEAM_LIMIT_EXCEEDED,
                            count + " players from " + team + " exceeds limit " + maxPlayersPerTeam));
                }
            });
        }

        long missingLocks = lockedIds.stream().filter(id -> !ids.contains(id)).count();
        int openSlots = candidate.size() - candidate.filledCount();
        if (missingLocks > openSlots) {
            violations.add(ConstraintViolation.of(
                    ConstraintViolation.LOCKED_PLAYER_MISSING,
                    missingLocks + " locked player(s) missing with " + openSlots + " open slot(s)"));
        }

        for (ResolvedStack stack : stacks) {
            int inGroup = countIn(ids, stack.groupIds());
            if (inGroup > stack.maxCount()) {
                violations.add(ConstraintViolation.of(
                        ConstraintViolation.STACK_MAX_EXCEEDED,
                        stack.name() + " has " + inGroup + " players, max " + stack.maxCount()));
            }
            if (complete && inGroup < stack.minCount()) {
                violations.add(ConstraintViolation.of(
                        ConstraintViolation.STACK_MIN_NOT_MET,
                        stack.name() + " has " + inGroup + " players, min " + stack.minCount()));
            }
            if (complete && countIn(ids, stack.bringBackIds()) < stack.bringBackMin()) {
                violations.add(ConstraintViolation.of(
                        ConstraintViolation.BRING_BACK_NOT_MET,
                        stack.name() + " needs " + stack.bringBackMin() + " bring-back player(s)"));
            }
        }

        if (complete && minSalary != null && salary < minSalary) {
            violations.add(ConstraintViolation.of(
                    ConstraintViolation.SALARY_FLOOR_NOT_MET, "Salary " + salary + " is below floor " + minSalary));
        }
        if (complete && minGames != null && games.size() < minGames) {
            violations.add(ConstraintViolation.of(
                    ConstraintViolation.MIN_GAMES_NOT_MET,
                    games.size() + " game(s) represented, min " + minGames));
        }

        if (priorLineups != null) {
            int maxShared = getMaxSharedPlayers();
            for (Lineup prior : priorLineups) {
                int shared = countIn(ids, prior.getPlayerIds());
                if (shared > maxShared) {
                    violations.add(ConstraintViolation.of(
                            ConstraintViolation.UNIQUENESS_VIOLATED,
                            "Shares " + shared + " players with " + prior.getLineupId() + ", max " + maxShared));
                }
            }
        }

        return violations.isEmpty() ? FeasibilityResult.feasible() : FeasibilityResult.infeasible(violations);
    }

    private static ResolvedStack resolve(PlayerPool pool, StackRule rule, int rosterSize) {
        String name = rule.getName() != null ? rule.getName() : "stack";
        int maxCount = rule.getMaxCount() != null ? rule.getMaxCount() : rosterSize;
        if (rule.getMinCount() < 0 || maxCount < 0) {
            throw new ConstraintConfigException("Stack rule " + name + " has a negative count");
        }
        if (rule.getMinCount() > maxCount) {
            throw new ConstraintConfigException("Stack rule " + name + " has min " + rule.getMinCount()
                    + " greater than max " + maxCount);
        }
        if (rule.getBringBackMin() < 0) {
            throw new ConstraintConfigException("Stack rule " + name + " has a negative bring-back minimum");
        }

        Set<String> group = new LinkedHashSet<>();
        if (rule.getPlayerIds() != null && !rule.getPlayerIds().isEmpty()) {
            for (String id : rule.getPlayerIds()) {
                requireKnown(pool, id, "Stack " + name);
                group.add(id);
            }
        } else if (rule.getTeam() != null) {
            group.addAll(teamGroup(pool, rule.getTeam(), rule.getPositions()));
        }
        if (group.isEmpty()) {
            throw new ConstraintConfigException("Stack rule " + name + " resolves to an empty player group");
        }

        Set<String> bringBack = new LinkedHashSet<>();
        if (rule.getBringBackPlayerIds() != null && !rule.getBringBackPlayerIds().isEmpty()) {
            for (String id : rule.getBringBackPlayerIds()) {
                requireKnown(pool, id, "Stack " + name + " bring-back");
                bringBack.add(id);
            }
        } else if (rule.getBringBackMin() > 0 && rule.getTeam() != null) {
            String opponent = opponentOf(pool, rule.getTeam());
            if (opponent != null) {
                bringBack.addAll(teamGroup(pool, opponent, rule.getBringBackPositions()));
            }
        }
        if (rule.getBringBackMin() > 0 && bringBack.isEmpty()) {
            throw new ConstraintConfigException("Stack rule " + name + " requires a bring-back but has no bring-back group");
        }
        return new ResolvedStack(
                name, Set.copyOf(group), rule.getMinCount(), maxCount, Set.copyOf(bringBack), rule.getBringBackMin());
    }

    private static Set<String> teamGroup(PlayerPool pool, String team, Set<String> positions) {
        Set<String> ids = new LinkedHashSet<>();
        for (Player player : pool.getPlayers()) {
            if (!player.getTeam().equals(team)) {
                continue;
            }
            if (positions == null || positions.isEmpty() || player.isEligibleFor(positions)) {
                ids.add(player.getId());
            }
        }
        return ids;
    }

    private static String opponentOf(PlayerPool pool, String team) {
        return pool.getPlayers().stream()
                .filter(p -> p.getTeam().equals(team) && p.getOpponent() != null)
                .map(Player::getOpponent)
                .findFirst()
                .orElse(null);
    }

    private static int countIn(Set<String> ids, Set<String> group) {
        int count = 0;
        for (String id : group) {
            if (ids.contains(id)) {
                count++;
            }
        }
        return count;
    }

    private static void requireKnown(PlayerPool pool, String id, String context) {
        if (!pool.contains(id)) {
            throw new ConstraintConfigException(context + " player id not in pool: " + id);
        }
    }

    private static <T> Set<T> nullSafe(Set<T> set) {
        return set != null ? set : Set.of();
    }
}
