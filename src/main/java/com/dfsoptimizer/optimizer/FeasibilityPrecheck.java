package com.dfsoptimizer.optimizer;

import com.dfsoptimizer.constraint.ConstraintSet;
import com.dfsoptimizer.constraint.ConstraintSet.ResolvedStack;
import com.dfsoptimizer.domain.enums.InfeasibilityCause;
import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.domain.model.RosterSlot;
import com.dfsoptimizer.domain.model.RosterSlotSpec;
import com.dfsoptimizer.exception.InfeasibleException;
import com.dfsoptimizer.pool.PlayerPool;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Cheap structural checks run before the first solve. Each one proves infeasibility on its own
 * and names the constraint class responsible; passing them does not prove feasibility.
 */
final class FeasibilityPrecheck {

    private FeasibilityPrecheck() {}

    static void check(ConstraintSet constraints) {
        PlayerPool pool = constraints.getPool();
        RosterSlotSpec slotSpec = constraints.getSlotSpec();
        int rosterSize = slotSpec.getRosterSize();
        int cap = constraints.getSalaryCap();

        if (constraints.getMinSalary() != null && constraints.getMinSalary() > cap) {
            throw new InfeasibleException(InfeasibilityCause.SALARY_FLOOR,
                    "Salary floor " + constraints.getMinSalary() + " exceeds cap " + cap,
                    Map.of("minSalary", constraints.getMinSalary(), "salaryCap", cap));
        }

        List<Player> locked = constraints.getLockedIds().stream().map(pool::getById).toList();
        if (locked.size() > rosterSize) {
            throw new InfeasibleException(InfeasibilityCause.LOCKED_PLAYERS,
                    locked.size() + " locked players exceed roster size " + rosterSize,
                    Map.of("locked", locked.size(), "rosterSize", rosterSize));
        }
        int lockedSalary = locked.stream().mapToInt(Player::getSalary).sum();
        if (lockedSalary > cap) {
            throw new InfeasibleException(InfeasibilityCause.SALARY_CAP,
                    "Locked players cost " + lockedSalary + ", above cap " + cap,
                    Map.of("lockedSalary", lockedSalary, "salaryCap", cap));
        }
        if (SlotAssigner.assign(locked, slotSpec) == null) {
            throw new InfeasibleException(InfeasibilityCause.ROSTER_SLOTS,
                    "Locked players cannot all be seated in distinct eligible slots",
                    Map.of("locked", constraints.getLockedIds()));
        }

        int cheapestRoster = 0;
        for (RosterSlot slot : slotSpec.getSlots()) {
            OptionalInt cheapest = pool.eligibleForSlot(slot).stream()
                    .filter(player -> !constraints.isBanned(player.getId()))
                    .mapToInt(Player::getSalary)
                    .min();
            if (cheapest.isEmpty()) {
                throw new InfeasibleException(InfeasibilityCause.ROSTER_SLOTS,
                        "No eligible player for slot " + slot.getName(),
                        Map.of("slot", slot.getName()));
            }
            cheapestRoster += cheapest.getAsInt();
        }
        if (cheapestRoster > cap) {
            throw new InfeasibleException(InfeasibilityCause.SALARY_CAP,
                    "Cheapest possible roster costs " + cheapestRoster + ", above cap " + cap,
                    Map.of("minimumRosterSalary", cheapestRoster, "salaryCap", cap));
        }

        Set<String> games = new LinkedHashSet<>();
        Map<String, Integer> lockedPerTeam = new HashMap<>();
        for (Player player : pool.getPlayers()) {
            if (!constraints.isBanned(player.getId()) && player.isEligibleFor(slotSpec.getAllPositions())) {
                games.add(player.getResolvedGameId());
            }
        }
        locked.forEach(p -> lockedPerTeam.merge(p.getTeam(), 1, Integer::sum));
        if (constraints.getMinGames() != null && constraints.getMinGames() > games.size()) {
            throw new InfeasibleException(InfeasibilityCause.GAME_DIVERSITY,
                    "Minimum games " + constraints.getMinGames() + " exceeds the " + games.size() + " game(s) available",
                    Map.of("minGames", constraints.getMinGames(), "gamesAvailable", games.size()));
        }

        Integer maxPerTeam = constraints.getMaxPlayersPerTeam();
        if (maxPerTeam != null) {
            long teams = pool.getPlayers().stream()
                    .filter(p -> !constraints.isBanned(p.getId()))
                    .map(Player::getTeam)
                    .distinct()
                    .count();
            if ((long) maxPerTeam * teams < rosterSize) {
                throw new InfeasibleException(InfeasibilityCause.TEAM_LIMIT,
                        teams + " team(s) with at most " + maxPerTeam + " each cannot fill " + rosterSize + " slots",
                        Map.of("teams", teams, "maxPlayersPerTeam", maxPerTeam));
            }
            for (Map.Entry<String, Integer> entry : lockedPerTeam.entrySet()) {
                if (entry.getValue() > maxPerTeam) {
                    throw new InfeasibleException(InfeasibilityCause.TEAM_LIMIT,
                            entry.getValue() + " locked players from " + entry.getKey() + " exceed limit " + maxPerTeam,
                            Map.of("team", entry.getKey(), "maxPlayersPerTeam", maxPerTeam));
                }
            }
        }

        for (ResolvedStack stack : constraints.getStacks()) {
            long available = stack.groupIds().stream().filter(id -> !constraints.isBanned(id)).count();
            if (available < stack.minCount()) {
                throw new InfeasibleException(InfeasibilityCause.STACK_RULE,
                        "Stack " + stack.name() + " needs " + stack.minCount() + " players but only " + available
                                + " are available", Map.of("stack", stack.name()));
            }
            long lockedInGroup = stack.groupIds().stream().filter(constraints::isLocked).count();
            if (lockedInGroup > stack.maxCount()) {
                throw new InfeasibleException(InfeasibilityCause.STACK_RULE,
                        "Stack " + stack.name() + " allows " + stack.maxCount() + " players but " + lockedInGroup
                                + " are locked", Map.of("stack", stack.name()));
            }
            long bringBackAvailable = stack.bringBackIds().stream().filter(id -> !constraints.isBanned(id)).count();
            if (bringBackAvailable < stack.bringBackMin()) {
                throw new InfeasibleException(InfeasibilityCause.STACK_RULE,
                        "Stack " + stack.name() + " bring-back needs " + stack.bringBackMin() + " players but only "
                                + bringBackAvailable + " are available", Map.of("stack", stack.name()));
            }
        }
    }

    /**
     * Attributes an infeasible program to a constraint class by dropping one class of rows at a
     * time, in order, until the program becomes feasible. A program that is feasible as a whole,
     * or stays infeasible after every drop, has no single culprit and is reported as UNKNOWN.
     */
    static InfeasibilityCause diagnose(LineupProgram program, MipSolver solver, String backend, long timeLimitMs) {
        List<InfeasibilityCause> order = List.of(
                InfeasibilityCause.UNIQUENESS,
                InfeasibilityCause.STACK_RULE,
                InfeasibilityCause.TEAM_LIMIT,
                InfeasibilityCause.GAME_DIVERSITY,
                InfeasibilityCause.SALARY_FLOOR);
        IntegerProgram base = program.getProgram();
        for (InfeasibilityCause cause : order) {
            if (base.hasRowsFor(cause) && solver.isFeasible(base.without(cause), backend, timeLimitMs)) {
                return cause;
            }
        }
        return InfeasibilityCause.UNKNOWN;
    }
}
