package com.dfsoptimizer.constraint;

import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;

/**
 * Roster-construction rules for one optimization run, as supplied by the caller.
 *
 * <p>Null optional limits mean the check is disabled. Structural consistency is verified when a
 * {@link ConstraintSet} is built from this object; nothing is validated here.
 */
@Getter
@Builder(toBuilder = true)
public class LineupConstraints {

    private final int salaryCap;

    /** Minimum total salary. Null = no floor. */
    private final Integer minSalary;

    /** Maximum players from a single team. Null = no limit. */
    private final Integer maxPlayersPerTeam;

    /** Minimum number of distinct games represented. Null = no requirement. */
    private final Integer minGames;

    /** Minimum number of players any two lineups in a batch must differ by. */
    @Builder.Default
    private final int minUniquePlayers = 1;

    @Builder.Default
    private final Set<String> lockedPlayerIds = Set.of();

    @Builder.Default
    private final Set<String> bannedPlayerIds = Set.of();

    @Builder.Default
    private final List<StackRule> stackRules = List.of();
}
