package com.dfsoptimizer.constraint;

import java.util.Set;
import lombok.Builder;
import lombok.Getter;

/**
 * A named player group that must appear together: between {@code minCount} and {@code maxCount}
 * players of the group per lineup, plus at least {@code bringBackMin} players from the
 * bring-back group (typically pass-catchers on the opposing team).
 *
 * <p>The group is either listed explicitly ({@code playerIds}) or described by a team and a set
 * of positions, in which case {@link ConstraintSet} resolves it against the pool. The same holds
 * for the bring-back group: explicit {@code bringBackPlayerIds}, or the opponent of
 * {@code team} restricted to {@code bringBackPositions}.
 */
@Getter
@Builder
public class StackRule {

    private final String name;

    private final Set<String> playerIds;

    private final String team;
    private final Set<String> positions;

    private final int minCount;

    /** Upper bound on group players per lineup; null means no bound beyond the roster size. */
    private final Integer maxCount;

    private final Set<String> bringBackPlayerIds;
    private final Set<String> bringBackPositions;

    private final int bringBackMin;

    @Override
    public String toString() {
        return name + "[" + minCount + ".." + (maxCount != null ? maxCount : "*") + (bringBackMin > 0 ? ", bring-back " + bringBackMin : "") + "]";
    }
}
