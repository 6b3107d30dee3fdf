package com.dfsoptimizer.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stack rule. Either list the group's player ids, or give a team plus positions to resolve the
 * group from the pool. The bring-back group works the same way against the opponent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StackRuleRequest {

    @NotBlank
    private String name;

    private Set<String> playerIds;
    private String team;
    private Set<String> positions;

    @Min(0)
    private int minCount;

    /** Omitted means no upper bound beyond the roster size. */
    @Min(0)
    private Integer maxCount;

    private Set<String> bringBackPlayerIds;
    private Set<String> bringBackPositions;

    @Min(0)
    private int bringBackMin;
}
