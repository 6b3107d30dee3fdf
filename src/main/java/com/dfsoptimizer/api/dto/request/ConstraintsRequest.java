package com.dfsoptimizer.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConstraintsRequest {

    /** Roster preset name, e.g. DK_NFL_CLASSIC. */
    @NotBlank
    private String preset;

    /** Optional cap override; may lower the preset's cap, never raise it. */
    private Integer salaryCap;

    private Integer minSalary;

    @Min(1)
    private Integer maxPlayersPerTeam;

    @Min(1)
    private Integer minGames;

    @Min(1)
    private Integer minUniquePlayers;

    private Set<String> lockedPlayerIds;
    private Set<String> bannedPlayerIds;

    @Valid
    private List<StackRuleRequest> stackRules;
}
