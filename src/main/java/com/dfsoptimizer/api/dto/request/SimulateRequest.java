package com.dfsoptimizer.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulateRequest {

    @NotEmpty
    @Valid
    private List<PlayerRequest> players;

    /** Roster preset that gives the slot names of each lineup. */
    @NotBlank
    private String preset;

    @NotEmpty
    @Valid
    private List<LineupRequest> lineups;

    @Valid
    private List<CorrelationRequest> correlations;

    /** Strength of the generated team/opponent correlations; null or 0 disables them. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double correlationStrength;

    @Valid
    private SimulationOptionsRequest simulation;
}
