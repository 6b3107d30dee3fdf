package com.dfsoptimizer.api.dto.request;

import com.dfsoptimizer.domain.enums.ContestType;
import com.dfsoptimizer.domain.enums.DistributionMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Simulation options. Unset options fall back to the {@code dfs.simulation} defaults. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationOptionsRequest {

    @Min(1)
    private Integer trials;

    private Long seed;
    private DistributionMode distributionMode;
    private Double targetScore;

    @Min(1)
    private Integer fieldSize;

    @Positive
    private Double entryFee;

    private ContestType contestType;
}
