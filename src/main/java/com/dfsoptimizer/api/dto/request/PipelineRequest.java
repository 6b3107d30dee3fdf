package com.dfsoptimizer.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Optimize, simulate and filter in one call. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRequest {

    @NotNull
    @Valid
    private OptimizeRequest optimize;

    @Valid
    private List<CorrelationRequest> correlations;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double correlationStrength;

    @Valid
    private SimulationOptionsRequest simulation;

    @Valid
    private List<ExposureTargetRequest> exposureTargets;

    private ThresholdsRequest thresholds;
}
