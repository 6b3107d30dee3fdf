package com.dfsoptimizer.api.dto.request;

import com.dfsoptimizer.domain.enums.ObjectiveType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Optimizer request. Unset options fall back to the {@code dfs.optimizer} defaults. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizeRequest {

    @NotEmpty
    @Valid
    private List<PlayerRequest> players;

    @NotNull
    @Valid
    private ConstraintsRequest constraints;

    @Min(1)
    private Integer lineupCount;

    private ObjectiveType objective;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double jitterPercent;

    private Long seed;
}
