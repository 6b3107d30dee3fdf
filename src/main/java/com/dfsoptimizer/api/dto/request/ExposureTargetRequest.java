package com.dfsoptimizer.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExposureTargetRequest {

    @NotBlank
    private String playerId;

    private Double minExposure;
    private Double maxExposure;
}
