package com.dfsoptimizer.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThresholdsRequest {

    private Double maxDuplicateRisk;
    private Double minLeverage;
    private Double minRoi;
    private Double maxTotalOwnership;
    private Double minWinProbability;
}
