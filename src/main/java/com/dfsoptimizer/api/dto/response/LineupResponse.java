package com.dfsoptimizer.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineupResponse {

    private String lineupId;
    private int generationIndex;
    private List<SlotResponse> slots;
    private int totalSalary;
    private double totalProjection;
    private double totalOwnership;
    private double objectiveValue;

    /** Stack classification, e.g. "QB+2 Stack (KC)". */
    private String stackType;
}
