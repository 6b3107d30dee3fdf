package com.dfsoptimizer.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotResponse {

    private String slot;
    private String playerId;
    private String name;
    private String team;
    private int salary;
    private double projection;
    private double ownership;
}
