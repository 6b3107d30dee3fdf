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
public class PresetResponse {

    private String name;
    private String site;
    private String sport;
    private int salaryCap;
    private List<Slot> slots;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Slot {
        private String name;
        private List<String> eligiblePositions;
        private boolean flex;
    }
}
