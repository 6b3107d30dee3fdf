package com.dfsoptimizer.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorrelationRequest {

    @NotBlank
    private String playerA;

    @NotBlank
    private String playerB;

    @NotNull
    private Double coefficient;
}
