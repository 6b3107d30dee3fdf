package com.dfsoptimizer.domain.model;

import com.dfsoptimizer.domain.enums.CorrelationReason;
import lombok.Builder;
import lombok.Getter;

/** Pairwise outcome correlation between two players, with a tag explaining where it came from. */
@Getter
@Builder
public class CorrelationEntry {

    private final String playerA;
    private final String playerB;
    private final double coefficient;

    @Builder.Default
    private final CorrelationReason reason = CorrelationReason.MANUAL;

    public static CorrelationEntry of(String playerA, String playerB, double coefficient, CorrelationReason reason) {
        return CorrelationEntry.builder()
                .playerA(playerA)
                .playerB(playerB)
                .coefficient(coefficient)
                .reason(reason)
                .build();
    }

    @Override
    public String toString() {
        return playerA + "~" + playerB + "=" + coefficient + " (" + reason + ")";
    }
}
