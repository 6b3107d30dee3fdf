package com.dfsoptimizer.domain.enums;

public enum ExposureStatus {
    WITHIN,
    UNDER,
    OVER
}
