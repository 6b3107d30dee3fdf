package com.dfsoptimizer.domain.enums;

public enum ContestType {
    GPP,
    CASH
}
