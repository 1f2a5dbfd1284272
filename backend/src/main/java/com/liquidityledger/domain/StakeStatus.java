package com.liquidityledger.domain;

public enum StakeStatus {
    ACTIVE,
    UNBONDING,
    SLASHED,
    WITHDRAWN,
    LOCKED
}
