package com.liquidityledger.domain;

public enum PositionStatus {
    ACTIVE,
    /** LP balance reached zero; kept for audit history. */
    CLOSED
}
