package com.liquidityledger.domain;

/**
 * Operational status of a liquidity pool. Only ACTIVE pools accept deposits and swaps.
 */
public enum PoolStatus {
    ACTIVE,
    PAUSED,
    EMERGENCY_PAUSED,
    MIGRATING,
    DEPRECATED
}
