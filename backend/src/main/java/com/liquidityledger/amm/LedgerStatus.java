package com.liquidityledger.amm;

import java.math.BigDecimal;

/**
 * Ledger-wide AMM totals.
 */
public record LedgerStatus(
        int totalPools,
        int activePools,
        long activePositions,
        int totalSwaps,
        BigDecimal totalValueLockedUsd,
        int registeredTokens) {
}
