package com.liquidityledger.amm;

import com.liquidityledger.domain.PoolKind;
import com.liquidityledger.domain.PoolStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time pool metrics. Windowed figures cover the configured analytics window (24h by default).
 *
 * @param feeApyPct  fees in window annualised over TVL, in percent
 * @param volatility population std-dev of relative changes between successive execution prices
 */
public record PoolAnalytics(
        String poolId,
        String name,
        PoolKind kind,
        PoolStatus status,
        Map<String, BigDecimal> reserves,
        BigDecimal lpSupply,
        BigDecimal swapFeeRate,
        BigDecimal tvlUsd,
        BigDecimal volumeUsd,
        BigDecimal feesUsd,
        BigDecimal feeApyPct,
        BigDecimal volatility,
        long providerCount,
        int swapCount,
        Instant updatedAt) {

    public PoolAnalytics {
        reserves = Map.copyOf(reserves);
    }
}
