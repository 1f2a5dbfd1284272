package com.liquidityledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Executed swap. Append-only.
 *
 * @param priceImpactPct fraction, e.g. 0.05 for 5%
 * @param feePaid        swap fee in units of tokenIn (includes the protocol share)
 * @param slippagePct    (minAmountOut - amountOut) / minAmountOut, zero when no minimum was given
 */
public record SwapRecord(
        String id,
        String poolId,
        String trader,
        String tokenIn,
        String tokenOut,
        BigDecimal amountIn,
        BigDecimal amountOut,
        BigDecimal priceImpactPct,
        BigDecimal feePaid,
        BigDecimal protocolFeePaid,
        BigDecimal slippagePct,
        BigDecimal tradeValueUsd,
        Instant timestamp) {
}
