package com.liquidityledger.amm;

import java.math.BigDecimal;

/**
 * Pricing of a prospective swap against current reserves. Produced without touching the pool.
 *
 * @param feePaid        total swap fee in tokenIn units
 * @param protocolFee    part of feePaid kept out of the pool
 * @param priceImpactPct fraction, e.g. 0.0928
 */
public record SwapQuote(
        String poolId,
        String tokenIn,
        String tokenOut,
        BigDecimal amountIn,
        BigDecimal amountOut,
        BigDecimal feePaid,
        BigDecimal protocolFee,
        BigDecimal priceImpactPct) {
}
