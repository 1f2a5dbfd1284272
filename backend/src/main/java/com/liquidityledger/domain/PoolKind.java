package com.liquidityledger.domain;

import com.liquidityledger.common.Decimals;

import java.math.BigDecimal;

/**
 * AMM curve of a pool. Each constant carries its own pricing function; the curve is fixed when the pool is created.
 */
public enum PoolKind {

    /** x * y = k. */
    CONSTANT_PRODUCT {
        @Override
        public BigDecimal amountOut(BigDecimal netAmountIn, BigDecimal reserveIn, BigDecimal reserveOut) {
            return netAmountIn.multiply(reserveOut).divide(reserveIn.add(netAmountIn), Decimals.MC_DOWN);
        }
    },

    /**
     * Simplified stable-swap approximation for correlated assets: the constant-product share of the trade
     * damped by the amplification term. Not the full StableSwap invariant.
     */
    STABLE_SWAP {
        @Override
        public BigDecimal amountOut(BigDecimal netAmountIn, BigDecimal reserveIn, BigDecimal reserveOut) {
            BigDecimal share = Decimals.divide(netAmountIn, reserveIn.add(netAmountIn));
            BigDecimal damping = BigDecimal.ONE.subtract(Decimals.divide(share, AMPLIFICATION));
            return reserveOut.multiply(share).multiply(damping).round(Decimals.MC_DOWN);
        }
    };

    public static final BigDecimal AMPLIFICATION = BigDecimal.valueOf(100);

    /**
     * Output amount for an input already net of the swap fee, truncated to 28 significant digits.
     */
    public abstract BigDecimal amountOut(BigDecimal netAmountIn, BigDecimal reserveIn, BigDecimal reserveOut);
}
