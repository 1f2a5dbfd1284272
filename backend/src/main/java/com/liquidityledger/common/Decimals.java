package com.liquidityledger.common;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Fixed-precision decimal helpers shared by the AMM and staking ledgers.
 * All divisions and roots run with 28 significant digits, HALF_EVEN, so repeated fee accrual does not drift.
 */
public final class Decimals {

    public static final MathContext MC = new MathContext(28, RoundingMode.HALF_EVEN);
    /** Truncating context for amounts paid out of a pool, so rounding never favours the taker. */
    public static final MathContext MC_DOWN = new MathContext(28, RoundingMode.DOWN);
    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    public static final BigDecimal SECONDS_PER_YEAR = BigDecimal.valueOf(365L * 24 * 3600);

    private static final MathContext WORKING = new MathContext(MC.getPrecision() + 10, RoundingMode.HALF_EVEN);
    private static final int MAX_ROOT_ITERATIONS = 200;

    private Decimals() {
    }

    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return dividend.divide(divisor, MC);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static boolean isNegative(BigDecimal value) {
        return value != null && value.signum() < 0;
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    /**
     * Principal n-th root of a non-negative value (Newton iteration, 28 significant digits).
     */
    public static BigDecimal nthRoot(BigDecimal value, int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("root degree must be positive, got: " + n);
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("root of negative value: " + value);
        }
        if (value.signum() == 0 || n == 1) {
            return value.round(MC);
        }
        if (n == 2) {
            return value.sqrt(MC);
        }
        BigDecimal degree = BigDecimal.valueOf(n);
        BigDecimal x = initialGuess(value, n);
        BigDecimal tolerance = BigDecimal.ONE.movePointLeft(MC.getPrecision() + 2);
        for (int i = 0; i < MAX_ROOT_ITERATIONS; i++) {
            BigDecimal power = x.pow(n - 1, WORKING);
            BigDecimal next = x.multiply(degree.subtract(BigDecimal.ONE), WORKING)
                    .add(value.divide(power, WORKING), WORKING)
                    .divide(degree, WORKING);
            BigDecimal delta = next.subtract(x, WORKING).abs();
            x = next;
            if (delta.compareTo(tolerance.multiply(x, WORKING)) <= 0) {
                return x.round(MC);
            }
        }
        throw new ArithmeticException("root of degree " + n + " did not converge for " + value);
    }

    /**
     * Double estimate where the value fits a double, otherwise a power of ten at or above the root taken
     * from the decimal exponent.
     */
    private static BigDecimal initialGuess(BigDecimal value, int n) {
        double approx = Math.pow(value.doubleValue(), 1.0 / n);
        if (Double.isNaN(approx) || Double.isInfinite(approx) || approx < Double.MIN_NORMAL) {
            int digits = value.precision() - value.scale();
            return BigDecimal.ONE.scaleByPowerOfTen(-Math.floorDiv(-digits, n));
        }
        return new BigDecimal(approx, WORKING);
    }
}
