package com.liquidityledger.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DecimalsTest {

    @Test
    @DisplayName("divide uses 28 significant digits HALF_EVEN")
    void divideRoundsToContext() {
        BigDecimal third = Decimals.divide(BigDecimal.ONE, BigDecimal.valueOf(3));
        assertThat(third.precision()).isEqualTo(28);
        assertThat(third).isEqualByComparingTo("0.3333333333333333333333333333");
    }

    @Test
    @DisplayName("square root of a perfect square is exact")
    void squareRoot() {
        assertThat(Decimals.nthRoot(new BigDecimal("10000000000"), 2)).isEqualByComparingTo("100000");
    }

    @Test
    @DisplayName("cube and higher roots converge")
    void higherRoots() {
        assertThat(Decimals.nthRoot(new BigDecimal("27"), 3)).isCloseTo(new BigDecimal("3"), within(new BigDecimal("1e-20")));
        assertThat(Decimals.nthRoot(new BigDecimal("1e12"), 4)).isCloseTo(new BigDecimal("1000"), within(new BigDecimal("1e-18")));
        assertThat(Decimals.nthRoot(new BigDecimal("2"), 5))
                .isCloseTo(new BigDecimal("1.148698354997035006798626946"), within(new BigDecimal("1e-24")));
    }

    @Test
    @DisplayName("roots of values beyond double range stay exact")
    void rootsOutsideDoubleRange() {
        BigDecimal huge = new BigDecimal("1e400");
        BigDecimal tiny = new BigDecimal("1e-400");

        BigDecimal hugeRoot = Decimals.nthRoot(huge, 3);
        BigDecimal tinyRoot = Decimals.nthRoot(tiny, 3);

        assertThat(Decimals.divide(hugeRoot.pow(3), huge)).isCloseTo(BigDecimal.ONE, within(new BigDecimal("1e-20")));
        assertThat(Decimals.divide(tinyRoot.pow(3), tiny)).isCloseTo(BigDecimal.ONE, within(new BigDecimal("1e-20")));
        assertThat(Decimals.nthRoot(new BigDecimal("1e800"), 4))
                .isCloseTo(new BigDecimal("1e200"), within(new BigDecimal("1e175")));
    }

    @Test
    @DisplayName("root of zero is zero; first root is the value itself")
    void trivialRoots() {
        assertThat(Decimals.nthRoot(BigDecimal.ZERO, 3)).isEqualByComparingTo("0");
        assertThat(Decimals.nthRoot(new BigDecimal("42.5"), 1)).isEqualByComparingTo("42.5");
    }

    @Test
    void rejectsNegativeValueAndDegree() {
        assertThatThrownBy(() -> Decimals.nthRoot(new BigDecimal("-1"), 2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Decimals.nthRoot(BigDecimal.TEN, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void signHelpersTreatNullAsNotSigned() {
        assertThat(Decimals.isPositive(null)).isFalse();
        assertThat(Decimals.isNegative(null)).isFalse();
        assertThat(Decimals.isPositive(BigDecimal.ONE)).isTrue();
        assertThat(Decimals.isNegative(BigDecimal.ONE.negate())).isTrue();
        assertThat(Decimals.orZero(null)).isEqualByComparingTo("0");
    }
}
