package com.liquidityledger.domain;

import java.math.BigDecimal;

/**
 * Staking mechanism, with its base reward multiplier.
 */
public enum StakeKind {
    FLEXIBLE("1.0"),
    FIXED_TERM("1.5"),
    LIQUIDITY_MINING("2.0"),
    GOVERNANCE("1.2"),
    VALIDATOR_DELEGATION("3.0"),
    YIELD_FARMING("2.5");

    private final BigDecimal multiplier;

    StakeKind(String multiplier) {
        this.multiplier = new BigDecimal(multiplier);
    }

    public BigDecimal multiplier() {
        return multiplier;
    }
}
