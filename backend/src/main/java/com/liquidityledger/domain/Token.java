package com.liquidityledger.domain;

import java.math.BigDecimal;

/**
 * Registered token. Immutable; a price refresh replaces the instance via {@link #withPrice(BigDecimal)}.
 */
public record Token(String address, String symbol, String name, int decimals, BigDecimal totalSupply,
                    BigDecimal priceUsd) {

    public Token withPrice(BigDecimal newPriceUsd) {
        return new Token(address, symbol, name, decimals, totalSupply, newPriceUsd);
    }

    public BigDecimal valueUsd(BigDecimal amount) {
        return amount.multiply(priceUsd);
    }
}
