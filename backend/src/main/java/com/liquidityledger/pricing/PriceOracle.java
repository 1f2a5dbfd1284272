package com.liquidityledger.pricing;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * USD price lookup consumed by the ledgers. Implementations must answer from memory: ledgers call it before
 * taking any entity lock.
 */
public interface PriceOracle {

    /**
     * Current USD price of a registered token.
     *
     * @throws TokenRegistryException INVALID_TOKEN when the token is unknown
     */
    BigDecimal priceOf(String tokenAddress);

    /** Prices for all given tokens, in iteration order. Fails on the first unknown token. */
    default Map<String, BigDecimal> pricesFor(Collection<String> tokenAddresses) {
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        for (String token : tokenAddresses) {
            prices.put(token, priceOf(token));
        }
        return prices;
    }
}
