package com.liquidityledger.pricing;

import com.liquidityledger.domain.Token;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registered tokens and their USD prices, keyed by address. Default {@link PriceOracle}: prices are refreshed
 * out-of-band through {@link #updatePrice(String, BigDecimal)}.
 */
@Component
@Slf4j
public class TokenRegistry implements PriceOracle {

    private final Map<String, Token> tokens = new ConcurrentHashMap<>();

    public Token register(String address, String symbol, String name, int decimals, BigDecimal totalSupply,
                          BigDecimal priceUsd) {
        if (address == null || address.isBlank()) {
            throw new TokenRegistryException(TokenRegistryException.INVALID_TOKEN, "Token address is required");
        }
        if (!address.equals(address.strip())) {
            throw new TokenRegistryException(TokenRegistryException.INVALID_TOKEN,
                    "Token address has surrounding whitespace: '" + address + "'");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new TokenRegistryException(TokenRegistryException.INVALID_TOKEN, "Token symbol is required: " + address);
        }
        if (decimals < 0) {
            throw new TokenRegistryException(TokenRegistryException.INVALID_TOKEN, "Negative decimals for " + address);
        }
        if (priceUsd == null || priceUsd.signum() < 0) {
            throw new TokenRegistryException(TokenRegistryException.INVALID_TOKEN, "Invalid price for " + address);
        }
        if (totalSupply != null && totalSupply.signum() < 0) {
            throw new TokenRegistryException(TokenRegistryException.INVALID_TOKEN, "Negative total supply for " + address);
        }
        Token token = new Token(address, symbol.strip(), name != null ? name : symbol.strip(), decimals,
                totalSupply != null ? totalSupply : BigDecimal.ZERO, priceUsd);
        tokens.put(address, token);
        log.info("Registered token {} ({}) at {} USD", token.symbol(), address, priceUsd);
        return token;
    }

    public Optional<Token> find(String address) {
        return address == null ? Optional.empty() : Optional.ofNullable(tokens.get(address));
    }

    public Token get(String address) {
        return find(address).orElseThrow(() -> new TokenRegistryException(
                TokenRegistryException.INVALID_TOKEN, "Token not registered: " + address));
    }

    public boolean isRegistered(String address) {
        return find(address).isPresent();
    }

    public Token updatePrice(String address, BigDecimal priceUsd) {
        if (priceUsd == null || priceUsd.signum() < 0) {
            throw new TokenRegistryException(TokenRegistryException.INVALID_TOKEN, "Invalid price for " + address);
        }
        Token updated = tokens.computeIfPresent(address, (k, existing) -> existing.withPrice(priceUsd));
        if (updated == null) {
            throw new TokenRegistryException(TokenRegistryException.INVALID_TOKEN, "Token not registered: " + address);
        }
        log.debug("Price of {} updated to {}", updated.symbol(), priceUsd);
        return updated;
    }

    /** Throws INVALID_TOKEN for the first unregistered address. */
    public void requireRegistered(Collection<String> addresses) {
        for (String address : addresses) {
            get(address);
        }
    }

    @Override
    public BigDecimal priceOf(String tokenAddress) {
        return get(tokenAddress).priceUsd();
    }

    public List<Token> listTokens() {
        return List.copyOf(tokens.values());
    }

    public int size() {
        return tokens.size();
    }
}
