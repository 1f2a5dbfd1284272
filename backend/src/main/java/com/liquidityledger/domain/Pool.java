package com.liquidityledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Liquidity pool state. Mutated only by the AMM ledger while holding the pool's lock; callers get {@link #snapshot()}.
 * Reserve keys always equal {@code tokens}; lpSupply is never negative.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Pool {

    @EqualsAndHashCode.Include
    private String id;
    private String name;
    private PoolKind kind;
    private PoolStatus status;
    private List<String> tokens = List.of();
    private Map<String, BigDecimal> reserves = new LinkedHashMap<>();
    private BigDecimal lpSupply = BigDecimal.ZERO;
    private BigDecimal swapFeeRate;
    private BigDecimal volumeUsd = BigDecimal.ZERO;
    private BigDecimal feesCollectedUsd = BigDecimal.ZERO;
    private Map<String, BigDecimal> protocolFeesCollected = new LinkedHashMap<>();
    /** Cumulative USD fees per LP unit; positions settle against it. */
    private BigDecimal feePerShareUsd = BigDecimal.ZERO;
    private Instant createdAt;
    private Instant updatedAt;

    public BigDecimal reserveOf(String token) {
        return reserves.getOrDefault(token, BigDecimal.ZERO);
    }

    public boolean containsToken(String token) {
        return tokens.contains(token);
    }

    public boolean isActive() {
        return status == PoolStatus.ACTIVE;
    }

    public Pool snapshot() {
        Pool copy = new Pool();
        copy.id = id;
        copy.name = name;
        copy.kind = kind;
        copy.status = status;
        copy.tokens = List.copyOf(tokens);
        copy.reserves = new LinkedHashMap<>(reserves);
        copy.lpSupply = lpSupply;
        copy.swapFeeRate = swapFeeRate;
        copy.volumeUsd = volumeUsd;
        copy.feesCollectedUsd = feesCollectedUsd;
        copy.protocolFeesCollected = new LinkedHashMap<>(protocolFeesCollected);
        copy.feePerShareUsd = feePerShareUsd;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }
}
