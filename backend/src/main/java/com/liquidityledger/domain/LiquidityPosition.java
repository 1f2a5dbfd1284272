package com.liquidityledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A provider's LP position in one pool. Owned by its provider; closed (not deleted) when lpAmount reaches zero.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LiquidityPosition {

    public static final String USD = "USD";

    @EqualsAndHashCode.Include
    private String id;
    private String provider;
    private String poolId;
    private Map<String, BigDecimal> tokenAmounts = new LinkedHashMap<>();
    private BigDecimal lpAmount = BigDecimal.ZERO;
    private Instant entryTime;
    private Map<String, BigDecimal> feesEarned = new LinkedHashMap<>();
    private BigDecimal impermanentLossPct = BigDecimal.ZERO;
    private PositionStatus status = PositionStatus.ACTIVE;
    /** Pool fee-per-share value at the last settlement. */
    private BigDecimal feeCheckpoint = BigDecimal.ZERO;

    public boolean isActive() {
        return status == PositionStatus.ACTIVE;
    }

    public BigDecimal feesEarnedUsd() {
        return feesEarned.getOrDefault(USD, BigDecimal.ZERO);
    }

    public LiquidityPosition snapshot() {
        LiquidityPosition copy = new LiquidityPosition();
        copy.id = id;
        copy.provider = provider;
        copy.poolId = poolId;
        copy.tokenAmounts = new LinkedHashMap<>(tokenAmounts);
        copy.lpAmount = lpAmount;
        copy.entryTime = entryTime;
        copy.feesEarned = new LinkedHashMap<>(feesEarned);
        copy.impermanentLossPct = impermanentLossPct;
        copy.status = status;
        copy.feeCheckpoint = feeCheckpoint;
        return copy;
    }
}
