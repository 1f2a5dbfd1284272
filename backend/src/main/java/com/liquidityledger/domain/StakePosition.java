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
 * A staking position. For VALIDATOR_DELEGATION positions {@code poolId} is the target validator id.
 * Never deleted; a fully withdrawn position keeps status WITHDRAWN.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class StakePosition {

    @EqualsAndHashCode.Include
    private String id;
    private String owner;
    private String poolId;
    private BigDecimal amount;
    private StakeKind kind;
    private StakeStatus status;
    private BigDecimal multiplier = BigDecimal.ONE;
    private Instant stakeTime;
    private Instant unlockTime;
    private Instant lastClaimTime;
    private Map<String, BigDecimal> accruedRewards = new LinkedHashMap<>();
    private BigDecimal penaltyApplied = BigDecimal.ZERO;
    private BigDecimal governancePower = BigDecimal.ZERO;

    public boolean isActive() {
        return status == StakeStatus.ACTIVE;
    }

    public boolean isDelegation() {
        return kind == StakeKind.VALIDATOR_DELEGATION;
    }

    public StakePosition snapshot() {
        StakePosition copy = new StakePosition();
        copy.id = id;
        copy.owner = owner;
        copy.poolId = poolId;
        copy.amount = amount;
        copy.kind = kind;
        copy.status = status;
        copy.multiplier = multiplier;
        copy.stakeTime = stakeTime;
        copy.unlockTime = unlockTime;
        copy.lastClaimTime = lastClaimTime;
        copy.accruedRewards = new LinkedHashMap<>(accruedRewards);
        copy.penaltyApplied = penaltyApplied;
        copy.governancePower = governancePower;
        return copy;
    }
}
