package com.liquidityledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Validator node. delegatedStake tracks the sum of its delegation positions; both are mutated under the
 * validator's lock only.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ValidatorNode {

    @EqualsAndHashCode.Include
    private String id;
    private String operator;
    private BigDecimal selfStake;
    private BigDecimal commissionRate;
    private BigDecimal performanceScore = BigDecimal.ONE;
    private int slashCount;
    private BigDecimal delegatedStake = BigDecimal.ZERO;
    private ValidatorStatus status = ValidatorStatus.ACTIVE;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean isActive() {
        return status == ValidatorStatus.ACTIVE;
    }

    public ValidatorNode snapshot() {
        ValidatorNode copy = new ValidatorNode();
        copy.id = id;
        copy.operator = operator;
        copy.selfStake = selfStake;
        copy.commissionRate = commissionRate;
        copy.performanceScore = performanceScore;
        copy.slashCount = slashCount;
        copy.delegatedStake = delegatedStake;
        copy.status = status;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }
}
