package com.liquidityledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Staking pool definition and running totals. Mutated under the staking pool's lock.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class StakingPool {

    @EqualsAndHashCode.Include
    private String id;
    private String name;
    private String stakingToken;
    private List<String> rewardTokens = List.of();
    private StakeKind kind;
    private BigDecimal apy;
    private int lockPeriodDays;
    private BigDecimal minStake;
    private BigDecimal maxStake;
    private boolean active = true;
    private BigDecimal totalStaked = BigDecimal.ZERO;
    private BigDecimal totalRewardsDistributed = BigDecimal.ZERO;
    private Instant createdAt;
    private Instant updatedAt;

    public StakingPool snapshot() {
        StakingPool copy = new StakingPool();
        copy.id = id;
        copy.name = name;
        copy.stakingToken = stakingToken;
        copy.rewardTokens = List.copyOf(rewardTokens);
        copy.kind = kind;
        copy.apy = apy;
        copy.lockPeriodDays = lockPeriodDays;
        copy.minStake = minStake;
        copy.maxStake = maxStake;
        copy.active = active;
        copy.totalStaked = totalStaked;
        copy.totalRewardsDistributed = totalRewardsDistributed;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }
}
