package com.liquidityledger.staking;

import com.liquidityledger.domain.StakeKind;

import java.math.BigDecimal;
import java.util.List;

/**
 * @param apyPct       pool APY in percent
 * @param activeStakers ACTIVE positions in the pool
 * @param averageStake totalStaked / activeStakers, zero without stakers
 */
public record StakingPoolAnalytics(
        String poolId,
        String name,
        StakeKind kind,
        String stakingToken,
        List<String> rewardTokens,
        BigDecimal totalStaked,
        BigDecimal totalRewardsDistributed,
        BigDecimal apyPct,
        long activeStakers,
        BigDecimal averageStake,
        BigDecimal minStake,
        BigDecimal maxStake,
        int lockPeriodDays,
        boolean active) {

    public StakingPoolAnalytics {
        rewardTokens = List.copyOf(rewardTokens);
    }
}
