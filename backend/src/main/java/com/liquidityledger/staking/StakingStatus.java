package com.liquidityledger.staking;

import java.math.BigDecimal;

/**
 * Ledger-wide staking totals.
 */
public record StakingStatus(
        int totalPools,
        BigDecimal totalStaked,
        BigDecimal totalRewardsDistributed,
        int totalPositions,
        int totalValidators,
        long activeValidators) {
}
