package com.liquidityledger.staking;

import com.liquidityledger.domain.StakeStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Outcome of an unstake. Pending rewards are reported only; they stay claimable while the position is ACTIVE.
 *
 * @param finalAmount withdrawnAmount minus penalty
 */
public record UnstakeResult(
        String stakeId,
        BigDecimal withdrawnAmount,
        BigDecimal penalty,
        boolean earlyWithdrawal,
        BigDecimal finalAmount,
        BigDecimal remainingAmount,
        StakeStatus status,
        Map<String, BigDecimal> pendingRewards,
        Instant timestamp) {
}
