package com.liquidityledger.staking;

import com.liquidityledger.domain.StakePosition;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A position with its target's display name and the rewards it could claim now.
 *
 * @param targetName staking pool name, or the validator id for delegations
 */
public record StakePositionView(StakePosition position, String targetName, Map<String, BigDecimal> pendingRewards) {

    public StakePositionView {
        pendingRewards = Map.copyOf(pendingRewards);
    }
}
