package com.liquidityledger.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Application event: rewards claimed on a stake position (token to amount).
 */
public record RewardClaimedEvent(String stakeId, String owner, Map<String, BigDecimal> rewards,
                                 Instant occurredAt) implements LedgerEvent {

    @Override
    public String aggregateId() {
        return stakeId;
    }
}
