package com.liquidityledger.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Application event: pool reserves, LP supply or status changed.
 * Consumed by analytics (cache eviction) and audit.
 */
public record PoolUpdatedEvent(String poolId, PoolStatus status, Map<String, BigDecimal> reserves,
                               BigDecimal lpSupply, String reason, Instant occurredAt) implements LedgerEvent {

    @Override
    public String aggregateId() {
        return poolId;
    }
}
