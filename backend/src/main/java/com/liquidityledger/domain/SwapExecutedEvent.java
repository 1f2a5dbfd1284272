package com.liquidityledger.domain;

import java.time.Instant;

/**
 * Application event: a swap was executed and appended to the pool's history.
 */
public record SwapExecutedEvent(SwapRecord swap) implements LedgerEvent {

    @Override
    public String aggregateId() {
        return swap.poolId();
    }

    @Override
    public Instant occurredAt() {
        return swap.timestamp();
    }
}
