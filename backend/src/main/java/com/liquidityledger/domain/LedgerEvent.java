package com.liquidityledger.domain;

import java.time.Instant;

/**
 * Application event emitted by a ledger after a committed state change.
 * Published once the owning entity's lock is released; the audit module persists every instance.
 */
public interface LedgerEvent {

    /** Id of the pool, position or validator the event is about. */
    String aggregateId();

    Instant occurredAt();
}
