package com.liquidityledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Application event: a liquidity, stake or delegation position was opened.
 *
 * @param amount LP units minted for liquidity positions, staked amount otherwise
 */
public record PositionCreatedEvent(String positionId, PositionType type, String owner, String targetId,
                                   BigDecimal amount, Instant occurredAt) implements LedgerEvent {

    @Override
    public String aggregateId() {
        return positionId;
    }
}
