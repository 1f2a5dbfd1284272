package com.liquidityledger.domain;

import java.time.Instant;

public record ValidatorSlashedEvent(SlashingRecord slashing) implements LedgerEvent {

    @Override
    public String aggregateId() {
        return slashing.validatorId();
    }

    @Override
    public Instant occurredAt() {
        return slashing.timestamp();
    }
}
