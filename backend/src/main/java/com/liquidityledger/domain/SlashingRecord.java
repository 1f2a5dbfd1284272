package com.liquidityledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Outcome of one slash: what was removed from the validator and from its delegations.
 */
public record SlashingRecord(
        String validatorId,
        BigDecimal penaltyPct,
        String reason,
        BigDecimal validatorPenalty,
        BigDecimal delegatorPenalty,
        int affectedDelegations,
        Instant timestamp) {
}
