package com.liquidityledger.governance;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One voter's ballot, weighted by the voter's governance power when it was cast.
 */
public record Ballot(String voter, VoteChoice choice, BigDecimal weight, Instant castAt) {
}
