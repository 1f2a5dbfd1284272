package com.liquidityledger.staking;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Reward bonus for locking a stake. Only the listed lock lengths earn a bonus; any other length gets 1.0.
 */
public final class LockBonusSchedule {

    private static final Map<Integer, BigDecimal> BONUS_BY_DAYS = Map.of(
            30, new BigDecimal("1.1"),
            90, new BigDecimal("1.3"),
            180, new BigDecimal("1.6"),
            365, new BigDecimal("2.0"));

    private LockBonusSchedule() {
    }

    public static BigDecimal bonusFor(int lockDays) {
        return BONUS_BY_DAYS.getOrDefault(lockDays, BigDecimal.ONE);
    }
}
