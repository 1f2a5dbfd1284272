package com.liquidityledger.staking;

import com.liquidityledger.common.Decimals;
import com.liquidityledger.domain.StakePosition;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Linear reward accrual since the position's last claim:
 * {@code amount * apy * multiplier * elapsedSeconds / 31_536_000}, split evenly over the reward tokens.
 */
@Component
public class RewardCalculator {

    public Map<String, BigDecimal> accrued(StakePosition position, BigDecimal apy, List<String> rewardTokens,
                                           Instant now) {
        Map<String, BigDecimal> rewards = new LinkedHashMap<>();
        if (rewardTokens.isEmpty()) {
            return rewards;
        }
        BigDecimal elapsed = elapsedSeconds(position.getLastClaimTime(), now);
        BigDecimal total = Decimals.divide(
                position.getAmount().multiply(apy).multiply(position.getMultiplier()).multiply(elapsed),
                Decimals.SECONDS_PER_YEAR);
        BigDecimal perToken = Decimals.divide(total, BigDecimal.valueOf(rewardTokens.size()));
        for (String token : rewardTokens) {
            rewards.merge(token, perToken, BigDecimal::add);
        }
        return rewards;
    }

    static BigDecimal elapsedSeconds(Instant from, Instant to) {
        if (from == null || !to.isAfter(from)) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(Duration.between(from, to).toMillis()).movePointLeft(3);
    }
}
