package com.liquidityledger.staking.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Staking ledger config. Stake bounds apply when a staking pool is created without its own.
 */
@ConfigurationProperties(prefix = "liquidityledger.staking")
@NoArgsConstructor
@Getter
@Setter
public class StakingProperties {

    private BigDecimal defaultMinStake = new BigDecimal("10");

    private BigDecimal defaultMaxStake = new BigDecimal("10000000");

    /** Fraction of the withdrawn amount charged when a fixed-term stake leaves before its unlock time. */
    private BigDecimal earlyWithdrawalPenalty = new BigDecimal("0.02");

    /** Lock applied to validator delegations. */
    private Duration unbondingPeriod = Duration.ofDays(21);

    /** Base APY for delegation positions, before the delegation multiplier. */
    private BigDecimal delegationApy = new BigDecimal("0.05");

    /** Token in which delegation rewards accrue. */
    private String delegationRewardToken = "NATIVE";
}
