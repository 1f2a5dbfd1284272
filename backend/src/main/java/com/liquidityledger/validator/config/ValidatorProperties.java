package com.liquidityledger.validator.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Validator registration and slashing rules.
 */
@ConfigurationProperties(prefix = "liquidityledger.validator")
@NoArgsConstructor
@Getter
@Setter
public class ValidatorProperties {

    /** Minimum operator self-stake to register a validator. */
    private BigDecimal minSelfStake = new BigDecimal("32");

    /** Highest commission a validator may charge (fraction). */
    private BigDecimal maxCommissionRate = new BigDecimal("0.20");

    /** Performance score is multiplied by this on every slash. */
    private BigDecimal slashPerformanceFactor = new BigDecimal("0.9");
}
