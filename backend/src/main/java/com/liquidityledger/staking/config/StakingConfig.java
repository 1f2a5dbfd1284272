package com.liquidityledger.staking.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Staking module configuration: properties.
 */
@Configuration
@EnableConfigurationProperties(StakingProperties.class)
public class StakingConfig {
}
