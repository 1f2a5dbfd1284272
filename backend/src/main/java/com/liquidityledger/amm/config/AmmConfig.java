package com.liquidityledger.amm.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * AMM module configuration: properties.
 */
@Configuration
@EnableConfigurationProperties(AmmProperties.class)
public class AmmConfig {
}
