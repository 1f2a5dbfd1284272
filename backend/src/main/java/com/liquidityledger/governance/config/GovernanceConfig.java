package com.liquidityledger.governance.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(GovernanceProperties.class)
public class GovernanceConfig {
}
