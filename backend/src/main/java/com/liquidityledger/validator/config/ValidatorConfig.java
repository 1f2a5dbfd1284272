package com.liquidityledger.validator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ValidatorProperties.class)
public class ValidatorConfig {
}
