package com.sharecost.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sharecost.app")
public record AppProperties(String frontendUrl, String defaultCurrency) {}
