package com.sharecost.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sharecost.jwt")
public record JwtProperties(String secret, String issuer, long ttlDays) {}
