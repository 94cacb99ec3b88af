package com.homesplit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "homesplit.jwt")
public record JwtProperties(String secret, String issuer) {}
