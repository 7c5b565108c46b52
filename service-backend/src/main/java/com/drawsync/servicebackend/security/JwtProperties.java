package com.drawsync.servicebackend.security;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param secret     HMAC signing secret, at least 32 bytes
 * @param expiration token lifetime in milliseconds
 */
@ConfigurationProperties(prefix = "app.jwt")
public record JwtProperties(
        String secret,
        long expiration
) {
}
