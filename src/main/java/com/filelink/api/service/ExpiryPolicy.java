package com.filelink.api.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * How long a new file stays downloadable.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExpiryPolicy {

    Duration lifetime;

    public static ExpiryPolicy ofDays(int days) {
        return of(Duration.ofDays(days));
    }

    public static ExpiryPolicy of(Duration lifetime) {
        if (lifetime == null || lifetime.isZero() || lifetime.isNegative()) {
            throw new IllegalArgumentException("Expiry must be after creation");
        }
        return new ExpiryPolicy(lifetime);
    }

    public LocalDateTime expiryFrom(LocalDateTime createdAt) {
        return createdAt.plus(lifetime);
    }
}
