package com.taodividends.backend.cache;

import java.math.BigInteger;
import java.time.Instant;

public record CachedDividend(BigInteger value, Instant storedAt, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
