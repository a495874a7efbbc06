package com.taodividends.backend.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store behind the dividend cache. Implementations may drop entries at any time;
 * freshness is decided by the caller from {@link CachedDividend#expiresAt()}.
 */
public interface DividendCacheStore {

    Optional<CachedDividend> get(String fingerprint);

    void put(String fingerprint, CachedDividend entry, Duration ttl);

    void evict(String fingerprint);
}
