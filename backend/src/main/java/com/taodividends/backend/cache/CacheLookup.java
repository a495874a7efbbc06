package com.taodividends.backend.cache;

import java.math.BigInteger;

/**
 * A dividend value and whether it was served from the cache.
 */
public record CacheLookup(BigInteger value, boolean cached) {
}
