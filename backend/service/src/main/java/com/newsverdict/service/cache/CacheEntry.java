package com.newsverdict.service.cache;

import java.time.Instant;
import java.util.Objects;

public record CacheEntry<V>(String key, V value, Instant expiresAt) {
    public CacheEntry {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(value, "value is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
    }

    public boolean isLiveAt(Instant now) {
        return now.isBefore(expiresAt);
    }
}
