package com.newsverdict.service.cache;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Bounded key/value cache where every entry carries its own expiry instant.
 *
 * <p>Time comes from the injected {@link Clock}, so tests can move it. An entry at or past its
 * {@code expiresAt} is never returned. {@link #getOrCompute} runs the loader at most once per key
 * at a time, on the calling thread and outside any map lock, so a slow load never holds up other
 * keys. A loader that throws leaves nothing behind.
 */
public final class ResponseCache<V> {
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final long DEFAULT_MAXIMUM_SIZE = 1_000;

    private final Clock clock;
    private final Duration defaultTtl;
    private final AsyncCache<String, CacheEntry<V>> cache;

    public ResponseCache(Clock clock) {
        this(clock, DEFAULT_TTL, DEFAULT_MAXIMUM_SIZE);
    }

    public ResponseCache(Clock clock, Duration defaultTtl, long maximumSize) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.defaultTtl = requirePositive(defaultTtl);
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .expireAfter(new EntryExpiry<V>(clock))
                .buildAsync();
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    public Optional<V> get(String key) {
        CompletableFuture<CacheEntry<V>> pending = cache.getIfPresent(key);
        if (pending == null || !pending.isDone() || pending.isCompletedExceptionally()) {
            return Optional.empty();
        }
        CacheEntry<V> entry = pending.join();
        if (!entry.isLiveAt(clock.instant())) {
            cache.asMap().remove(key, pending);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public void put(String key, V value) {
        put(key, value, defaultTtl);
    }

    public void put(String key, V value, Duration ttl) {
        cache.put(key, CompletableFuture.completedFuture(
                new CacheEntry<>(key, value, clock.instant().plus(requirePositive(ttl)))));
    }

    public V getOrCompute(String key, Supplier<V> loader) {
        return getOrCompute(key, defaultTtl, loader);
    }

    public V getOrCompute(String key, Duration ttl, Supplier<V> loader) {
        Objects.requireNonNull(loader, "loader is required");
        Duration entryTtl = requirePositive(ttl);
        CompletableFuture<CacheEntry<V>> owned = new CompletableFuture<>();
        CompletableFuture<CacheEntry<V>> pending = cache.get(key, (k, executor) -> owned);
        if (pending == owned) {
            load(key, entryTtl, loader, owned);
        }
        CacheEntry<V> entry = await(pending);
        if (entry.isLiveAt(clock.instant())) {
            return entry.value();
        }
        cache.asMap().remove(key, pending);
        return getOrCompute(key, ttl, loader);
    }

    public void invalidateAll() {
        cache.synchronous().invalidateAll();
    }

    public long size() {
        cache.synchronous().cleanUp();
        return cache.synchronous().estimatedSize();
    }

    // A failed future is dropped from the map by the cache itself.
    private void load(String key, Duration ttl, Supplier<V> loader, CompletableFuture<CacheEntry<V>> target) {
        try {
            target.complete(new CacheEntry<>(key, loader.get(), clock.instant().plus(ttl)));
        } catch (RuntimeException | Error ex) {
            target.completeExceptionally(ex);
        }
    }

    private static <V> CacheEntry<V> await(CompletableFuture<CacheEntry<V>> pending) {
        try {
            return pending.join();
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw ex;
        }
    }

    private static Duration requirePositive(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl is required");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        return ttl;
    }

    private static final class EntryExpiry<V> implements Expiry<String, CacheEntry<V>> {
        private final Clock clock;

        private EntryExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, CacheEntry<V> entry, long currentTime) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry<V> entry, long currentTime, long currentDuration) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry<V> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(CacheEntry<V> entry) {
            return Math.max(0L, Duration.between(clock.instant(), entry.expiresAt()).toNanos());
        }
    }
}
