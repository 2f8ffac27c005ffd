package com.vigil.correlation.engine.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.vigil.correlation.api.model.Event;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * "Already handled" markers for repetitive fast-path traffic, keyed by
 * {@code fast:<eventType>:<source>:<user>}.
 *
 * <p>The time-to-live is read from the supplier when a marker is written, so
 * a runtime change of the cache expiration applies to new markers only.
 */
public final class FastPathCache {

    private static final String UNKNOWN_USER = "unknown";

    private final Cache<String, Boolean> cache;

    public FastPathCache(LongSupplier ttlMillis, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .expireAfter(new Expiry<String, Boolean>() {
                    @Override
                    public long expireAfterCreate(String key, Boolean value, long currentTime) {
                        return TimeUnit.MILLISECONDS.toNanos(ttlMillis.getAsLong());
                    }

                    @Override
                    public long expireAfterUpdate(String key, Boolean value, long currentTime,
                                                  long currentDuration) {
                        return TimeUnit.MILLISECONDS.toNanos(ttlMillis.getAsLong());
                    }

                    @Override
                    public long expireAfterRead(String key, Boolean value, long currentTime,
                                                long currentDuration) {
                        return currentDuration;
                    }
                })
                .ticker(ticker)
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    public static String key(Event event) {
        String user = event.userName() == null || event.userName().isBlank() ? UNKNOWN_USER : event.userName();
        return "fast:" + event.eventType() + ":" + event.source() + ":" + user;
    }

    public boolean isHandled(Event event) {
        return cache.getIfPresent(key(event)) != null;
    }

    public void markHandled(Event event) {
        cache.put(key(event), Boolean.TRUE);
    }

    public void sweep() {
        cache.cleanUp();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }
}
