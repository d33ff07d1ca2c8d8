package com.tradingagents.analysis.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * TTL-keyed memoizer for expensive fetches. Each entry carries its own time-to-live.
 *
 * <p>Only successful values are stored; an erroring or empty factory leaves the key absent
 * so the next caller tries again.
 */
public class TtlCache {

    private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

    private record Entry(Object value, Duration ttl) {}

    private final Cache<String, Entry> cache;

    public TtlCache(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    public TtlCache(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .ticker(ticker)
            .executor(Runnable::run)
            .expireAfter(new Expiry<String, Entry>() {
                @Override
                public long expireAfterCreate(String key, Entry entry, long currentTime) {
                    return entry.ttl().toNanos();
                }

                @Override
                public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                    return entry.ttl().toNanos();
                }

                @Override
                public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                    return currentDuration;
                }
            })
            .build();
    }

    @SuppressWarnings("unchecked")
    public <T> Mono<T> get(String key, Supplier<Mono<T>> factory, long ttlMinutes) {
        if (ttlMinutes <= 0) {
            return Mono.defer(factory);
        }
        Entry hit = cache.getIfPresent(key);
        if (hit != null) {
            log.debug("CACHE_HIT key={}", key);
            return Mono.just((T) hit.value());
        }
        return Mono.defer(factory)
            .doOnNext(value -> {
                cache.put(key, new Entry(value, Duration.ofMinutes(ttlMinutes)));
                log.debug("CACHE_REFRESH key={} ttlMinutes={}", key, ttlMinutes);
            });
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
