package org.perles.engine.cache;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Read-through cache with a per-entry time to live, backed by Caffeine.
 *
 * Concurrent misses on the same key run the loader once; the other callers wait for
 * that result. The loader runs on the calling thread outside Caffeine's compute, so a
 * slow load never blocks writes to other keys. A loader that throws caches nothing and
 * the exception reaches every waiting caller. A disabled cache calls the loader on every read.
 *
 * @param <K> Key type
 * @param <V> Value type
 */
public final class ReadThroughCache<K, V> {

    private static final Logger LOG = LoggerFactory.getLogger(ReadThroughCache.class);

    private final String name;
    private final boolean enabled;
    private final Duration defaultTtl;
    private final AsyncCache<K, Timed<V>> cache;

    private ReadThroughCache(Builder builder) {
        this.name = builder.name;
        this.enabled = builder.enabled;
        this.defaultTtl = builder.defaultTtl;
        this.cache = Caffeine.newBuilder()
                .maximumSize(builder.maximumSize)
                .expireAfter(new TimedExpiry<K, V>())
                .ticker(builder.ticker)
                .executor(Runnable::run)
                .buildAsync();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Returns the cached value, loading it with the default time to live on a miss.
     */
    public V get(K key, Function<? super K, ? extends V> loader) {
        return get(key, loader, defaultTtl);
    }

    /**
     * Returns the cached value, loading it with the given time to live on a miss.
     * A hit keeps its remaining lifetime.
     */
    public V get(K key, Function<? super K, ? extends V> loader, Duration ttl) {
        Objects.requireNonNull(key, "Key cannot be null");
        if (!enabled) {
            return loader.apply(key);
        }
        CompletableFuture<Timed<V>> pending = new CompletableFuture<>();
        CompletableFuture<Timed<V>> existing = cache.asMap().putIfAbsent(key, pending);
        if (existing != null) {
            return await(existing).value();
        }

        LOG.debug("Cache {} miss for {}", name, key);
        try {
            Timed<V> loaded = new Timed<>(loader.apply(key), ttl.toNanos());
            pending.complete(loaded);
            return loaded.value();
        } catch (RuntimeException | Error e) {
            cache.asMap().remove(key, pending);
            pending.completeExceptionally(e);
            throw e;
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    /**
     * Like {@link #get(Object, Function)}, but a hit restarts the entry's lifetime.
     */
    public V getWithRefresh(K key, Function<? super K, ? extends V> loader) {
        return getWithRefresh(key, loader, defaultTtl);
    }

    public V getWithRefresh(K key, Function<? super K, ? extends V> loader, Duration ttl) {
        Objects.requireNonNull(key, "Key cannot be null");
        if (!enabled) {
            return loader.apply(key);
        }
        // In-flight loads are not hits; get() waits for them
        Timed<V> hit = cache.synchronous().getIfPresent(key);
        if (hit != null) {
            cache.synchronous().policy().expireVariably()
                    .ifPresent(policy -> policy.setExpiresAfter(key, ttl));
            return hit.value();
        }
        return get(key, loader, ttl);
    }

    public void invalidate(K key) {
        cache.synchronous().invalidate(key);
    }

    public void invalidateAll() {
        LOG.debug("Cache {} cleared", name);
        cache.synchronous().invalidateAll();
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @return Approximate number of live entries
     */
    public long size() {
        cache.synchronous().cleanUp();
        return cache.synchronous().estimatedSize();
    }

    /**
     * A cached value with the lifetime it was stored with. The value itself may be null.
     */
    private record Timed<V>(V value, long ttlNanos) {
    }

    private static final class TimedExpiry<K, V> implements Expiry<K, Timed<V>> {

        @Override
        public long expireAfterCreate(K key, Timed<V> value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(K key, Timed<V> value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(K key, Timed<V> value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    /**
     * Builder for ReadThroughCache.
     */
    public static class Builder {
        private final String name;
        private boolean enabled = true;
        private Duration defaultTtl = Duration.ofMinutes(5);
        private long maximumSize = 1_000;
        private Ticker ticker = Ticker.systemTicker();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Name cannot be null");
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder defaultTtl(Duration defaultTtl) {
            if (defaultTtl.isNegative() || defaultTtl.isZero()) {
                throw new IllegalArgumentException("Cache TTL must be positive, got " + defaultTtl);
            }
            this.defaultTtl = defaultTtl;
            return this;
        }

        public Builder maximumSize(long maximumSize) {
            if (maximumSize < 1) {
                throw new IllegalArgumentException("Cache size must be positive, got " + maximumSize);
            }
            this.maximumSize = maximumSize;
            return this;
        }

        public Builder ticker(Ticker ticker) {
            this.ticker = Objects.requireNonNull(ticker, "Ticker cannot be null");
            return this;
        }

        public <K, V> ReadThroughCache<K, V> build() {
            return new ReadThroughCache<>(this);
        }
    }
}
