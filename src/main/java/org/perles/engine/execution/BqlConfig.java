package org.perles.engine.execution;

import org.perles.engine.graph.GraphExpander;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;

/**
 * Executor settings.
 *
 * {@link #load()} reads {@code bql.properties} from the classpath, then applies
 * System property overrides with the same keys.
 *
 * @param cacheEnabled        Whether query results and the dependency graph are cached
 * @param cacheTtl            Lifetime of a cache entry, restarted on every hit
 * @param cacheMaxQueries     Maximum number of cached query results
 * @param expandMaxIterations Level ceiling for unlimited expansion
 * @param expandTimeBudget    Wall-clock limit for one expansion
 * @param queryTimeoutSeconds JDBC statement timeout, 0 for none
 */
public record BqlConfig(
        boolean cacheEnabled,
        Duration cacheTtl,
        long cacheMaxQueries,
        int expandMaxIterations,
        Duration expandTimeBudget,
        int queryTimeoutSeconds) {

    public static final String RESOURCE = "bql.properties";

    public static final String CACHE_ENABLED = "bql.cache.enabled";
    public static final String CACHE_TTL_SECONDS = "bql.cache.ttl-seconds";
    public static final String CACHE_MAX_QUERIES = "bql.cache.max-queries";
    public static final String EXPAND_MAX_ITERATIONS = "bql.expand.max-iterations";
    public static final String EXPAND_TIME_BUDGET_MS = "bql.expand.time-budget-ms";
    public static final String QUERY_TIMEOUT_SECONDS = "bql.query.timeout-seconds";

    public static final BqlConfig DEFAULTS = builder().build();

    public BqlConfig {
        if (cacheTtl == null || cacheTtl.isNegative() || cacheTtl.isZero()) {
            throw new IllegalArgumentException(CACHE_TTL_SECONDS + " must be positive, got " + cacheTtl);
        }
        if (cacheMaxQueries < 1) {
            throw new IllegalArgumentException(CACHE_MAX_QUERIES + " must be positive, got " + cacheMaxQueries);
        }
        if (expandMaxIterations < 1) {
            throw new IllegalArgumentException(
                    EXPAND_MAX_ITERATIONS + " must be positive, got " + expandMaxIterations);
        }
        if (expandTimeBudget == null || expandTimeBudget.isNegative() || expandTimeBudget.isZero()) {
            throw new IllegalArgumentException(
                    EXPAND_TIME_BUDGET_MS + " must be positive, got " + expandTimeBudget);
        }
        if (queryTimeoutSeconds < 0) {
            throw new IllegalArgumentException(
                    QUERY_TIMEOUT_SECONDS + " cannot be negative, got " + queryTimeoutSeconds);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads the classpath defaults and applies System property overrides.
     */
    public static BqlConfig load() {
        Properties properties = new Properties();
        try (InputStream stream = BqlConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (stream != null) {
                properties.load(stream);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        for (String key : new String[] {CACHE_ENABLED, CACHE_TTL_SECONDS, CACHE_MAX_QUERIES,
                EXPAND_MAX_ITERATIONS, EXPAND_TIME_BUDGET_MS, QUERY_TIMEOUT_SECONDS}) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return from(properties);
    }

    /**
     * Builds a config from properties; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException naming the key of a malformed value
     */
    public static BqlConfig from(Properties properties) {
        Builder builder = builder();
        String enabled = properties.getProperty(CACHE_ENABLED);
        if (enabled != null) {
            builder.cacheEnabled(parseBoolean(CACHE_ENABLED, enabled));
        }
        String ttl = properties.getProperty(CACHE_TTL_SECONDS);
        if (ttl != null) {
            builder.cacheTtl(Duration.ofSeconds(parseLong(CACHE_TTL_SECONDS, ttl)));
        }
        String maxQueries = properties.getProperty(CACHE_MAX_QUERIES);
        if (maxQueries != null) {
            builder.cacheMaxQueries(parseLong(CACHE_MAX_QUERIES, maxQueries));
        }
        String iterations = properties.getProperty(EXPAND_MAX_ITERATIONS);
        if (iterations != null) {
            builder.expandMaxIterations((int) parseLong(EXPAND_MAX_ITERATIONS, iterations));
        }
        String budget = properties.getProperty(EXPAND_TIME_BUDGET_MS);
        if (budget != null) {
            builder.expandTimeBudget(Duration.ofMillis(parseLong(EXPAND_TIME_BUDGET_MS, budget)));
        }
        String timeout = properties.getProperty(QUERY_TIMEOUT_SECONDS);
        if (timeout != null) {
            builder.queryTimeoutSeconds((int) parseLong(QUERY_TIMEOUT_SECONDS, timeout));
        }
        return builder.build();
    }

    private static boolean parseBoolean(String key, String value) {
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return true;
        }
        if (trimmed.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException("property [" + key + "] must be true or false, got [" + value + "]");
    }

    private static long parseLong(String key, String value) {
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed > Integer.MAX_VALUE || parsed < Integer.MIN_VALUE) {
                throw new IllegalArgumentException("property [" + key + "] is out of range: [" + value + "]");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("property [" + key + "] must be an integer, got [" + value + "]", e);
        }
    }

    /**
     * Builder for BqlConfig.
     */
    public static class Builder {
        private boolean cacheEnabled = true;
        private Duration cacheTtl = Duration.ofMinutes(5);
        private long cacheMaxQueries = 500;
        private int expandMaxIterations = GraphExpander.DEFAULT_ITERATION_CEILING;
        private Duration expandTimeBudget = GraphExpander.DEFAULT_TIME_BUDGET;
        private int queryTimeoutSeconds = 30;

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder cacheMaxQueries(long cacheMaxQueries) {
            this.cacheMaxQueries = cacheMaxQueries;
            return this;
        }

        public Builder expandMaxIterations(int expandMaxIterations) {
            this.expandMaxIterations = expandMaxIterations;
            return this;
        }

        public Builder expandTimeBudget(Duration expandTimeBudget) {
            this.expandTimeBudget = expandTimeBudget;
            return this;
        }

        public Builder queryTimeoutSeconds(int queryTimeoutSeconds) {
            this.queryTimeoutSeconds = queryTimeoutSeconds;
            return this;
        }

        public BqlConfig build() {
            return new BqlConfig(cacheEnabled, cacheTtl, cacheMaxQueries, expandMaxIterations,
                    expandTimeBudget, queryTimeoutSeconds);
        }
    }
}
