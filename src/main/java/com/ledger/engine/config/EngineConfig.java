package com.ledger.engine.config;

import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Configuration for rule application.
 * <p>
 * Properties live under {@code app.rules.*}. Fields are public so components constructed
 * outside the container (tests, embedded use) can be given a config via {@link #defaults()};
 * the bean is a singleton so injected references are the instance itself, not a client proxy.
 */
@Singleton
public class EngineConfig {

    /**
     * Number of transactions loaded and processed per bulk chunk.
     * <p>
     * Bounds peak memory and sets the granularity of progress events and cancellation.
     * Default: 500
     */
    @ConfigProperty(name = "app.rules.bulk.chunk-size", defaultValue = "500")
    public int bulkChunkSize;

    /**
     * Maximum number of per-transaction failures kept in a bulk summary.
     * The failure count is always exact; only the detail list is capped.
     * Default: 1000
     */
    @ConfigProperty(name = "app.rules.bulk.max-recorded-failures", defaultValue = "1000")
    public int maxRecordedFailures;

    /**
     * Maximum number of compiled regex patterns cached by the trigger evaluator.
     * The cache is cleared when full.
     * Default: 1000
     */
    @ConfigProperty(name = "app.rules.regex.cache-size", defaultValue = "1000")
    public int regexCacheSize;

    /**
     * Whether rule match counts are written back through the store after each match.
     * Default: true
     */
    @ConfigProperty(name = "app.rules.statistics.persist", defaultValue = "true")
    public boolean persistStatistics;

    /**
     * Whether the YAML simulation endpoint is enabled.
     * Default: true
     */
    @ConfigProperty(name = "app.rules.simulation.enabled", defaultValue = "true")
    public boolean simulationEnabled;

    /**
     * Config with the default values, for use outside the container.
     */
    public static EngineConfig defaults() {
        EngineConfig config = new EngineConfig();
        config.bulkChunkSize = 500;
        config.maxRecordedFailures = 1000;
        config.regexCacheSize = 1000;
        config.persistStatistics = true;
        config.simulationEnabled = true;
        return config;
    }

    /**
     * Chunk size clamped to at least one.
     */
    public int effectiveChunkSize() {
        return Math.max(1, bulkChunkSize);
    }
}
