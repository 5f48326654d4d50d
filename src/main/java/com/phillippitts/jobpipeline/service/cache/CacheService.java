package com.phillippitts.jobpipeline.service.cache;

import com.phillippitts.jobpipeline.exception.StoreUnavailableException;
import com.phillippitts.jobpipeline.service.metrics.PipelineMetrics;
import com.phillippitts.jobpipeline.store.CoordinationStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Fail-open cache over the coordination store.
 *
 * <p>A store failure never reaches the caller: reads behave as a cache miss and writes
 * report {@code false}. Each absorbed failure is logged at WARN and counted under
 * {@code jobpipeline.store.failopen{component=cache}}.
 */
@Service
public class CacheService {

    private static final Logger LOG = LogManager.getLogger(CacheService.class);
    private static final String COMPONENT = "cache";

    /** Expiry used when the caller does not pass one. */
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private final CoordinationStore store;
    private final PipelineMetrics metrics;

    public CacheService(CoordinationStore store, PipelineMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    public Optional<String> get(String key) {
        try {
            return store.get(key);
        } catch (StoreUnavailableException e) {
            failOpen("get", key, e);
            return Optional.empty();
        }
    }

    public boolean set(String key, String value) {
        return set(key, value, DEFAULT_TTL);
    }

    /**
     * Stores a value that expires after {@code ttl}.
     *
     * @return false if the store could not be reached
     */
    public boolean set(String key, String value, Duration ttl) {
        try {
            store.set(key, value, ttl);
            return true;
        } catch (StoreUnavailableException e) {
            failOpen("set", key, e);
            return false;
        }
    }

    public boolean delete(String key) {
        try {
            return store.delete(key);
        } catch (StoreUnavailableException e) {
            failOpen("delete", key, e);
            return false;
        }
    }

    public boolean exists(String key) {
        try {
            return store.exists(key);
        } catch (StoreUnavailableException e) {
            failOpen("exists", key, e);
            return false;
        }
    }

    /**
     * @return the new value, or empty if the store could not be reached
     */
    public OptionalLong increment(String key, long amount) {
        try {
            return OptionalLong.of(store.increment(key, amount));
        } catch (StoreUnavailableException e) {
            failOpen("increment", key, e);
            return OptionalLong.empty();
        }
    }

    public boolean setHash(String key, Map<String, String> fields, Duration ttl) {
        try {
            store.setHash(key, fields, ttl);
            return true;
        } catch (StoreUnavailableException e) {
            failOpen("setHash", key, e);
            return false;
        }
    }

    public Optional<Map<String, String>> getHash(String key) {
        try {
            return store.getHash(key);
        } catch (StoreUnavailableException e) {
            failOpen("getHash", key, e);
            return Optional.empty();
        }
    }

    private void failOpen(String operation, String key, StoreUnavailableException e) {
        LOG.warn("Cache {} failed for key={}, treating as miss: {}", operation, key, e.getMessage());
        metrics.recordFailOpen(COMPONENT, operation);
    }
}
