package com.phillippitts.jobpipeline.service.health;

import com.phillippitts.jobpipeline.store.CoordinationStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the coordination store answers a ping.
 *
 * <p>DOWN means job submission and workers are unavailable, while cache, session reads
 * and rate limiting keep serving by failing open.
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class CoordinationStoreHealthIndicator implements HealthIndicator {

    private final CoordinationStore store;

    public CoordinationStoreHealthIndicator(CoordinationStore store) {
        this.store = store;
    }

    @Override
    public Health health() {
        if (store.ping()) {
            return Health.up().withDetail("store", "reachable").build();
        }
        return Health.down()
                .withDetail("store", "unreachable")
                .withDetail("impact", "job submission and processing paused; cache and rate limiting failing open")
                .build();
    }
}
