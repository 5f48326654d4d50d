package com.phillippitts.jobpipeline.service.health;

import com.phillippitts.jobpipeline.store.CoordinationStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CoordinationStoreHealthIndicatorTest {

    private final CoordinationStore store = mock(CoordinationStore.class);
    private final CoordinationStoreHealthIndicator indicator = new CoordinationStoreHealthIndicator(store);

    @Test
    void upWhenStoreAnswers() {
        when(store.ping()).thenReturn(true);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("store", "reachable");
    }

    @Test
    void downWhenStoreUnreachable() {
        when(store.ping()).thenReturn(false);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("store", "unreachable").containsKey("impact");
    }
}
