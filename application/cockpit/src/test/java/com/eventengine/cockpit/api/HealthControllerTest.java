package com.eventengine.cockpit.api;

import com.eventengine.platform.engine.EventEngine;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthControllerTest {

    @Test
    void engineCheckRunsOnBoundedElasticScheduler() {
        EventEngine engine = mock(EventEngine.class);
        AtomicReference<String> checkedOn = new AtomicReference<>();
        when(engine.isHealthy()).thenAnswer(invocation -> {
            checkedOn.set(Thread.currentThread().getName());
            return true;
        });

        ResponseEntity<Map<String, Object>> response = new HealthController(engine, "ee-cockpit").health().block();

        assertThat(checkedOn.get())
                .startsWith("boundedElastic")
                .isNotEqualTo(Thread.currentThread().getName());
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody())
                .containsEntry("status", "UP")
                .containsEntry("service", "ee-cockpit")
                .containsKey("timestamp");
    }

    @Test
    void unhealthyEngineAnswersServiceUnavailable() {
        EventEngine engine = mock(EventEngine.class);
        when(engine.isHealthy()).thenReturn(false);

        ResponseEntity<Map<String, Object>> response = new HealthController(engine, "ee-cockpit").health().block();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).containsEntry("status", "DOWN");
    }

    @Test
    void nothingIsCheckedUntilSubscribed() {
        EventEngine engine = mock(EventEngine.class);
        AtomicReference<String> checkedOn = new AtomicReference<>();
        when(engine.isHealthy()).thenAnswer(invocation -> {
            checkedOn.set(Thread.currentThread().getName());
            return true;
        });

        new HealthController(engine, "ee-cockpit").health();

        assertThat(checkedOn.get()).isNull();
    }
}
