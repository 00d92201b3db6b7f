package com.eventengine.cockpit.api;

import com.eventengine.platform.engine.EventEngine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Health endpoint at root level. The engine check may reach the broker, so it runs off the event loop.
 */
@RestController
public class HealthController {

    private final EventEngine eventEngine;
    private final String serviceName;

    public HealthController(EventEngine eventEngine,
                            @Value("${spring.application.name:ee-cockpit}") String serviceName) {
        this.eventEngine = eventEngine;
        this.serviceName = serviceName;
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(() -> {
                    boolean healthy = eventEngine.isHealthy();
                    return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                            .body(Map.<String, Object>of(
                                    "status", healthy ? "UP" : "DOWN",
                                    "service", serviceName,
                                    "timestamp", System.currentTimeMillis()));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
