package com.eventengine.platform.replay;

import com.eventengine.platform.base.Result;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Folds already loaded aggregate events through a projector with tracing.
 *
 * 1. Start from the projector's initial state
 * 2. Apply each event in the given order
 * 3. Record a span per replay and per event
 *
 * @param <S> The state type
 */
public class ReplayService<S> {

    private static final Logger log = LoggerFactory.getLogger(ReplayService.class);
    private static final String SERVICE_NAME = "replay-service";

    /** Create replay service. */
    public static <S> ReplayService<S> create(AggregateProjector<S> projector) {
        return new ReplayService<>(projector);
    }

    private final AggregateProjector<S> projector;
    private final Tracer tracer;

    private ReplayService(AggregateProjector<S> projector) {
        this.projector = Objects.requireNonNull(projector, "projector required");
        this.tracer = GlobalOpenTelemetry.get().getTracer(SERVICE_NAME);
    }

    /**
     * Replay {@code events} and serialize the final state. An empty list yields the initial state.
     */
    public Result<Map<String, Object>> loadState(String aggregateType, String aggregateId, List<StoredEvent> events) {
        long startTime = System.currentTimeMillis();

        Span replaySpan = tracer.spanBuilder("replay.aggregate")
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute("replay.aggregateType", aggregateType)
                .setAttribute("replay.aggregateId", aggregateId)
                .setAttribute("replay.eventsFound", events.size())
                .startSpan();

        try (Scope scope = replaySpan.makeCurrent()) {
            MDC.put("traceId", replaySpan.getSpanContext().getTraceId());
            MDC.put("aggregateType", aggregateType);
            MDC.put("aggregateId", aggregateId);

            log.debug("Replaying aggregate: {}/{}, {} events", aggregateType, aggregateId, events.size());

            return Result.of(() -> replayEvents(events))
                    .map(projector::stateToMap)
                    .onSuccess(state -> {
                        replaySpan.setStatus(StatusCode.OK);
                        log.debug("Replay completed: {} events in {}ms", events.size(),
                                System.currentTimeMillis() - startTime);
                    })
                    .onFailure(e -> {
                        log.error("Replay failed for aggregate: {}/{}", aggregateType, aggregateId, e);
                        replaySpan.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
                        replaySpan.recordException(e);
                    });

        } finally {
            replaySpan.end();
            MDC.remove("traceId");
            MDC.remove("aggregateType");
            MDC.remove("aggregateId");
        }
    }

    private S replayEvents(List<StoredEvent> events) {
        S currentState = projector.initialState();
        for (int i = 0; i < events.size(); i++) {
            currentState = replayEvent(events.get(i), currentState, i, events.size());
        }
        return currentState;
    }

    private S replayEvent(StoredEvent event, S currentState, int index, int total) {
        Span eventSpan = tracer.spanBuilder("replay.event")
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute("event.index", index)
                .setAttribute("event.total", total)
                .setAttribute("event.id", event.eventId())
                .setAttribute("event.name", event.eventName())
                .setAttribute("event.aggregateVersion", event.aggregateVersion())
                .startSpan();

        try (Scope scope = eventSpan.makeCurrent()) {
            MDC.put("eventId", event.eventId());

            S newState = projector.apply(currentState, event);

            if (log.isTraceEnabled()) {
                log.trace("After event {} (v{}): {}", event.eventName(), event.aggregateVersion(),
                        projector.stateToMap(newState));
            }

            eventSpan.setStatus(StatusCode.OK);
            return newState;

        } catch (RuntimeException e) {
            eventSpan.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            eventSpan.recordException(e);
            throw e;
        } finally {
            eventSpan.end();
            MDC.remove("eventId");
        }
    }
}
