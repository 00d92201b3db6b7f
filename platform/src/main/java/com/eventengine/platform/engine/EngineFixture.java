package com.eventengine.platform.engine;

import com.eventengine.platform.replay.StoredEvent;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import static com.eventengine.platform.base.OrderedMaps.immutableCopy;

/**
 * A self-contained engine setup: compiled configuration, message box schema and seed events.
 *
 * Loaded from JSON by {@link EngineFixtureLoader}.
 */
public record EngineFixture(
        CompiledConfig config,
        Map<String, Object> messageBoxSchema,
        List<SeedEvent> events
) {
    public EngineFixture {
        Objects.requireNonNull(config, "config cannot be null");
        messageBoxSchema = immutableCopy(messageBoxSchema);
        events = events != null ? List.copyOf(events) : List.of();
    }

    /**
     * Seed event as written in the fixture; {@code eventId} and {@code createdAt} are optional.
     */
    public record SeedEvent(
            String eventId,
            String eventName,
            String aggregateType,
            String aggregateId,
            int aggregateVersion,
            String createdAt,
            Map<String, Object> metadata,
            Map<String, Object> payload
    ) {
        public StoredEvent toStoredEvent() {
            return new StoredEvent(
                    eventId != null ? eventId : UUID.randomUUID().toString(),
                    eventName,
                    aggregateType,
                    aggregateId,
                    aggregateVersion,
                    payload,
                    metadata,
                    createdAt != null ? OffsetDateTime.parse(createdAt).toInstant() : Instant.now()
            );
        }
    }
}
