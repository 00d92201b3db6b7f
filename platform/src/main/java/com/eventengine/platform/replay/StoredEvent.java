package com.eventengine.platform.replay;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

import static com.eventengine.platform.base.OrderedMaps.immutableCopy;

/**
 * An event recorded against one aggregate instance.
 *
 * This is a platform-agnostic representation of events that can be replayed
 * through an {@link AggregateProjector} to rebuild aggregate state.
 *
 * @param eventId Unique identifier for this event
 * @param eventName The event name as declared in the engine's event map
 * @param aggregateType The aggregate type the event belongs to
 * @param aggregateId The aggregate instance identifier
 * @param aggregateVersion Version of the aggregate after this event (1-based)
 * @param payload The raw event payload
 * @param metadata Event metadata (causation, correlation, user, ...)
 * @param createdAt When the event was recorded
 */
public record StoredEvent(
        String eventId,
        String eventName,
        String aggregateType,
        String aggregateId,
        int aggregateVersion,
        Map<String, Object> payload,
        Map<String, Object> metadata,
        Instant createdAt
) {
    public StoredEvent {
        Objects.requireNonNull(eventId, "eventId cannot be null");
        Objects.requireNonNull(eventName, "eventName cannot be null");
        Objects.requireNonNull(aggregateType, "aggregateType cannot be null");
        Objects.requireNonNull(aggregateId, "aggregateId cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        if (aggregateVersion < 1) {
            throw new IllegalArgumentException("aggregateVersion must be >= 1, was " + aggregateVersion);
        }
        payload = immutableCopy(payload);
        metadata = immutableCopy(metadata);
    }

    /**
     * True if this event belongs to the given aggregate instance.
     */
    public boolean belongsTo(String aggregateType, String aggregateId) {
        return this.aggregateType.equals(aggregateType) && this.aggregateId.equals(aggregateId);
    }
}
