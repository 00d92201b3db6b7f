package com.eventengine.platform.replay;

import com.eventengine.platform.base.Result;

import java.util.List;

/**
 * Interface for reading aggregate events from the event store.
 *
 * Events are immutable facts that can be replayed to reconstruct
 * aggregate state at any version.
 *
 * Usage:
 *   EventStore store = ...;
 *   List<StoredEvent> events = store.loadAggregateEvents("User", "user-1").getOrThrow();
 */
public interface EventStore {

    /**
     * Fetch all events of an aggregate instance, ordered by aggregate version.
     *
     * @param aggregateType The aggregate type
     * @param aggregateId The aggregate identifier
     * @return Events in version order (empty if the aggregate is unknown), or failure
     */
    Result<List<StoredEvent>> loadAggregateEvents(String aggregateType, String aggregateId);

    /**
     * Check if the event store is healthy/connected.
     */
    boolean isHealthy();
}
