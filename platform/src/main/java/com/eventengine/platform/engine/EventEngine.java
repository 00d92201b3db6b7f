package com.eventengine.platform.engine;

import com.eventengine.platform.base.Result;
import com.eventengine.platform.replay.StoredEvent;

import java.util.List;
import java.util.Map;

/**
 * Read side of the event engine as seen by the cockpit.
 */
public interface EventEngine {

    /**
     * The compiled configuration. Callers must not assume it is cached.
     */
    CompiledConfig compileCacheableConfig();

    /**
     * JSON schema of the message box; its {@code definitions} block is shared by all message schemas.
     */
    Map<String, Object> messageBoxSchema();

    /**
     * Current state of an aggregate, rebuilt from all of its events.
     * Fails with {@link AggregateNotFoundException} if the aggregate has no events.
     */
    Result<Map<String, Object>> loadAggregateState(String aggregateType, String aggregateId);

    /**
     * State of an aggregate as of {@code version}: only events with
     * {@code aggregateVersion <= version} are replayed.
     */
    Result<Map<String, Object>> loadAggregateStateUntil(String aggregateType, String aggregateId, int version);

    /**
     * All events of an aggregate in version order.
     */
    Result<List<StoredEvent>> loadAggregateEvents(String aggregateType, String aggregateId);

    boolean isHealthy();
}
