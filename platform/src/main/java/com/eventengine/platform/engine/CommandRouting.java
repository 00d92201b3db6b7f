package com.eventengine.platform.engine;

import java.util.Map;
import java.util.Objects;

import static com.eventengine.platform.base.OrderedMaps.immutableCopy;

/**
 * Compiled routing of one command.
 *
 * @param aggregateType The aggregate type handling the command
 * @param createAggregate Whether the command creates a new aggregate instance
 * @param eventRecorderMap Event name to recorder metadata, in recording order; only the keys matter here
 */
public record CommandRouting(
        String aggregateType,
        boolean createAggregate,
        Map<String, Object> eventRecorderMap
) {
    public CommandRouting {
        Objects.requireNonNull(aggregateType, "aggregateType cannot be null");
        eventRecorderMap = immutableCopy(eventRecorderMap);
    }

    /**
     * Names of the events this command may record, in declaration order.
     */
    public Iterable<String> eventNames() {
        return eventRecorderMap.keySet();
    }
}
