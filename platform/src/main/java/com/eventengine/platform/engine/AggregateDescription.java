package com.eventengine.platform.engine;

import java.util.Objects;

/**
 * How an aggregate type is stored.
 *
 * @param aggregateType Aggregate type name
 * @param aggregateIdentifier Name of the payload property holding the aggregate id
 * @param aggregateStream Event stream the aggregate's events are written to
 * @param aggregateCollection Document store collection holding the aggregate state
 * @param multiStoreMode Storage mode as configured in the engine, passed through as is
 */
public record AggregateDescription(
        String aggregateType,
        String aggregateIdentifier,
        String aggregateStream,
        String aggregateCollection,
        Object multiStoreMode
) {
    public AggregateDescription {
        Objects.requireNonNull(aggregateType, "aggregateType cannot be null");
    }
}
