package com.eventengine.platform.engine;

/**
 * No events exist for the requested aggregate instance.
 */
public class AggregateNotFoundException extends RuntimeException {

    private final String aggregateType;
    private final String aggregateId;

    public AggregateNotFoundException(String aggregateType, String aggregateId) {
        super("Aggregate " + aggregateType + " with id " + aggregateId + " not found");
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
    }

    public String aggregateType() {
        return aggregateType;
    }

    public String aggregateId() {
        return aggregateId;
    }
}
