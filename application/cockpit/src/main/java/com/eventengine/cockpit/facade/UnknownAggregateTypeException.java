package com.eventengine.cockpit.facade;

/**
 * The requested aggregate type has no aggregate description in the engine configuration.
 */
public class UnknownAggregateTypeException extends RuntimeException {

    private final String aggregateType;

    public UnknownAggregateTypeException(String aggregateType) {
        super("Unknown aggregate type " + aggregateType);
        this.aggregateType = aggregateType;
    }

    public String aggregateType() {
        return aggregateType;
    }
}
