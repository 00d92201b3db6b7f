package com.eventengine.platform.engine;

/**
 * Identifies one aggregate instance.
 */
public record AggregateRef(String aggregateType, String aggregateId) {}
