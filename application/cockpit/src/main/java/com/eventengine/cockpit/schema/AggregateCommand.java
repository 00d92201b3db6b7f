package com.eventengine.cockpit.schema;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * A command as listed under its aggregate.
 */
@JsonPropertyOrder({"commandName", "aggregateType", "createAggregate", "schema"})
public record AggregateCommand(
        String commandName,
        String aggregateType,
        boolean createAggregate,
        Map<String, Object> schema
) {}
