package com.eventengine.cockpit.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * A command in the top-level command list.
 *
 * @param aggregateType Routed aggregate type, null if the command has no routing
 * @param createAggregate False if the command has no routing
 */
@JsonPropertyOrder({"commandName", "schema", "aggregateType", "createAggregate"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public record CommandSchema(
        String commandName,
        Map<String, Object> schema,
        String aggregateType,
        boolean createAggregate
) {}
