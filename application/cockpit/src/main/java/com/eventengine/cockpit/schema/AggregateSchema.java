package com.eventengine.cockpit.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * One aggregate type with the commands routed to it and the events those commands record.
 */
@JsonPropertyOrder({"aggregateType", "aggregateIdentifier", "aggregateStream", "aggregateCollection",
        "multiStoreMode", "commands", "events"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public record AggregateSchema(
        String aggregateType,
        String aggregateIdentifier,
        String aggregateStream,
        String aggregateCollection,
        Object multiStoreMode,
        List<AggregateCommand> commands,
        List<AggregateEvent> events
) {
    public AggregateSchema {
        commands = List.copyOf(commands);
        events = List.copyOf(events);
    }
}
