package com.eventengine.cockpit.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Aggregate-centric view of the engine's message schema, as served to cockpit clients.
 *
 * @param aggregates One entry per aggregate description, in configuration order
 * @param queries One entry per query, in configuration order
 * @param commands One entry per command, in configuration order
 * @param definitions The message box schema's shared definitions, verbatim
 */
@JsonPropertyOrder({"aggregates", "queries", "commands", "definitions"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public record SchemaDocument(
        List<AggregateSchema> aggregates,
        List<QuerySchema> queries,
        List<CommandSchema> commands,
        Object definitions
) {
    public SchemaDocument {
        aggregates = List.copyOf(aggregates);
        queries = List.copyOf(queries);
        commands = List.copyOf(commands);
    }
}
