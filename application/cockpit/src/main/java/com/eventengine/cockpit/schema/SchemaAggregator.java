package com.eventengine.cockpit.schema;

import com.eventengine.cockpit.schema.ConfigurationIntegrityException.Kind;
import com.eventengine.platform.engine.AggregateDescription;
import com.eventengine.platform.engine.CommandRouting;
import com.eventengine.platform.engine.CompiledConfig;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.eventengine.platform.base.OrderedMaps.filter;
import static com.eventengine.platform.base.OrderedMaps.mapWithKey;

/**
 * Reshapes the engine's flat compiled configuration into an aggregate-centric {@link SchemaDocument}.
 *
 * Pure function of its inputs: nothing is cached and the inputs are never modified.
 *
 * Ordering:
 * - queries and top-level commands follow the query map and command map
 * - aggregates follow the aggregate descriptions
 * - an aggregate's commands follow the command routing table
 * - an aggregate's events appear once each, in order of first occurrence across its commands
 */
public final class SchemaAggregator {

    private SchemaAggregator() {}

    /**
     * Build the schema document from a compiled configuration and the message box definitions.
     */
    public static SchemaDocument buildSchemaDocument(CompiledConfig config, Object definitions) {
        return buildSchemaDocument(
                config.commandMap(),
                config.queryMap(),
                config.eventMap(),
                config.compiledCommandRouting(),
                config.aggregateDescriptions(),
                definitions);
    }

    /**
     * @throws ConfigurationIntegrityException if a routed command or recorded event has no schema
     */
    public static SchemaDocument buildSchemaDocument(
            Map<String, Map<String, Object>> commandMap,
            Map<String, Map<String, Object>> queryMap,
            Map<String, Map<String, Object>> eventMap,
            Map<String, CommandRouting> compiledCommandRouting,
            Map<String, AggregateDescription> aggregateDescriptions,
            Object definitions) {

        List<QuerySchema> queries = mapWithKey(queryMap, QuerySchema::new);

        List<CommandSchema> commands = mapWithKey(commandMap, (commandName, schema) -> {
            CommandRouting routing = compiledCommandRouting.get(commandName);
            return new CommandSchema(
                    commandName,
                    schema,
                    routing != null ? routing.aggregateType() : null,
                    routing != null && routing.createAggregate());
        });

        List<AggregateSchema> aggregates = mapWithKey(aggregateDescriptions, (key, description) ->
                aggregateSchema(description, commandMap, eventMap, compiledCommandRouting));

        return new SchemaDocument(aggregates, queries, commands, definitions);
    }

    /**
     * The {@code definitions} block of a message box schema, or null if it has none.
     */
    public static Object definitionsOf(Map<String, Object> messageBoxSchema) {
        return messageBoxSchema.get("definitions");
    }

    /**
     * The description's own {@code aggregateType} selects the routed commands; its map key is not consulted.
     */
    private static AggregateSchema aggregateSchema(
            AggregateDescription description,
            Map<String, Map<String, Object>> commandMap,
            Map<String, Map<String, Object>> eventMap,
            Map<String, CommandRouting> compiledCommandRouting) {

        String aggregateType = description.aggregateType();

        Map<String, CommandRouting> routed = filter(compiledCommandRouting,
                (commandName, routing) -> aggregateType.equals(routing.aggregateType()));

        List<AggregateCommand> commands = mapWithKey(routed, (commandName, routing) -> new AggregateCommand(
                commandName,
                routing.aggregateType(),
                routing.createAggregate(),
                require(commandMap, commandName, Kind.COMMAND, aggregateType)));

        return new AggregateSchema(
                aggregateType,
                description.aggregateIdentifier(),
                description.aggregateStream(),
                description.aggregateCollection(),
                description.multiStoreMode(),
                commands,
                recordedEvents(routed, eventMap, aggregateType));
    }

    private static List<AggregateEvent> recordedEvents(
            Map<String, CommandRouting> routed,
            Map<String, Map<String, Object>> eventMap,
            String aggregateType) {

        Set<String> seen = new LinkedHashSet<>();
        List<AggregateEvent> events = new ArrayList<>();
        for (CommandRouting routing : routed.values()) {
            for (String eventName : routing.eventNames()) {
                if (seen.add(eventName)) {
                    events.add(new AggregateEvent(eventName, require(eventMap, eventName, Kind.EVENT, aggregateType)));
                }
            }
        }
        return events;
    }

    private static Map<String, Object> require(Map<String, Map<String, Object>> schemas, String name,
                                               Kind kind, String aggregateType) {
        Map<String, Object> schema = schemas.get(name);
        if (schema == null) {
            throw new ConfigurationIntegrityException(kind, name, aggregateType, "has no payload schema");
        }
        return schema;
    }
}
