package com.eventengine.platform.engine;

import java.util.Map;
import java.util.Optional;

import static com.eventengine.platform.base.OrderedMaps.immutableCopy;

/**
 * The engine's compiled, cacheable configuration.
 *
 * All maps keep the declaration order of the engine setup and are immutable.
 *
 * @param commandMap Command name to payload schema
 * @param queryMap Query name to payload schema
 * @param eventMap Event name to payload schema
 * @param compiledCommandRouting Command name to routing
 * @param aggregateDescriptions Aggregate type to storage description
 */
public record CompiledConfig(
        Map<String, Map<String, Object>> commandMap,
        Map<String, Map<String, Object>> queryMap,
        Map<String, Map<String, Object>> eventMap,
        Map<String, CommandRouting> compiledCommandRouting,
        Map<String, AggregateDescription> aggregateDescriptions
) {
    public CompiledConfig {
        commandMap = immutableCopy(commandMap);
        queryMap = immutableCopy(queryMap);
        eventMap = immutableCopy(eventMap);
        compiledCommandRouting = immutableCopy(compiledCommandRouting);
        aggregateDescriptions = immutableCopy(aggregateDescriptions);
    }

    public Optional<AggregateDescription> aggregateDescription(String aggregateType) {
        return Optional.ofNullable(aggregateDescriptions.get(aggregateType));
    }
}
