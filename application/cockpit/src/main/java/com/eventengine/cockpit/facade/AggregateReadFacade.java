package com.eventengine.cockpit.facade;

import com.eventengine.platform.base.Result;
import com.eventengine.platform.engine.AggregateDescription;
import com.eventengine.platform.engine.EventEngine;
import com.eventengine.platform.store.AnyFilter;
import com.eventengine.platform.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Read-only access to aggregates for the cockpit.
 *
 * Every operation checks the aggregate type against the engine's aggregate descriptions
 * first and fails with {@link UnknownAggregateTypeException} without touching the
 * document store or event engine.
 */
public class AggregateReadFacade {

    private static final Logger log = LoggerFactory.getLogger(AggregateReadFacade.class);

    private final EventEngine eventEngine;
    private final DocumentStore documentStore;

    public AggregateReadFacade(EventEngine eventEngine, DocumentStore documentStore) {
        this.eventEngine = Objects.requireNonNull(eventEngine, "eventEngine required");
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore required");
    }

    /**
     * Up to {@code limit} state documents from the aggregate type's collection.
     */
    public Result<List<Map<String, Object>>> listAggregates(String aggregateType, int limit) {
        return describe(aggregateType).flatMap(description -> {
            log.debug("Listing {} (collection {}), limit {}", aggregateType, description.aggregateCollection(), limit);
            return documentStore.filterDocs(description.aggregateCollection(), new AnyFilter(), 0, limit);
        });
    }

    /**
     * Current state, or the state as of {@code version} when present.
     */
    public Result<Map<String, Object>> loadAggregateState(String aggregateType, String aggregateId, OptionalInt version) {
        return describe(aggregateType).flatMap(description -> version.isPresent()
                ? eventEngine.loadAggregateStateUntil(aggregateType, aggregateId, version.getAsInt())
                : eventEngine.loadAggregateState(aggregateType, aggregateId));
    }

    /**
     * Full event history in version order.
     */
    public Result<List<AggregateEventRecord>> loadAggregateEvents(String aggregateType, String aggregateId) {
        return describe(aggregateType)
                .flatMap(description -> eventEngine.loadAggregateEvents(aggregateType, aggregateId))
                .map(events -> events.stream().map(AggregateEventRecord::from).toList());
    }

    private Result<AggregateDescription> describe(String aggregateType) {
        return eventEngine.compileCacheableConfig().aggregateDescription(aggregateType)
                .map(Result::success)
                .orElseGet(() -> Result.failure(new UnknownAggregateTypeException(aggregateType)));
    }
}
