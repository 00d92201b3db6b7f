package com.eventengine.platform.engine;

import com.eventengine.platform.base.Result;
import com.eventengine.platform.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Writes the current state of an aggregate into its document store collection.
 *
 * The document id is the aggregate id; the collection is the aggregate's
 * {@code aggregateCollection}.
 */
public class AggregateStateProjection {

    private static final Logger log = LoggerFactory.getLogger(AggregateStateProjection.class);

    private final EventEngine eventEngine;
    private final DocumentStore documentStore;

    public AggregateStateProjection(EventEngine eventEngine, DocumentStore documentStore) {
        this.eventEngine = Objects.requireNonNull(eventEngine, "eventEngine required");
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore required");
    }

    public Result<Map<String, Object>> project(String aggregateType, String aggregateId) {
        return eventEngine.compileCacheableConfig().aggregateDescription(aggregateType)
                .map(description -> eventEngine.loadAggregateState(aggregateType, aggregateId)
                        .flatMap(state -> documentStore.upsertDoc(description.aggregateCollection(), aggregateId, state))
                        .onSuccess(doc -> log.debug("Projected {}/{} into {}", aggregateType, aggregateId,
                                description.aggregateCollection())))
                .orElseGet(() -> Result.failure(
                        new IllegalArgumentException("No aggregate description for type " + aggregateType)));
    }
}
