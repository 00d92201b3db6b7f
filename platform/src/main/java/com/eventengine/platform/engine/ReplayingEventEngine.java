package com.eventengine.platform.engine;

import com.eventengine.platform.base.Result;
import com.eventengine.platform.replay.AggregateProjector;
import com.eventengine.platform.replay.EventStore;
import com.eventengine.platform.replay.MergingProjector;
import com.eventengine.platform.replay.ReplayService;
import com.eventengine.platform.replay.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.Consumer;

import static com.eventengine.platform.base.OrderedMaps.immutableCopy;

/**
 * EventEngine that rebuilds aggregate state by replaying the event store.
 *
 * Each aggregate type can register its own {@link AggregateProjector};
 * types without one use {@link MergingProjector}.
 *
 * Example:
 * <pre>{@code
 * EventEngine engine = ReplayingEventEngine.create(c -> c
 *         .config(compiledConfig)
 *         .messageBoxSchema(schema)
 *         .eventStore(store)
 *         .projector("User", new UserProjector()));
 * }</pre>
 */
public class ReplayingEventEngine implements EventEngine {

    private static final Logger log = LoggerFactory.getLogger(ReplayingEventEngine.class);

    /**
     * Create engine with lambda configuration.
     */
    public static ReplayingEventEngine create(Consumer<Builder> configure) {
        Builder builder = new Builder();
        configure.accept(builder);
        return builder.build();
    }

    private final CompiledConfig config;
    private final Map<String, Object> messageBoxSchema;
    private final EventStore eventStore;
    private final Map<String, ReplayService<?>> replayByType;
    private final ReplayService<?> defaultReplay;

    private ReplayingEventEngine(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config required");
        this.messageBoxSchema = immutableCopy(b.messageBoxSchema);
        this.eventStore = Objects.requireNonNull(b.eventStore, "eventStore required");
        this.replayByType = new HashMap<>();
        b.projectors.forEach((type, projector) -> replayByType.put(type, ReplayService.create(projector)));
        this.defaultReplay = ReplayService.create(new MergingProjector());
    }

    /** Configuration builder - use via create(c -> c.xxx()) */
    public static class Builder {
        private CompiledConfig config;
        private Map<String, Object> messageBoxSchema = Map.of();
        private EventStore eventStore;
        private final Map<String, AggregateProjector<?>> projectors = new HashMap<>();

        public Builder config(CompiledConfig c) { this.config = c; return this; }
        public Builder messageBoxSchema(Map<String, Object> s) { this.messageBoxSchema = s; return this; }
        public Builder eventStore(EventStore s) { this.eventStore = s; return this; }
        public Builder projector(String aggregateType, AggregateProjector<?> p) { this.projectors.put(aggregateType, p); return this; }

        ReplayingEventEngine build() {
            return new ReplayingEventEngine(this);
        }
    }

    // ========================================================================
    // EventEngine implementation
    // ========================================================================

    @Override
    public CompiledConfig compileCacheableConfig() {
        return config;
    }

    @Override
    public Map<String, Object> messageBoxSchema() {
        return messageBoxSchema;
    }

    @Override
    public Result<Map<String, Object>> loadAggregateState(String aggregateType, String aggregateId) {
        return loadState(aggregateType, aggregateId, OptionalInt.empty());
    }

    @Override
    public Result<Map<String, Object>> loadAggregateStateUntil(String aggregateType, String aggregateId, int version) {
        if (version < 0) {
            return Result.failure(new IllegalArgumentException("version must be >= 0, was " + version));
        }
        return loadState(aggregateType, aggregateId, OptionalInt.of(version));
    }

    @Override
    public Result<List<StoredEvent>> loadAggregateEvents(String aggregateType, String aggregateId) {
        return eventStore.loadAggregateEvents(aggregateType, aggregateId);
    }

    @Override
    public boolean isHealthy() {
        return eventStore.isHealthy();
    }

    // ========================================================================
    // Internals
    // ========================================================================

    /**
     * Reads the store once. An empty history means the aggregate does not exist.
     */
    private Result<Map<String, Object>> loadState(String aggregateType, String aggregateId, OptionalInt upToVersion) {
        return eventStore.loadAggregateEvents(aggregateType, aggregateId)
                .filterOrElse(events -> !events.isEmpty(), events -> new AggregateNotFoundException(aggregateType, aggregateId))
                .onFailure(e -> log.debug("Cannot load {}/{}: {}", aggregateType, aggregateId, e.getMessage()))
                .map(events -> upToVersion.isPresent() ? upTo(events, upToVersion.getAsInt()) : events)
                .flatMap(events -> replayFor(aggregateType).loadState(aggregateType, aggregateId, events));
    }

    private static List<StoredEvent> upTo(List<StoredEvent> events, int version) {
        return events.stream().filter(e -> e.aggregateVersion() <= version).toList();
    }

    private ReplayService<?> replayFor(String aggregateType) {
        return replayByType.getOrDefault(aggregateType, defaultReplay);
    }
}
