package com.eventengine.cockpit.config;

import com.eventengine.platform.config.CockpitConfig;
import com.eventengine.platform.config.CockpitConfig.EventStoreType;
import com.eventengine.platform.engine.AggregateRef;
import com.eventengine.platform.engine.AggregateStateProjection;
import com.eventengine.platform.engine.CompiledConfig;
import com.eventengine.platform.engine.EngineFixture;
import com.eventengine.platform.engine.EngineFixtureLoader;
import com.eventengine.platform.engine.EventEngine;
import com.eventengine.platform.engine.ReplayingEventEngine;
import com.eventengine.platform.replay.EventStore;
import com.eventengine.platform.replay.InMemoryEventStore;
import com.eventengine.platform.replay.KafkaEventStore;
import com.eventengine.platform.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the event engine from cockpit configuration.
 *
 * memory: events come from the fixture and every seeded aggregate is projected
 *         into the document store.
 * kafka:  events are read from the configured topic; fixture events are ignored.
 *
 * The compiled configuration and message box schema always come from the fixture.
 */
public class EngineBootstrap {

    private static final Logger log = LoggerFactory.getLogger(EngineBootstrap.class);

    private final CockpitConfig config;
    private final DocumentStore documentStore;

    public EngineBootstrap(CockpitConfig config, DocumentStore documentStore) {
        this.config = config;
        this.documentStore = documentStore;
    }

    public EventEngine start() {
        EngineFixture fixture = config.fixture().path()
                .map(path -> EngineFixtureLoader.load(path).getOrThrow())
                .orElseGet(() -> {
                    log.warn("No cockpit.fixture.path configured, starting with an empty engine configuration");
                    return new EngineFixture(new CompiledConfig(Map.of(), Map.of(), Map.of(), Map.of(), Map.of()),
                            Map.of(), List.of());
                });

        return config.eventStore().type() == EventStoreType.KAFKA
                ? startWithKafka(fixture)
                : startInMemory(fixture);
    }

    private EventEngine startInMemory(EngineFixture fixture) {
        InMemoryEventStore store = new InMemoryEventStore();
        Set<AggregateRef> seeded = EngineFixtureLoader.seed(fixture, store).getOrThrow();

        EventEngine engine = engine(fixture, store);
        AggregateStateProjection projection = new AggregateStateProjection(engine, documentStore);
        for (AggregateRef ref : seeded) {
            projection.project(ref.aggregateType(), ref.aggregateId()).getOrThrow();
        }

        log.info("In-memory event engine started: {} aggregates seeded", seeded.size());
        return engine;
    }

    private EventEngine startWithKafka(EngineFixture fixture) {
        var kafka = config.eventStore().kafka();
        if (!fixture.events().isEmpty()) {
            log.warn("Ignoring {} fixture events, reading events from Kafka topic {}", fixture.events().size(), kafka.topic());
        }
        log.info("Kafka event engine started: {} @ {}", kafka.topic(), kafka.bootstrapServers());
        return engine(fixture, KafkaEventStore.create(kafka));
    }

    private static EventEngine engine(EngineFixture fixture, EventStore store) {
        return ReplayingEventEngine.create(c -> c
                .config(fixture.config())
                .messageBoxSchema(fixture.messageBoxSchema())
                .eventStore(store));
    }
}
