package com.eventengine.platform.engine;

import com.eventengine.platform.base.Result;
import com.eventengine.platform.replay.InMemoryEventStore;
import com.eventengine.platform.serialization.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Loads an {@link EngineFixture} and seeds stores from it.
 *
 * Locations starting with {@code classpath:} are read from the classpath,
 * everything else from the file system.
 */
public final class EngineFixtureLoader {

    private static final Logger log = LoggerFactory.getLogger(EngineFixtureLoader.class);
    private static final String CLASSPATH_PREFIX = "classpath:";

    private EngineFixtureLoader() {} // Utility class

    public static Result<EngineFixture> load(String location) {
        return Result.of(() -> {
            try (InputStream in = open(location)) {
                return JsonCodec.decode(in, EngineFixture.class).getOrThrow();
            }
        }).onSuccess(f -> log.info("Loaded engine fixture {}: {} aggregates, {} commands, {} events seeded",
                location, f.config().aggregateDescriptions().size(), f.config().commandMap().size(), f.events().size()));
    }

    /**
     * Append all fixture events to the store.
     *
     * @return The distinct aggregates that received events, in first-seen order
     */
    public static Result<Set<AggregateRef>> seed(EngineFixture fixture, InMemoryEventStore store) {
        Set<AggregateRef> aggregates = new LinkedHashSet<>();
        for (EngineFixture.SeedEvent seed : fixture.events()) {
            var appended = Result.of(seed::toStoredEvent).flatMap(store::append);
            if (appended.isFailure()) {
                return Result.failure(appended.error().orElseThrow());
            }
            aggregates.add(new AggregateRef(seed.aggregateType(), seed.aggregateId()));
        }
        return Result.success(aggregates);
    }

    private static InputStream open(String location) throws Exception {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length()).replaceFirst("^/", "");
            InputStream in = EngineFixtureLoader.class.getClassLoader().getResourceAsStream(resource);
            if (in == null) {
                throw new FileNotFoundException("Classpath resource not found: " + resource);
            }
            return in;
        }
        return Files.newInputStream(Path.of(location));
    }
}
