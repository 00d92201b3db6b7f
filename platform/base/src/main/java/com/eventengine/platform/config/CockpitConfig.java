package com.eventengine.platform.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

import static com.eventengine.platform.config.ConfigAccessor.*;

/**
 * Type-safe access to cockpit configuration (HOCON, rooted at {@code cockpit}).
 *
 * Uses record classes for immutable, concise config objects.
 * All nested configs are records with static from(Config) factories.
 *
 * Example:
 * <pre>
 *   var config = CockpitConfig.load();
 *   if (config.eventStore().type() == EventStoreType.KAFKA) { ... }
 * </pre>
 */
public final class CockpitConfig {

    private static final String ROOT = "cockpit";

    private final EventStoreConfig eventStore;
    private final FixtureConfig fixture;

    public enum EventStoreType {
        MEMORY,
        KAFKA;

        public static EventStoreType fromString(String value) {
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "memory", "in-memory" -> MEMORY;
                case "kafka" -> KAFKA;
                default -> throw new IllegalArgumentException("Unknown event store type: " + value);
            };
        }
    }

    private CockpitConfig(Config config) {
        Config root = config.getConfig(ROOT);
        this.eventStore = EventStoreConfig.from(section(root, "event-store"));
        this.fixture = FixtureConfig.from(section(root, "fixture"));
    }

    /**
     * Load from application.conf / reference.conf on the classpath.
     */
    public static CockpitConfig load() {
        return new CockpitConfig(ConfigFactory.load());
    }

    /**
     * Build from an already resolved config, e.g. {@code ConfigFactory.parseString(...)} in tests.
     */
    public static CockpitConfig from(Config config) {
        return new CockpitConfig(config.withFallback(ConfigFactory.defaultReference()).resolve());
    }

    public EventStoreConfig eventStore() { return eventStore; }
    public FixtureConfig fixture() { return fixture; }

    // =========================================================================
    // Record: EventStoreConfig
    // =========================================================================

    public record EventStoreConfig(EventStoreType type, KafkaConfig kafka) {
        public static EventStoreConfig from(Config c) {
            return new EventStoreConfig(
                EventStoreType.fromString(string(c, "type", "memory")),
                KafkaConfig.from(section(c, "kafka"))
            );
        }
    }

    // =========================================================================
    // Record: KafkaConfig
    // =========================================================================

    public record KafkaConfig(
        String bootstrapServers,
        String topic,
        Duration pollTimeout,
        int maxEventsToScan
    ) {
        public static KafkaConfig from(Config c) {
            return new KafkaConfig(
                string(c, "bootstrap-servers", "localhost:9092"),
                string(c, "topic", "aggregate-events"),
                duration(c, "poll-timeout", Duration.ofMillis(500)),
                intVal(c, "max-events-to-scan", 100_000)
            );
        }
    }

    // =========================================================================
    // Record: FixtureConfig
    // =========================================================================

    /**
     * Location of the engine fixture. Paths starting with {@code classpath:} are
     * resolved against the classpath, anything else against the file system.
     */
    public record FixtureConfig(Optional<String> path) {
        public static FixtureConfig from(Config c) {
            return new FixtureConfig(nonBlankString(c, "path"));
        }
    }
}
