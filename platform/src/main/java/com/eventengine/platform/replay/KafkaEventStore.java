package com.eventengine.platform.replay;

import com.eventengine.platform.base.Result;
import com.eventengine.platform.config.CockpitConfig.KafkaConfig;
import com.eventengine.platform.serialization.JsonCodec;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Kafka-backed EventStore implementation.
 *
 * Reads aggregate events from a topic for replay. Each record value is a JSON envelope:
 * <pre>
 * {"eventId": "...", "eventName": "UserWasRegistered", "aggregateType": "User",
 *  "aggregateId": "u-1", "aggregateVersion": 1, "createdAt": "2024-01-01T10:00:00+00:00",
 *  "metadata": {...}, "payload": {...}}
 * </pre>
 * The whole topic is scanned per request, so this is meant for debugging tools, not hot paths.
 */
public class KafkaEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventStore.class);

    /** Create from the cockpit Kafka settings. */
    public static KafkaEventStore create(KafkaConfig config) {
        return new KafkaEventStore(config.bootstrapServers(), config.topic(),
                config.pollTimeout(), config.maxEventsToScan());
    }

    private final String bootstrapServers;
    private final String topic;
    private final Duration pollTimeout;
    private final int maxEventsToScan;

    KafkaEventStore(String bootstrapServers, String topic, Duration pollTimeout, int maxEventsToScan) {
        this.bootstrapServers = Objects.requireNonNull(bootstrapServers);
        this.topic = Objects.requireNonNull(topic);
        this.pollTimeout = pollTimeout;
        this.maxEventsToScan = maxEventsToScan;
    }

    // ========================================================================
    // EventStore implementation
    // ========================================================================

    @Override
    public Result<List<StoredEvent>> loadAggregateEvents(String aggregateType, String aggregateId) {
        return scanTopic(event -> event.belongsTo(aggregateType, aggregateId));
    }

    @Override
    public boolean isHealthy() {
        try (var consumer = createConsumer()) {
            consumer.listTopics(Duration.ofSeconds(5));
            return true;
        } catch (Exception e) {
            log.warn("Kafka health check failed: {}", e.getMessage());
            return false;
        }
    }

    // ========================================================================
    // Core scanning
    // ========================================================================

    private Result<List<StoredEvent>> scanTopic(Predicate<StoredEvent> filter) {
        return Result.of(() -> {
            try (var consumer = createConsumer()) {
                var partitions = getPartitions(consumer);
                if (partitions.isEmpty()) {
                    log.warn("No partitions for topic: {}", topic);
                    return List.<StoredEvent>of();
                }

                consumer.assign(partitions);
                consumer.seekToBeginning(partitions);
                var endOffsets = consumer.endOffsets(partitions);

                return pollAllRecords(consumer, partitions, endOffsets)
                        .flatMap(r -> toStoredEvent(r).stream())
                        .filter(filter)
                        .sorted(Comparator.comparingInt(StoredEvent::aggregateVersion))
                        .toList();
            }
        });
    }

    private Stream<ConsumerRecord<String, byte[]>> pollAllRecords(
            KafkaConsumer<String, byte[]> consumer,
            List<TopicPartition> partitions,
            Map<TopicPartition, Long> endOffsets
    ) {
        List<ConsumerRecord<String, byte[]>> allRecords = new ArrayList<>();
        int scanned = 0;

        while (scanned < maxEventsToScan && !reachedEnd(consumer, partitions, endOffsets)) {
            var records = consumer.poll(pollTimeout);
            for (var record : records) {
                allRecords.add(record);
                scanned++;
                if (scanned >= maxEventsToScan) break;
            }
        }

        if (scanned >= maxEventsToScan) {
            log.warn("Stopped scanning {} after {} records", topic, scanned);
        }
        return allRecords.stream();
    }

    private boolean reachedEnd(KafkaConsumer<?, ?> consumer,
                               List<TopicPartition> partitions,
                               Map<TopicPartition, Long> endOffsets) {
        return partitions.stream().allMatch(tp ->
            consumer.position(tp) >= endOffsets.getOrDefault(tp, 0L)
        );
    }

    private List<TopicPartition> getPartitions(KafkaConsumer<?, ?> consumer) {
        return consumer.partitionsFor(topic).stream()
                .map(info -> new TopicPartition(topic, info.partition()))
                .toList();
    }

    // ========================================================================
    // Parsing
    // ========================================================================

    /**
     * Decode one record. Records that are not valid event envelopes are logged and skipped.
     */
    Optional<StoredEvent> toStoredEvent(ConsumerRecord<String, byte[]> record) {
        return JsonCodec.decodeMap(record.value())
                .flatMap(envelope -> Result.of(() -> buildStoredEvent(record, envelope)))
                .fold(
                    err -> {
                        log.warn("Failed to parse event at offset {}: {}", record.offset(), err.getMessage());
                        return Optional.empty();
                    },
                    Optional::of
                );
    }

    private StoredEvent buildStoredEvent(ConsumerRecord<String, byte[]> record, Map<String, Object> envelope) {
        var aggregateId = stringField(envelope, "aggregateId")
                .or(() -> Optional.ofNullable(record.key()).filter(k -> !k.isEmpty()))
                .orElseThrow(() -> new IllegalArgumentException("aggregateId missing"));

        return new StoredEvent(
                stringField(envelope, "eventId").orElse(UUID.nameUUIDFromBytes(
                        (topic + ":" + record.partition() + ":" + record.offset()).getBytes(StandardCharsets.UTF_8)).toString()),
                stringField(envelope, "eventName").orElseThrow(() -> new IllegalArgumentException("eventName missing")),
                stringField(envelope, "aggregateType").orElseThrow(() -> new IllegalArgumentException("aggregateType missing")),
                aggregateId,
                intField(envelope, "aggregateVersion").orElseThrow(() -> new IllegalArgumentException("aggregateVersion missing")),
                mapField(envelope, "payload"),
                mapField(envelope, "metadata"),
                stringField(envelope, "createdAt")
                        .map(KafkaEventStore::parseTimestamp)
                        .orElse(Instant.ofEpochMilli(record.timestamp()))
        );
    }

    private static Instant parseTimestamp(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return Instant.parse(value);
        }
    }

    private static Optional<String> stringField(Map<String, Object> envelope, String field) {
        return Optional.ofNullable(envelope.get(field)).map(Object::toString);
    }

    private static Optional<Integer> intField(Map<String, Object> envelope, String field) {
        Object value = envelope.get(field);
        if (value instanceof Number n) {
            return Optional.of(n.intValue());
        }
        return Optional.ofNullable(value).map(v -> Integer.parseInt(v.toString()));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> mapField(Map<String, Object> envelope, String field) {
        Object value = envelope.get(field);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private KafkaConsumer<String, byte[]> createConsumer() {
        var props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "cockpit-" + UUID.randomUUID());
        props.put(ConsumerConfig.CLIENT_ID_CONFIG, "cockpit-replay");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 1000);
        return new KafkaConsumer<>(props);
    }
}
