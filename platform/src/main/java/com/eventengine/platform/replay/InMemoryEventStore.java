package com.eventengine.platform.replay;

import com.eventengine.platform.base.Result;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * EventStore kept in memory, one stream per aggregate instance.
 *
 * Used for local runs (seeded from the engine fixture) and in tests.
 */
public class InMemoryEventStore implements EventStore {

    private final Map<StreamKey, List<StoredEvent>> streams = new ConcurrentHashMap<>();

    private record StreamKey(String aggregateType, String aggregateId) {}

    /**
     * Append an event to its aggregate stream.
     * Fails if the stream already holds an event with the same version.
     */
    public Result<StoredEvent> append(StoredEvent event) {
        return Result.of(() -> {
            var key = new StreamKey(event.aggregateType(), event.aggregateId());
            streams.compute(key, (k, existing) -> {
                List<StoredEvent> stream = existing != null ? new ArrayList<>(existing) : new ArrayList<>();
                boolean duplicate = stream.stream()
                        .anyMatch(e -> e.aggregateVersion() == event.aggregateVersion());
                if (duplicate) {
                    throw new IllegalStateException("Aggregate " + k.aggregateType() + "/" + k.aggregateId()
                            + " already has an event at version " + event.aggregateVersion());
                }
                stream.add(event);
                stream.sort(Comparator.comparingInt(StoredEvent::aggregateVersion));
                return List.copyOf(stream);
            });
            return event;
        });
    }

    @Override
    public Result<List<StoredEvent>> loadAggregateEvents(String aggregateType, String aggregateId) {
        return Result.success(streams.getOrDefault(new StreamKey(aggregateType, aggregateId), List.of()));
    }

    @Override
    public boolean isHealthy() {
        return true;
    }
}
