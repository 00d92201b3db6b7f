package com.eventengine.cockpit.facade;

import com.eventengine.platform.replay.StoredEvent;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * One entry of an aggregate's event history.
 *
 * @param createdAt ISO-8601 timestamp with numeric offset, e.g. {@code 2024-03-01T09:15:00+00:00}
 * @param payload The raw event payload
 */
@JsonPropertyOrder({"eventName", "aggregateVersion", "createdAt", "metadata", "payload"})
public record AggregateEventRecord(
        String eventName,
        int aggregateVersion,
        String createdAt,
        Map<String, Object> metadata,
        Map<String, Object> payload
) {
    static final DateTimeFormatter CREATED_AT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxxx").withZone(ZoneOffset.UTC);

    public static AggregateEventRecord from(StoredEvent event) {
        return new AggregateEventRecord(
                event.eventName(),
                event.aggregateVersion(),
                CREATED_AT_FORMAT.format(event.createdAt()),
                event.metadata(),
                event.payload());
    }
}
