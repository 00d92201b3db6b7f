package com.eventengine.cockpit.schema;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

@JsonPropertyOrder({"eventName", "schema"})
public record AggregateEvent(String eventName, Map<String, Object> schema) {}
