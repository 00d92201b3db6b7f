package com.eventengine.cockpit.schema;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

@JsonPropertyOrder({"queryName", "schema"})
public record QuerySchema(String queryName, Map<String, Object> schema) {}
