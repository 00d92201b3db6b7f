package com.eventengine.cockpit.api;

import org.springframework.util.MultiValueMap;

import java.util.OptionalInt;

/**
 * Typed access to request query parameters. Blank values count as absent.
 */
final class QueryParams {

    private final MultiValueMap<String, String> params;

    QueryParams(MultiValueMap<String, String> params) {
        this.params = params;
    }

    String required(String name) {
        String value = params.getFirst(name);
        if (value == null || value.isBlank()) {
            throw new MissingParameterException(name);
        }
        return value;
    }

    int requiredInt(String name) {
        return parseNonNegative(name, required(name));
    }

    OptionalInt optionalInt(String name) {
        String value = params.getFirst(name);
        if (value == null || value.isBlank()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(parseNonNegative(name, value));
    }

    private static int parseNonNegative(String name, String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                throw new InvalidParameterException(name, value, "a non-negative integer");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(name, value, "an integer");
        }
    }
}
