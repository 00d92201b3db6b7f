package com.eventengine.platform.store;

import java.util.Map;

/**
 * Predicate over stored documents.
 */
@FunctionalInterface
public interface Filter {

    boolean matches(Map<String, Object> document);
}
