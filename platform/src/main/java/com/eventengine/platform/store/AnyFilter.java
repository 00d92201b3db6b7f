package com.eventengine.platform.store;

import java.util.Map;

/**
 * Matches every document.
 */
public record AnyFilter() implements Filter {

    @Override
    public boolean matches(Map<String, Object> document) {
        return true;
    }
}
