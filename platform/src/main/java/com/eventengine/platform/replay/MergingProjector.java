package com.eventengine.platform.replay;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default projector: state is a JSON-like map and every event payload is merged
 * into it, later keys overwriting earlier ones.
 */
public class MergingProjector implements AggregateProjector<Map<String, Object>> {

    @Override
    public Map<String, Object> initialState() {
        return Map.of();
    }

    @Override
    public Map<String, Object> apply(Map<String, Object> state, StoredEvent event) {
        Map<String, Object> next = new LinkedHashMap<>(state);
        next.putAll(event.payload());
        return Collections.unmodifiableMap(next);
    }

    @Override
    public Map<String, Object> stateToMap(Map<String, Object> state) {
        return state;
    }
}
