package com.eventengine.platform.replay;

import java.util.Map;

/**
 * Folds an aggregate's events into its state.
 *
 * This lets the replay infrastructure work with any aggregate type
 * without coupling to the domain.
 *
 * @param <S> The state type
 */
public interface AggregateProjector<S> {

    /**
     * State before the first event.
     */
    S initialState();

    /**
     * Apply an event to a state, producing new state.
     */
    S apply(S state, StoredEvent event);

    /**
     * Convert state to a map for serialization.
     */
    Map<String, Object> stateToMap(S state);
}
