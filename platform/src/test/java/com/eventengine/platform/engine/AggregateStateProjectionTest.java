package com.eventengine.platform.engine;

import com.eventengine.platform.base.Result;
import com.eventengine.platform.store.DocumentStore;
import com.eventengine.platform.store.InMemoryDocumentStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AggregateStateProjectionTest {

    private static final CompiledConfig CONFIG = new CompiledConfig(Map.of(), Map.of(), Map.of(), Map.of(),
            Map.of("Todo", new AggregateDescription("Todo", "todoId", "todo_stream", "todos", "mode_e_s")));

    @Mock
    private EventEngine engine;

    @Test
    void upsertsStateIntoAggregateCollection() {
        when(engine.compileCacheableConfig()).thenReturn(CONFIG);
        when(engine.loadAggregateState("Todo", "t-1")).thenReturn(Result.success(Map.of("text", "Ship it")));
        InMemoryDocumentStore documents = new InMemoryDocumentStore();

        new AggregateStateProjection(engine, documents).project("Todo", "t-1").getOrThrow();

        assertThat(documents.getDoc("todos", "t-1").getOrThrow()).contains(Map.of("text", "Ship it"));
    }

    @Test
    void unknownTypeFailsWithoutLoadingState(@Mock DocumentStore documents) {
        when(engine.compileCacheableConfig()).thenReturn(CONFIG);

        var result = new AggregateStateProjection(engine, documents).project("Invoice", "i-1");

        assertThat(result.error()).get().isInstanceOf(IllegalArgumentException.class);
        verify(engine, never()).loadAggregateState(anyString(), anyString());
        verify(documents, never()).upsertDoc(anyString(), anyString(), any());
    }

    @Test
    void missingAggregateIsNotStored(@Mock DocumentStore documents) {
        when(engine.compileCacheableConfig()).thenReturn(CONFIG);
        when(engine.loadAggregateState("Todo", "t-9"))
                .thenReturn(Result.failure(new AggregateNotFoundException("Todo", "t-9")));

        var result = new AggregateStateProjection(engine, documents).project("Todo", "t-9");

        assertThat(result.error()).get().isInstanceOf(AggregateNotFoundException.class);
        verify(documents, never()).upsertDoc(anyString(), anyString(), any());
    }
}
