package com.eventengine.cockpit.facade;

import com.eventengine.platform.base.Result;
import com.eventengine.platform.engine.AggregateDescription;
import com.eventengine.platform.engine.CompiledConfig;
import com.eventengine.platform.engine.EventEngine;
import com.eventengine.platform.replay.StoredEvent;
import com.eventengine.platform.store.AnyFilter;
import com.eventengine.platform.store.DocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AggregateReadFacadeTest {

    private static final CompiledConfig CONFIG = new CompiledConfig(Map.of(), Map.of(), Map.of(), Map.of(),
            Map.of("User", new AggregateDescription("User", "userId", "user_stream", "users", "mode_e_s")));

    @Mock
    private EventEngine engine;

    @Mock
    private DocumentStore documents;

    private AggregateReadFacade facade;

    @BeforeEach
    void setUp() {
        when(engine.compileCacheableConfig()).thenReturn(CONFIG);
        facade = new AggregateReadFacade(engine, documents);
    }

    @Test
    void unknownTypeFailsBeforeAnyStoreAccess() {
        var result = facade.listAggregates("Invoice", 10);

        assertThat(result.error()).get()
                .isInstanceOf(UnknownAggregateTypeException.class)
                .extracting(Throwable::getMessage)
                .isEqualTo("Unknown aggregate type Invoice");
        verifyNoInteractions(documents);
    }

    @Test
    void unknownTypeFailsBeforeAnyReplay() {
        assertThat(facade.loadAggregateState("Invoice", "i-1", OptionalInt.empty()).isFailure()).isTrue();
        assertThat(facade.loadAggregateEvents("Invoice", "i-1").isFailure()).isTrue();

        verify(engine, never()).loadAggregateState(any(), any());
        verify(engine, never()).loadAggregateEvents(any(), any());
        verifyNoInteractions(documents);
    }

    @Test
    void listAggregatesReadsDescriptionCollection() {
        List<Map<String, Object>> docs = List.of(Map.of("userId", "u-1"));
        when(documents.filterDocs(eq("users"), any(AnyFilter.class), eq(0), eq(5))).thenReturn(Result.success(docs));

        assertThat(facade.listAggregates("User", 5).getOrThrow()).isEqualTo(docs);
    }

    @Test
    void versionSelectsTruncatedReplay() {
        when(engine.loadAggregateStateUntil("User", "u-1", 1)).thenReturn(Result.success(Map.of("username", "alice")));
        when(engine.loadAggregateState("User", "u-1")).thenReturn(Result.success(Map.of("username", "alice.w")));

        assertThat(facade.loadAggregateState("User", "u-1", OptionalInt.of(1)).getOrThrow())
                .containsEntry("username", "alice");
        assertThat(facade.loadAggregateState("User", "u-1", OptionalInt.empty()).getOrThrow())
                .containsEntry("username", "alice.w");
    }

    @Test
    void eventsAreMappedToRecords() {
        StoredEvent event = new StoredEvent("e-1", "UserWasRegistered", "User", "u-1", 1,
                Map.of("username", "alice"), Map.of("causationName", "RegisterUser"),
                Instant.parse("2024-03-01T09:15:00Z"));
        when(engine.loadAggregateEvents("User", "u-1")).thenReturn(Result.success(List.of(event)));

        assertThat(facade.loadAggregateEvents("User", "u-1").getOrThrow()).containsExactly(new AggregateEventRecord(
                "UserWasRegistered", 1, "2024-03-01T09:15:00+00:00",
                Map.of("causationName", "RegisterUser"), Map.of("username", "alice")));
    }
}
