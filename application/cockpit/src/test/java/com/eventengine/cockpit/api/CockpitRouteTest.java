package com.eventengine.cockpit.api;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CockpitRouteTest {

    @ParameterizedTest
    @CsvSource({
            "/api/ee-cockpit/schema, SCHEMA",
            "/api/ee-cockpit/load-aggregates, LOAD_AGGREGATES",
            "/api/ee-cockpit/load-aggregate, LOAD_AGGREGATE",
            "/api/ee-cockpit/load-aggregate-events, LOAD_AGGREGATE_EVENTS",
            "/somewhere/else/schema, SCHEMA",
            "schema, SCHEMA"
    })
    void resolvesByTrailingSegment(String path, CockpitRoute expected) {
        assertThat(CockpitRoute.resolve(path)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"/api/ee-cockpit/drop-aggregates", "/api/ee-cockpit/schema/", "/api/ee-cockpit/SCHEMA"})
    void unknownSegmentIsUnresolved(String path) {
        assertThatThrownBy(() -> CockpitRoute.resolve(path))
                .isInstanceOf(UnresolvedRouteException.class)
                .hasMessageContaining("compatible version of the cockpit client");
    }

    @Test
    void unresolvedRouteNamesTheSegment() {
        assertThatThrownBy(() -> CockpitRoute.resolve("/api/ee-cockpit/replay"))
                .isInstanceOfSatisfying(UnresolvedRouteException.class,
                        e -> assertThat(e.segment()).isEqualTo("replay"))
                .hasMessageStartingWith("Could not resolve replay to a handler.");
    }

    @Test
    void trailingSegmentOfEdgeCases() {
        assertThat(CockpitRoute.trailingSegment(null)).isEmpty();
        assertThat(CockpitRoute.trailingSegment("/a/b/")).isEmpty();
        assertThat(CockpitRoute.trailingSegment("/a/b")).isEqualTo("b");
    }
}
