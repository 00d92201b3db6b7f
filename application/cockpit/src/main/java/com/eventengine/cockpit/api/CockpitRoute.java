package com.eventengine.cockpit.api;

import java.util.Arrays;

/**
 * Cockpit operations, addressed by the last segment of the request path.
 */
public enum CockpitRoute {
    SCHEMA("schema"),
    LOAD_AGGREGATES("load-aggregates"),
    LOAD_AGGREGATE("load-aggregate"),
    LOAD_AGGREGATE_EVENTS("load-aggregate-events");

    private final String segment;

    CockpitRoute(String segment) {
        this.segment = segment;
    }

    public String segment() {
        return segment;
    }

    /**
     * Resolve a request path such as {@code /api/ee-cockpit/load-aggregate}.
     *
     * @throws UnresolvedRouteException if the last segment matches no operation
     */
    public static CockpitRoute resolve(String path) {
        String segment = trailingSegment(path);
        return Arrays.stream(values())
                .filter(route -> route.segment.equals(segment))
                .findFirst()
                .orElseThrow(() -> new UnresolvedRouteException(segment));
    }

    static String trailingSegment(String path) {
        if (path == null) {
            return "";
        }
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }
}
