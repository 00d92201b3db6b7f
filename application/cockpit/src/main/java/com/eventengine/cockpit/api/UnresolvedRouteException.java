package com.eventengine.cockpit.api;

/**
 * The trailing path segment does not name a cockpit operation.
 */
public class UnresolvedRouteException extends RuntimeException {

    private final String segment;

    public UnresolvedRouteException(String segment) {
        super("Could not resolve " + segment + " to a handler. "
                + "Please make sure that you are using a compatible version of the cockpit client.");
        this.segment = segment;
    }

    public String segment() {
        return segment;
    }
}
