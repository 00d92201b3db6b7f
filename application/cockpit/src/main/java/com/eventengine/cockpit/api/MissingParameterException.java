package com.eventengine.cockpit.api;

public class MissingParameterException extends RuntimeException {

    public MissingParameterException(String name) {
        super("Missing required query parameter " + name);
    }
}
