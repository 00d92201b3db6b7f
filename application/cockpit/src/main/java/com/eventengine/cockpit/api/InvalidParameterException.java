package com.eventengine.cockpit.api;

public class InvalidParameterException extends RuntimeException {

    public InvalidParameterException(String name, String value, String expected) {
        super("Query parameter " + name + " must be " + expected + ", got '" + value + "'");
    }
}
