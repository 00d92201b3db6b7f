package com.eventengine.cockpit.schema;

import java.util.Locale;

/**
 * The compiled configuration references a name that is missing from its schema map.
 */
public class ConfigurationIntegrityException extends RuntimeException {

    public enum Kind {
        COMMAND,
        EVENT
    }

    private final Kind kind;
    private final String name;
    private final String aggregateType;

    public ConfigurationIntegrityException(Kind kind, String name, String aggregateType, String detail) {
        super("Inconsistent engine configuration for aggregate " + aggregateType + ": "
                + kind.name().toLowerCase(Locale.ROOT) + " " + name + " " + detail);
        this.kind = kind;
        this.name = name;
        this.aggregateType = aggregateType;
    }

    public Kind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    public String aggregateType() {
        return aggregateType;
    }
}
