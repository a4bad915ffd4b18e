package com.fourinarow.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A required payload field and the JSON shape it must have.
 */
public final class FieldSpec {

    public enum Kind {
        TEXT,
        STRING,
        INTEGER
    }

    private final String name;
    private final Kind kind;

    private FieldSpec(String name, Kind kind) {
        this.name = name;
        this.kind = kind;
    }

    public static FieldSpec text(String name) {
        return new FieldSpec(name, Kind.TEXT);
    }

    /**
     * A string field that may be empty or blank.
     */
    public static FieldSpec string(String name) {
        return new FieldSpec(name, Kind.STRING);
    }

    public static FieldSpec integer(String name) {
        return new FieldSpec(name, Kind.INTEGER);
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Text fields must be non-blank strings, string fields any string, and
     * integer fields integral numbers that fit an int.
     */
    public boolean accepts(JsonNode value) {
        if (value == null || value.isNull()) {
            return false;
        }
        switch (kind) {
            case TEXT:
                return value.isTextual() && !value.asText().isBlank();
            case STRING:
                return value.isTextual();
            case INTEGER:
                return value.isIntegralNumber() && value.canConvertToInt();
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return name + ":" + kind.name().toLowerCase();
    }
}
