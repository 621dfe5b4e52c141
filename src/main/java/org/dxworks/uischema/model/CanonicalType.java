package org.dxworks.uischema.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Value shape of a component property, independent of the source language's own type system.
 */
public enum CanonicalType {
    TEXT,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT,
    FUNCTION,
    ELEMENT,
    COLOR,
    DIMENSION,
    RESOURCE;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
