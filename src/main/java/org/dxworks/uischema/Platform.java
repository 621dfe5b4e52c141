package org.dxworks.uischema;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Platform {
    REACT("react"),
    REACT_NATIVE("react-native"),
    VUE("vue"),
    ANGULAR("angular"),
    SVELTE("svelte"),
    VANILLA("vanilla"),
    UNIVERSAL("universal");

    private final String id;

    Platform(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
