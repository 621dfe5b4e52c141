package org.dxworks.uischema.model;

public class PropertyCandidate {
    public final String name;
    public final String rawType;
    public final CanonicalType canonicalType;
    public final boolean required;
    public final CandidateOrigin origin;
    public final Object defaultValue;

    public PropertyCandidate(String name, String rawType, CanonicalType canonicalType, boolean required,
                             CandidateOrigin origin, Object defaultValue) {
        this.name = name;
        this.rawType = rawType;
        this.canonicalType = canonicalType;
        this.required = required;
        this.origin = origin;
        this.defaultValue = defaultValue;
    }

    @Override
    public String toString() {
        return origin + ":" + name + "(" + rawType + (required ? "" : "?") + ")";
    }
}
