package org.dxworks.uischema.model;

import java.util.List;

public class EventCandidate {
    public final String name;
    public final List<String> parameterHints;
    public final CandidateOrigin origin;

    public EventCandidate(String name, List<String> parameterHints, CandidateOrigin origin) {
        this.name = name;
        this.parameterHints = parameterHints == null ? List.of() : List.copyOf(parameterHints);
        this.origin = origin;
    }

    @Override
    public String toString() {
        return origin + ":" + name + parameterHints;
    }
}
