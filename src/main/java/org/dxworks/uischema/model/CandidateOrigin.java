package org.dxworks.uischema.model;

/**
 * Where a candidate was found. Lower precedence wins when candidates share a name.
 */
public enum CandidateOrigin {
    INTERFACE(0),
    TYPE_ALIAS(0),
    RUNTIME_METADATA(0),
    DESTRUCTURE(1),
    MARKUP_ATTRIBUTE(2);

    private final int precedence;

    CandidateOrigin(int precedence) {
        this.precedence = precedence;
    }

    public boolean outranks(CandidateOrigin other) {
        return precedence < other.precedence;
    }
}
