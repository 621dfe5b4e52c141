package org.dxworks.uischema.analyzer;

public enum AnalysisStage {
    ACCEPT_INPUT("accept-input"),
    DETECT_PLATFORM("detect-platform"),
    PARSE("parse"),
    WALK_SYNTAX("walk-syntax"),
    READ_RUNTIME_SHAPE("read-runtime-shape"),
    DEDUPLICATE("deduplicate"),
    ASSEMBLE("assemble");

    private final String label;

    AnalysisStage(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }
}
