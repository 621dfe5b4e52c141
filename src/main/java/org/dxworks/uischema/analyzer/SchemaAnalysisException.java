package org.dxworks.uischema.analyzer;

/**
 * Base class of failures raised inside the analysis pipeline. Never escapes {@link SchemaAnalyzer#analyze}.
 */
public class SchemaAnalysisException extends RuntimeException {
    private final AnalysisStage stage;

    public SchemaAnalysisException(AnalysisStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public SchemaAnalysisException(AnalysisStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public AnalysisStage getStage() {
        return stage;
    }
}
