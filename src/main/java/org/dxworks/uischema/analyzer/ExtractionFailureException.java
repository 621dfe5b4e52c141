package org.dxworks.uischema.analyzer;

/**
 * A single extractor failed while processing one node.
 */
public class ExtractionFailureException extends SchemaAnalysisException {
    private final String nodeKind;
    private final int line;

    public ExtractionFailureException(String nodeKind, int line, Throwable cause) {
        super(AnalysisStage.WALK_SYNTAX,
                "Extractor failed on " + nodeKind + " at line " + line + ": " + cause.getMessage(), cause);
        this.nodeKind = nodeKind;
        this.line = line;
    }

    public String getNodeKind() {
        return nodeKind;
    }

    public int getLine() {
        return line;
    }
}
