package org.dxworks.uischema.analyzer;

/**
 * The input could not be turned into a traversable syntax tree.
 */
public class ParseFailureException extends SchemaAnalysisException {

    public ParseFailureException(String message) {
        super(AnalysisStage.PARSE, message);
    }
}
