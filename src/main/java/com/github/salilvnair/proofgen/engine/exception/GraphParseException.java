package com.github.salilvnair.proofgen.engine.exception;

public class GraphParseException extends SourceLocatedException {

    public GraphParseException(String source, long line, long column, String detail) {
        super(ProofGenErrorCode.GRAPH_PARSE_FAILED, source, line, column, detail, null);
    }

    public GraphParseException(String source, long line, long column, String detail, Throwable cause) {
        super(ProofGenErrorCode.GRAPH_PARSE_FAILED, source, line, column, detail, cause);
    }

    public GraphParseException(String source, String detail, Throwable cause) {
        super(ProofGenErrorCode.GRAPH_PARSE_FAILED, source, -1, -1, detail, cause);
    }
}
