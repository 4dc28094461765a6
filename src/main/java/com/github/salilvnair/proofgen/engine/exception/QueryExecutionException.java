package com.github.salilvnair.proofgen.engine.exception;

public class QueryExecutionException extends SourceLocatedException {

    public QueryExecutionException(String source, long line, long column, String detail) {
        super(ProofGenErrorCode.QUERY_EXECUTION_FAILED, source, line, column, detail, null);
    }

    public QueryExecutionException(String source, long line, long column, String detail, Throwable cause) {
        super(ProofGenErrorCode.QUERY_EXECUTION_FAILED, source, line, column, detail, cause);
    }

    public QueryExecutionException(String source, String detail, Throwable cause) {
        super(ProofGenErrorCode.QUERY_EXECUTION_FAILED, source, -1, -1, detail, cause);
    }
}
