package com.github.salilvnair.proofgen.engine.exception;

import lombok.Getter;

/**
 * Collaborator failure that can point at a position inside a source file.
 * Line and column are 1-based; {@code -1} when the collaborator could not tell.
 */
@Getter
public abstract class SourceLocatedException extends ProofGenException {

    private final String source;
    private final long line;
    private final long column;

    protected SourceLocatedException(ProofGenErrorCode code, String source, long line, long column, String detail, Throwable cause) {
        super(code, format(source, line, column, detail), cause);
        this.source = source;
        this.line = line;
        this.column = column;
    }

    public boolean hasLocation() {
        return line > 0;
    }

    private static String format(String source, long line, long column, String detail) {
        StringBuilder sb = new StringBuilder(source == null ? "<unknown>" : source);
        if (line > 0) {
            sb.append(':').append(line);
            if (column > 0) {
                sb.append(':').append(column);
            }
        }
        return sb.append(": ").append(detail).toString();
    }
}
