package com.github.salilvnair.proofgen.engine.exception;

public class TemplateCompileException extends SourceLocatedException {

    public TemplateCompileException(String source, long line, long column, String detail) {
        super(ProofGenErrorCode.TEMPLATE_COMPILE_FAILED, source, line, column, detail, null);
    }

    public TemplateCompileException(String source, long line, long column, String detail, Throwable cause) {
        super(ProofGenErrorCode.TEMPLATE_COMPILE_FAILED, source, line, column, detail, cause);
    }

    public TemplateCompileException(String source, String detail, Throwable cause) {
        super(ProofGenErrorCode.TEMPLATE_COMPILE_FAILED, source, -1, -1, detail, cause);
    }
}
