package com.github.salilvnair.proofgen.template;

import com.github.salilvnair.proofgen.engine.exception.TemplateCompileException;
import com.github.salilvnair.proofgen.engine.query.QueryBindings;

public interface TemplateRenderer {

    CompiledTemplate compile(String name, String template) throws TemplateCompileException;

    String render(CompiledTemplate compiled, QueryBindings bindings);
}
