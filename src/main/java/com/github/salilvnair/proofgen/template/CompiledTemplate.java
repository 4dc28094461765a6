package com.github.salilvnair.proofgen.template;

import java.util.List;

/**
 * A template that passed the syntax check. {@code source} is the normalized Thymeleaf TEXT form.
 */
public record CompiledTemplate(String name, String source, List<String> expressions) {

    public CompiledTemplate {
        expressions = List.copyOf(expressions);
    }
}
