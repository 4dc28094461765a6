package com.github.salilvnair.proofgen.engine.validate;

import java.util.List;

public interface OutputValidator {

    /**
     * @return human readable issues; empty when the content is acceptable
     */
    List<String> validate(String path, String language, String content);
}
