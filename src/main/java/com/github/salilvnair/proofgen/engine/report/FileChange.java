package com.github.salilvnair.proofgen.engine.report;

/**
 * @param before previous content, {@code null} when the file does not exist yet
 */
public record FileChange(String path, String before, String after) {

    public boolean changed() {
        return before == null || !before.equals(after);
    }
}
