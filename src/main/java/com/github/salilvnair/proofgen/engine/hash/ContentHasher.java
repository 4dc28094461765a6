package com.github.salilvnair.proofgen.engine.hash;

import java.nio.charset.StandardCharsets;

/**
 * Content addressing used for inputs, outputs, fingerprints and receipt ids.
 * Digests are lowercase hex.
 */
public interface ContentHasher {

    String hash(byte[] content);

    default String hash(String content) {
        return hash((content == null ? "" : content).getBytes(StandardCharsets.UTF_8));
    }

    String algorithm();
}
