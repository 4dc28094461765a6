package com.github.salilvnair.proofgen.engine.workspace;

import com.github.salilvnair.proofgen.engine.hash.ContentHasher;
import lombok.experimental.UtilityClass;

import java.nio.file.Path;
import java.util.List;

@UtilityClass
public class WorkspaceFingerprint {

    public static String compute(ContentHasher hasher, Path root, String configHash, List<String> ontologyHashes) {
        StringBuilder material = new StringBuilder()
                .append("root:").append(root.toAbsolutePath().normalize()).append('\n')
                .append("config:").append(configHash).append('\n');
        ontologyHashes.stream().sorted().forEach(h -> material.append("ontology:").append(h).append('\n'));
        return hasher.hash(material.toString());
    }
}
