package com.github.salilvnair.proofgen.engine.workspace;

import lombok.Builder;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of a workspace taken at discovery time. Every later stage reads inputs from here,
 * never from the live filesystem.
 */
@Getter
@Builder
public class WorkspaceContext {

    private final Path root;
    private final String projectName;
    private final String generatedRoot;
    private final InputDescriptor config;
    private final List<InputDescriptor> inputs;
    private final List<GenerationRule> rules;
    /** Ontology paths as written in {@code [generation].ontologies}, unsafe ones included. */
    private final List<String> declaredOntologies;
    private final String fingerprint;
    private final GuardSettings guardSettings;
    private final boolean validateOutputs;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, byte[]> contents;

    public List<InputDescriptor> inputsOf(InputKind kind) {
        return inputs.stream().filter(i -> i.kind() == kind).toList();
    }

    public Optional<InputDescriptor> descriptor(String path) {
        String key = key(path);
        return inputs.stream().filter(i -> i.path().equals(key)).findFirst();
    }

    public boolean isLoaded(String path) {
        return contents.containsKey(key(path));
    }

    public byte[] bytes(String path) {
        byte[] content = contents.get(key(path));
        return content == null ? null : content.clone();
    }

    public String text(String path) {
        byte[] content = contents.get(key(path));
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    public List<String> getDeclaredOntologies() {
        return declaredOntologies == null ? List.of() : declaredOntologies;
    }

    public List<String> plannedOutputs() {
        return rules.stream().map(GenerationRule::output).toList();
    }

    /** Ontology hashes sorted, as they enter the fingerprint. */
    public List<String> ontologyHashes() {
        return inputsOf(InputKind.ONTOLOGY).stream()
                .map(InputDescriptor::contentHash)
                .sorted(Comparator.naturalOrder())
                .toList();
    }

    public long totalInputBytes() {
        return inputs.stream().mapToLong(InputDescriptor::sizeBytes).sum();
    }

    // inputs are keyed by their normalized relative path
    private static String key(String path) {
        String normalized = WorkspacePaths.normalize(path);
        return normalized == null ? path : normalized;
    }
}
