package com.github.salilvnair.proofgen.engine.workspace;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.github.salilvnair.proofgen.config.ProofGenConfig;
import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.hash.ContentHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Enumerates the declared inputs of a workspace and snapshots them.
 * <p>
 * Inputs are the config file, ontology files (declared in {@code [generation].ontologies} or every
 * {@code *.ttl} under the ontology directory) and the query and template files referenced by the
 * generation rules. Rules come from {@code [[generation.rules]]}; when none are declared each
 * {@code queries/<stem>.rq} is paired with {@code templates/<stem>[.<ext>].tera}.
 * <p>
 * Referenced paths are keyed by their normalized form. Paths that are not lexically inside the root are
 * left unread; the path-safety guard reports them.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class WorkspaceDiscovery {

    public static final String ONTOLOGY_EXTENSION = ".ttl";
    public static final String QUERY_EXTENSION = ".rq";
    public static final String TEMPLATE_EXTENSION = ".tera";
    public static final String DEFAULT_OUTPUT_EXTENSION = "rs";

    private static final TomlMapper TOML = TomlMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    private final ProofGenConfig config;
    private final ContentHasher hasher;

    public WorkspaceContext discover(Path workspaceRoot) {
        Path root = requireRoot(workspaceRoot);
        ProofGenConfig.Workspace layout = config.getWorkspace();

        Map<String, byte[]> contents = new LinkedHashMap<>();
        List<InputDescriptor> inputs = new ArrayList<>();

        Path configPath = root.resolve(layout.getConfigFile());
        WorkspaceConfigFile configFile = new WorkspaceConfigFile();
        InputDescriptor configDescriptor = null;
        if (Files.isRegularFile(configPath)) {
            byte[] bytes = read(configPath);
            configFile = parseConfig(configPath, bytes);
            configDescriptor = describe(root, configPath, bytes, InputKind.CONFIG);
            contents.put(configDescriptor.path(), bytes);
            inputs.add(configDescriptor);
        }

        for (Path ontology : ontologyFiles(root, configFile)) {
            byte[] bytes = read(ontology);
            InputDescriptor descriptor = describe(root, ontology, bytes, InputKind.ONTOLOGY);
            contents.put(descriptor.path(), bytes);
            inputs.add(descriptor);
        }

        String generatedRoot = Optional.ofNullable(configFile.getGeneration().getOutputDir())
                .filter(s -> !s.isBlank())
                .orElse(layout.getGeneratedRoot());
        List<GenerationRule> rules = resolveRules(root, configFile, generatedRoot);

        TreeSet<String> queries = new TreeSet<>();
        TreeSet<String> templates = new TreeSet<>();
        for (GenerationRule rule : rules) {
            queries.add(rule.query());
            templates.add(rule.template());
        }
        snapshotReferenced(root, queries, InputKind.QUERY, contents, inputs);
        snapshotReferenced(root, templates, InputKind.TEMPLATE, contents, inputs);

        inputs.sort(Comparator.comparing(InputDescriptor::kind).thenComparing(InputDescriptor::path));

        String configHash = configDescriptor == null ? hasher.hash(new byte[0]) : configDescriptor.contentHash();
        List<String> ontologyHashes = inputs.stream()
                .filter(i -> i.kind() == InputKind.ONTOLOGY)
                .map(InputDescriptor::contentHash)
                .toList();
        String fingerprint = WorkspaceFingerprint.compute(hasher, root, configHash, ontologyHashes);

        WorkspaceContext context = WorkspaceContext.builder()
                .root(root)
                .projectName(configFile.getProject().getName())
                .generatedRoot(Optional.ofNullable(WorkspacePaths.normalize(generatedRoot)).orElse(generatedRoot))
                .config(configDescriptor)
                .inputs(List.copyOf(inputs))
                .rules(List.copyOf(rules))
                .declaredOntologies(List.copyOf(configFile.getGeneration().getOntologies()))
                .fingerprint(fingerprint)
                .guardSettings(guardSettings(configFile.getGuards()))
                .validateOutputs(!Boolean.FALSE.equals(configFile.getGeneration().getValidate()))
                .contents(Map.copyOf(contents))
                .build();

        log.info("Discovered workspace {}: {} inputs, {} rules, fingerprint {}",
                root, inputs.size(), rules.size(), fingerprint);
        return context;
    }

    /**
     * Recomputes the workspace fingerprint from the current filesystem.
     * Only the config file and the ontology files participate.
     */
    public String fingerprint(Path workspaceRoot) {
        Path root = requireRoot(workspaceRoot);
        Path configPath = root.resolve(config.getWorkspace().getConfigFile());
        WorkspaceConfigFile configFile = new WorkspaceConfigFile();
        String configHash = hasher.hash(new byte[0]);
        if (Files.isRegularFile(configPath)) {
            byte[] bytes = read(configPath);
            configFile = parseConfig(configPath, bytes);
            configHash = hasher.hash(bytes);
        }
        List<String> ontologyHashes = new ArrayList<>();
        for (Path ontology : ontologyFiles(root, configFile)) {
            ontologyHashes.add(hasher.hash(read(ontology)));
        }
        return WorkspaceFingerprint.compute(hasher, root, configHash, ontologyHashes);
    }

    private Path requireRoot(Path workspaceRoot) {
        if (workspaceRoot == null || !Files.isDirectory(workspaceRoot)) {
            throw new ProofGenException(ProofGenErrorCode.WORKSPACE_NOT_FOUND,
                    "Workspace root does not exist or is not a directory: " + workspaceRoot);
        }
        return workspaceRoot.toAbsolutePath().normalize();
    }

    private WorkspaceConfigFile parseConfig(Path configPath, byte[] bytes) {
        try {
            WorkspaceConfigFile parsed = TOML.readValue(bytes, WorkspaceConfigFile.class);
            return parsed == null ? new WorkspaceConfigFile() : withDefaults(parsed);
        }
        catch (IOException e) {
            throw new ProofGenException(ProofGenErrorCode.WORKSPACE_CONFIG_INVALID,
                    "Invalid workspace config " + configPath + ": " + e.getMessage(), e);
        }
    }

    private WorkspaceConfigFile withDefaults(WorkspaceConfigFile parsed) {
        if (parsed.getProject() == null) {
            parsed.setProject(new WorkspaceConfigFile.Project());
        }
        if (parsed.getGeneration() == null) {
            parsed.setGeneration(new WorkspaceConfigFile.Generation());
        }
        if (parsed.getGeneration().getOntologies() == null) {
            parsed.getGeneration().setOntologies(new ArrayList<>());
        }
        if (parsed.getGeneration().getRules() == null) {
            parsed.getGeneration().setRules(new ArrayList<>());
        }
        if (parsed.getGuards() == null) {
            parsed.setGuards(new WorkspaceConfigFile.Guards());
        }
        return parsed;
    }

    private List<Path> ontologyFiles(Path root, WorkspaceConfigFile configFile) {
        List<String> declared = configFile.getGeneration().getOntologies();
        if (declared != null && !declared.isEmpty()) {
            TreeSet<String> normalized = new TreeSet<>();
            for (String path : declared) {
                if (!WorkspacePaths.isSafe(root, path)) {
                    log.warn("Ontology outside workspace root left unread: {}", path);
                    continue;
                }
                normalized.add(WorkspacePaths.normalize(path));
            }
            List<Path> files = new ArrayList<>();
            for (String path : normalized) {
                Path file = root.resolve(path);
                if (!Files.isRegularFile(file)) {
                    throw new ProofGenException(ProofGenErrorCode.INPUT_NOT_FOUND,
                            "Declared ontology does not exist: " + path);
                }
                files.add(file);
            }
            return files;
        }
        return listFiles(root.resolve(config.getWorkspace().getOntologyDir()), ONTOLOGY_EXTENSION);
    }

    private List<GenerationRule> resolveRules(Path root, WorkspaceConfigFile configFile, String generatedRoot) {
        List<WorkspaceConfigFile.Rule> declared = configFile.getGeneration().getRules();
        if (declared != null && !declared.isEmpty()) {
            List<GenerationRule> rules = new ArrayList<>();
            for (int i = 0; i < declared.size(); i++) {
                WorkspaceConfigFile.Rule rule = declared.get(i);
                if (isBlank(rule.getQuery()) || isBlank(rule.getTemplate()) || isBlank(rule.getOutput())) {
                    throw new ProofGenException(ProofGenErrorCode.WORKSPACE_CONFIG_INVALID,
                            "Generation rule #" + (i + 1) + " must declare query, template and output");
                }
                String name = isBlank(rule.getName()) ? "rule-" + (i + 1) : rule.getName();
                rules.add(new GenerationRule(name, rule.getQuery(), rule.getTemplate(), rule.getOutput()));
            }
            return rules;
        }
        return inferRules(root, generatedRoot);
    }

    private List<GenerationRule> inferRules(Path root, String generatedRoot) {
        ProofGenConfig.Workspace layout = config.getWorkspace();
        List<Path> templateFiles = listFiles(root.resolve(layout.getTemplateDir()), TEMPLATE_EXTENSION);
        List<GenerationRule> rules = new ArrayList<>();
        for (Path query : listFiles(root.resolve(layout.getQueryDir()), QUERY_EXTENSION)) {
            String stem = stripSuffix(query.getFileName().toString(), QUERY_EXTENSION);
            Optional<Path> template = templateFiles.stream()
                    .filter(t -> templateStem(t).equals(stem))
                    .findFirst();
            if (template.isEmpty()) {
                log.warn("No template for query {}, skipping", WorkspacePaths.relativize(root, query));
                continue;
            }
            String extension = templateOutputExtension(template.get());
            rules.add(new GenerationRule(
                    stem,
                    WorkspacePaths.relativize(root, query),
                    WorkspacePaths.relativize(root, template.get()),
                    trimSlash(generatedRoot) + "/" + stem + "." + extension));
        }
        return rules;
    }

    private void snapshotReferenced(Path root,
                                    Iterable<String> paths,
                                    InputKind kind,
                                    Map<String, byte[]> contents,
                                    List<InputDescriptor> inputs) {
        TreeSet<String> normalized = new TreeSet<>();
        for (String path : paths) {
            if (WorkspacePaths.isSafe(root, path)) {
                normalized.add(WorkspacePaths.normalize(path));
            }
        }
        for (String path : normalized) {
            Path file = root.resolve(path);
            if (!Files.isRegularFile(file)) {
                throw new ProofGenException(ProofGenErrorCode.INPUT_NOT_FOUND,
                        "Referenced " + kind.name().toLowerCase() + " does not exist: " + path);
            }
            byte[] bytes = read(file);
            contents.put(path, bytes);
            inputs.add(new InputDescriptor(path, hasher.hash(bytes), bytes.length, kind));
        }
    }

    private InputDescriptor describe(Path root, Path file, byte[] bytes, InputKind kind) {
        return new InputDescriptor(WorkspacePaths.relativize(root, file), hasher.hash(bytes), bytes.length, kind);
    }

    private byte[] read(Path file) {
        try {
            return Files.readAllBytes(file);
        }
        catch (IOException e) {
            throw new ProofGenException(ProofGenErrorCode.INPUT_READ_FAILED,
                    "Failed to read declared input " + file + ": " + e.getMessage(), e);
        }
    }

    private List<Path> listFiles(Path dir, String extension) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(extension))
                    .sorted()
                    .toList();
        }
        catch (IOException e) {
            throw new ProofGenException(ProofGenErrorCode.INPUT_READ_FAILED,
                    "Failed to list " + dir + ": " + e.getMessage(), e);
        }
    }

    private GuardSettings guardSettings(WorkspaceConfigFile.Guards overrides) {
        ProofGenConfig.Guard defaults = config.getGuard();
        return GuardSettings.builder()
                .failFast(overrides.getFailFast() != null ? overrides.getFailFast() : defaults.isFailFast())
                .maxOutputFiles(overrides.getMaxOutputFiles() != null ? overrides.getMaxOutputFiles() : defaults.getMaxOutputFiles())
                .maxOutputBytes(overrides.getMaxOutputBytes() != null ? overrides.getMaxOutputBytes() : defaults.getMaxOutputBytes())
                .maxFileBytes(defaults.getMaxFileBytes())
                .maxOntologyBytes(defaults.getMaxOntologyBytes())
                .maxTemplateBytes(defaults.getMaxTemplateBytes())
                .maxQueryBytes(defaults.getMaxQueryBytes())
                .build();
    }

    // a.rs.tera -> a, a.tera -> a
    static String templateStem(Path template) {
        String name = stripSuffix(template.getFileName().toString(), TEMPLATE_EXTENSION);
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    static String templateOutputExtension(Path template) {
        String name = stripSuffix(template.getFileName().toString(), TEMPLATE_EXTENSION);
        int dot = name.indexOf('.');
        return dot < 0 || dot == name.length() - 1 ? DEFAULT_OUTPUT_EXTENSION : name.substring(dot + 1);
    }

    private static String stripSuffix(String value, String suffix) {
        return value.endsWith(suffix) ? value.substring(0, value.length() - suffix.length()) : value;
    }

    private static String trimSlash(String value) {
        String trimmed = value.replace('\\', '/');
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
