package com.github.salilvnair.proofgen.engine.workspace;

import com.github.salilvnair.proofgen.config.ProofGenConfig;
import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.hash.Sha256ContentHasher;
import com.github.salilvnair.proofgen.support.TestWorkspaces;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static com.github.salilvnair.proofgen.support.TestWorkspaces.rule;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkspaceDiscoveryTest {

    private final Sha256ContentHasher hasher = new Sha256ContentHasher();
    private final WorkspaceDiscovery discovery = new WorkspaceDiscovery(new ProofGenConfig(), hasher);

    @TempDir
    Path root;

    @Test
    void discoversInputsAndInfersRuleFromStems() {
        TestWorkspaces.standard(root);

        WorkspaceContext workspace = discovery.discover(root);

        assertEquals(List.of(InputKind.CONFIG, InputKind.ONTOLOGY, InputKind.QUERY, InputKind.TEMPLATE),
                workspace.getInputs().stream().map(InputDescriptor::kind).toList());
        assertEquals(List.of(new GenerationRule("a", "queries/a.rq", "templates/a.rs.tera", "out/a.rs")),
                workspace.getRules());
        assertEquals("out", workspace.getGeneratedRoot());
        assertEquals("demo", workspace.getProjectName());
        assertEquals(64, workspace.getFingerprint().length());

        InputDescriptor ontology = workspace.descriptor("ontology/domain.ttl").orElseThrow();
        assertEquals(hasher.hash(TestWorkspaces.ONTOLOGY), ontology.contentHash());
        assertEquals(TestWorkspaces.ONTOLOGY, workspace.text("ontology/domain.ttl"));
    }

    @Test
    void fingerprintIsStableAndFollowsOntologyContent() {
        TestWorkspaces.standard(root);
        String first = discovery.discover(root).getFingerprint();

        assertEquals(first, discovery.discover(root).getFingerprint());
        assertEquals(first, discovery.fingerprint(root));

        TestWorkspaces.write(root, "queries/a.rq", TestWorkspaces.QUERY + "\n# comment\n");
        assertEquals(first, discovery.fingerprint(root));

        TestWorkspaces.write(root, "ontology/domain.ttl", TestWorkspaces.ONTOLOGY + "\n");
        assertNotEquals(first, discovery.fingerprint(root));
    }

    @Test
    void missingConfigFallsBackToDefaultGeneratedRoot() {
        TestWorkspaces.standard(root);
        root.resolve("ggen.toml").toFile().delete();

        WorkspaceContext workspace = discovery.discover(root);

        assertNull(workspace.getConfig());
        assertEquals("src/generated/a.rs", workspace.getRules().get(0).output());
    }

    @Test
    void inferenceOnlyPairsTeraTemplates() {
        TestWorkspaces.standard(root);
        TestWorkspaces.write(root, "queries/b.rq", TestWorkspaces.QUERY);
        TestWorkspaces.write(root, "templates/b.tera", TestWorkspaces.TEMPLATE);
        TestWorkspaces.write(root, "queries/c.rq", TestWorkspaces.QUERY);
        TestWorkspaces.write(root, "templates/c.rs.tmpl", TestWorkspaces.TEMPLATE);

        WorkspaceContext workspace = discovery.discover(root);

        assertEquals(List.of("out/a.rs", "out/b.rs"), workspace.plannedOutputs());
        assertEquals("templates/b.tera", workspace.getRules().get(1).template());
    }

    @Test
    void referencedPathsAreKeyedByNormalizedForm() {
        TestWorkspaces.withRules(root,
                rule("dotted", "./queries/a.rq", "templates/a.rs.tera", "out/a.rs")
                        + rule("plain", "queries/a.rq", "templates/a.rs.tera", "out/b.rs"));

        WorkspaceContext workspace = discovery.discover(root);

        List<InputDescriptor> queries = workspace.inputsOf(InputKind.QUERY);
        assertEquals(1, queries.size());
        assertEquals("queries/a.rq", queries.get(0).path());
        assertEquals(TestWorkspaces.QUERY, workspace.text("./queries/a.rq"));
        assertTrue(workspace.isLoaded("queries/a.rq"));
    }

    @Test
    void explicitRulesReplaceInference() {
        TestWorkspaces.withRules(root, rule("models", "queries/a.rq", "templates/a.rs.tera", "out/models.rs"));

        WorkspaceContext workspace = discovery.discover(root);

        assertEquals(1, workspace.getRules().size());
        assertEquals("models", workspace.getRules().get(0).name());
        assertEquals(List.of("out/models.rs"), workspace.plannedOutputs());
    }

    @Test
    void unsafeReferencedPathIsNotRead() {
        TestWorkspaces.withRules(root, rule("escape", "../secret.rq", "templates/a.rs.tera", "out/a.rs"));

        WorkspaceContext workspace = discovery.discover(root);

        assertFalse(workspace.isLoaded("../secret.rq"));
        assertTrue(workspace.isLoaded("templates/a.rs.tera"));
    }

    @Test
    void missingReferencedQueryFails() {
        TestWorkspaces.withRules(root, rule("gone", "queries/missing.rq", "templates/a.rs.tera", "out/a.rs"));

        ProofGenException ex = assertThrows(ProofGenException.class, () -> discovery.discover(root));

        assertEquals(ProofGenErrorCode.INPUT_NOT_FOUND.name(), ex.getErrorCode());
    }

    @Test
    void invalidConfigIsReported() {
        TestWorkspaces.standard(root);
        TestWorkspaces.write(root, "ggen.toml", "[project\nname = ");

        ProofGenException ex = assertThrows(ProofGenException.class, () -> discovery.discover(root));

        assertEquals(ProofGenErrorCode.WORKSPACE_CONFIG_INVALID.name(), ex.getErrorCode());
    }

    @Test
    void missingRootIsReported() {
        ProofGenException ex = assertThrows(ProofGenException.class,
                () -> discovery.discover(root.resolve("nope")));

        assertEquals(ProofGenErrorCode.WORKSPACE_NOT_FOUND.name(), ex.getErrorCode());
    }

    @Test
    void workspaceGuardSectionOverridesDefaults() {
        TestWorkspaces.standard(root);
        TestWorkspaces.write(root, "ggen.toml", TestWorkspaces.CONFIG + """

                [guards]
                fail_fast = false
                max_output_files = 3
                """);

        GuardSettings settings = discovery.discover(root).getGuardSettings();

        assertFalse(settings.isFailFast());
        assertEquals(3, settings.getMaxOutputFiles());
        assertEquals(new ProofGenConfig().getGuard().getMaxOutputBytes(), settings.getMaxOutputBytes());
    }
}
