package com.github.salilvnair.proofgen.engine.guard.provider;

import com.github.salilvnair.proofgen.config.ProofGenConfig;
import com.github.salilvnair.proofgen.engine.guard.core.GuardContext;
import com.github.salilvnair.proofgen.engine.guard.core.GuardOptions;
import com.github.salilvnair.proofgen.engine.guard.core.GuardOutcome;
import com.github.salilvnair.proofgen.engine.guard.core.GuardViolation;
import com.github.salilvnair.proofgen.support.ProofGenTestContext;
import com.github.salilvnair.proofgen.support.TestWorkspaces;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;

import static com.github.salilvnair.proofgen.support.TestWorkspaces.rule;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BuiltInGuardsTest {

    @TempDir
    Path root;

    private ProofGenTestContext ctx = new ProofGenTestContext();

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    void pathSafetyRejectsAbsoluteAndParentPaths() {
        GuardOutcome outcome = new PathSafetyGuard().check(context(
                rule("abs", "queries/a.rq", "templates/a.rs.tera", "/etc/passwd")
                        + rule("up", "queries/a.rq", "templates/a.rs.tera", "out/../../x.rs")));

        assertFalse(outcome.passed());
        assertEquals(GuardViolation.PATH_SAFETY_VIOLATION, outcome.violation());
        assertTrue(outcome.diagnostic().contains("/etc/passwd (rule abs): absolute path"));
        assertTrue(outcome.diagnostic().contains("out/../../x.rs (rule up): parent-directory segment"));
        assertEquals(2, outcome.metadata().get("violations"));
    }

    @Test
    void pathSafetyPassesRelativePaths() {
        GuardOutcome outcome = new PathSafetyGuard().check(standardContext());

        assertTrue(outcome.passed());
        assertEquals(3, outcome.metadata().get("paths_checked"));
    }

    @Test
    void pathSafetyRejectsDeclaredOntologyOutsideRoot() {
        TestWorkspaces.standard(root);
        TestWorkspaces.write(root, "ggen.toml", """
                [project]
                name = "demo"

                [generation]
                output_dir = "out"
                ontologies = ["ontology/domain.ttl", "../outside.ttl"]
                """);

        GuardOutcome outcome = new PathSafetyGuard().check(ctx.guardContext(
                ctx.discovery.discover(root), ProofGenTestContext.defaultOptions()));

        assertFalse(outcome.passed());
        assertEquals(GuardViolation.PATH_SAFETY_VIOLATION, outcome.violation());
        assertTrue(outcome.diagnostic().contains("../outside.ttl (ontology): parent-directory segment"));
        assertEquals(1, outcome.metadata().get("violations"));
    }

    @Test
    void overlapDetectsPathsThatNormalizeToTheSameFile() {
        GuardOutcome outcome = new OutputOverlapGuard().check(context(
                rule("one", "queries/a.rq", "templates/a.rs.tera", "out/a.rs")
                        + rule("two", "queries/a.rq", "templates/a.rs.tera", "out/./a.rs")));

        assertFalse(outcome.passed());
        assertEquals(GuardViolation.OUTPUT_OVERLAP_CONFLICT, outcome.violation());
        assertTrue(outcome.diagnostic().contains("out/a.rs <- one, two"));
    }

    @Test
    void templateCompileReportsLocation() {
        TestWorkspaces.write(root, "templates/bad.rs.tera", "ok\n[# th:each=\"r : ${rows}\"]\nnever closed\n");

        GuardOutcome outcome = new TemplateCompileGuard().check(context(
                rule("bad", "queries/a.rq", "templates/bad.rs.tera", "out/bad.rs")));

        assertFalse(outcome.passed());
        assertEquals(GuardViolation.TEMPLATE_COMPILE_ERROR, outcome.violation());
        assertTrue(outcome.diagnostic().startsWith("templates/bad.rs.tera:2:1"));
    }

    @Test
    void graphParseReportsBrokenTurtle() {
        TestWorkspaces.standard(root);
        TestWorkspaces.write(root, "ontology/domain.ttl", TestWorkspaces.BROKEN_TURTLE);

        GuardOutcome outcome = new GraphParseGuard().check(ctx.guardContext(
                ctx.discovery.discover(root), ProofGenTestContext.defaultOptions()));

        assertFalse(outcome.passed());
        assertEquals(GuardViolation.GRAPH_PARSE_ERROR, outcome.violation());
        assertEquals("ontology/domain.ttl", outcome.metadata().get("source"));
    }

    @Test
    void graphParseCountsTriples() {
        GuardOutcome outcome = new GraphParseGuard().check(standardContext());

        assertTrue(outcome.passed());
        assertEquals(10L, outcome.metadata().get("triple_count"));
    }

    @Test
    void queryExecutionRejectsUnboundProjection() {
        TestWorkspaces.write(root, "queries/bad.rq", "SELECT ?ghost WHERE { ?s ?p ?o }");

        GuardOutcome outcome = new QueryExecutionGuard().check(context(
                rule("bad", "queries/bad.rq", "templates/a.rs.tera", "out/bad.rs")));

        assertFalse(outcome.passed());
        assertEquals(GuardViolation.QUERY_EXECUTION_ERROR, outcome.violation());
        assertTrue(outcome.diagnostic().contains("ghost"));
    }

    @Test
    void queryExecutionOnlyParsesInValidateOnlyWithoutExecution() {
        TestWorkspaces.standard(root);
        GuardContext context = ctx.guardContext(ctx.discovery.discover(root), new GuardOptions(true, false, true, false));

        GuardOutcome outcome = new QueryExecutionGuard().check(context);

        assertTrue(outcome.passed());
        assertTrue(outcome.diagnostic().contains("execution disabled"));
        assertEquals(0, outcome.metadata().get("executed"));
    }

    @Test
    void determinismPassesForPureTemplates() {
        GuardOutcome outcome = new DeterminismGuard(ctx.hasher).check(standardContext());

        assertTrue(outcome.passed());
        assertEquals(64, String.valueOf(outcome.metadata().get("input_hash")).length());
    }

    @Test
    void determinismRecordsInputHashWithoutRendering() {
        TestWorkspaces.standard(root);
        GuardContext context = ctx.guardContext(ctx.discovery.discover(root), new GuardOptions(true, false, true, false));

        GuardOutcome outcome = new DeterminismGuard(ctx.hasher).check(context);

        assertTrue(outcome.passed());
        assertEquals("Render comparison not performed without query execution", outcome.diagnostic());
        assertTrue(outcome.metadata().containsKey("input_hash"));
    }

    @Test
    void boundsRejectsTooManyPlannedOutputs() {
        TestWorkspaces.standard(root);
        TestWorkspaces.write(root, "ggen.toml", TestWorkspaces.CONFIG + """

                [guards]
                max_output_files = 0
                """);

        GuardOutcome outcome = new BoundsGuard().check(ctx.guardContext(
                ctx.discovery.discover(root), ProofGenTestContext.defaultOptions()));

        assertFalse(outcome.passed());
        assertEquals(GuardViolation.BOUNDS_EXCEEDED, outcome.violation());
        assertTrue(outcome.diagnostic().contains("1 planned outputs (limit 0)"));
    }

    @Test
    void boundsRejectsOversizedRenderedFile() {
        ctx.close();
        ProofGenConfig config = new ProofGenConfig();
        config.getGuard().setMaxFileBytes(10);
        ctx = new ProofGenTestContext(config, Clock.fixed(ProofGenTestContext.NOW, ZoneOffset.UTC));

        GuardOutcome outcome = new BoundsGuard().check(standardContext());

        assertFalse(outcome.passed());
        assertTrue(outcome.diagnostic().contains("out/a.rs is"));
    }

    @Test
    void boundsPassesWithinLimits() {
        GuardOutcome outcome = new BoundsGuard().check(standardContext());

        assertTrue(outcome.passed());
        assertEquals(1, outcome.metadata().get("planned_files"));
        assertEquals(0, outcome.metadata().get("unsized_rules"));
    }

    @Test
    void boundsCountsOutputsThatNormalizeToTheSameFileOnce() {
        TestWorkspaces.standard(root);
        TestWorkspaces.write(root, "ggen.toml", TestWorkspaces.CONFIG + """

                [guards]
                max_output_files = 1

                """ + rule("one", "queries/a.rq", "templates/a.rs.tera", "out/a.rs")
                + rule("two", "queries/a.rq", "templates/a.rs.tera", "out/./a.rs"));

        GuardOutcome outcome = new BoundsGuard().check(ctx.guardContext(
                ctx.discovery.discover(root), ProofGenTestContext.defaultOptions()));

        assertTrue(outcome.passed());
        assertEquals(1, outcome.metadata().get("planned_files"));
    }

    private GuardContext standardContext() {
        TestWorkspaces.standard(root);
        return ctx.guardContext(ctx.discovery.discover(root), ProofGenTestContext.defaultOptions());
    }

    private GuardContext context(String rulesToml) {
        TestWorkspaces.withRules(root, rulesToml);
        return ctx.guardContext(ctx.discovery.discover(root), ProofGenTestContext.defaultOptions());
    }
}
