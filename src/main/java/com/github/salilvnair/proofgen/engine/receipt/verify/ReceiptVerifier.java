package com.github.salilvnair.proofgen.engine.receipt.verify;

import com.github.salilvnair.proofgen.config.ProofGenConfig;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.guard.core.GuardStatus;
import com.github.salilvnair.proofgen.engine.hash.ContentHasher;
import com.github.salilvnair.proofgen.engine.receipt.ReceiptIds;
import com.github.salilvnair.proofgen.engine.receipt.ReceiptSigner;
import com.github.salilvnair.proofgen.engine.receipt.model.GenerationReceipt;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptFile;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptGuard;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptOutput;
import com.github.salilvnair.proofgen.engine.workspace.WorkspaceDiscovery;
import com.github.salilvnair.proofgen.engine.workspace.WorkspacePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Audits a receipt against the current filesystem.
 * <p>
 * All seven checks always run so the caller sees every problem at once. Checks that depend on the
 * workspace fail rather than throw when the workspace is gone. Only the signature check may be skipped,
 * when the receipt carries no signature.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class ReceiptVerifier {

    public static final String V1 = "V1";
    public static final String V2 = "V2";
    public static final String V3 = "V3";
    public static final String V4 = "V4";
    public static final String V5 = "V5";
    public static final String V6 = "V6";
    public static final String V7 = "V7";

    static final String SCHEMA_VERSION = "Schema Version";
    static final String WORKSPACE_FINGERPRINT = "Workspace Fingerprint";
    static final String INPUT_HASHES = "Input Hashes";
    static final String OUTPUT_HASHES = "Output Hashes";
    static final String GUARD_INTEGRITY = "Guard Integrity";
    static final String METADATA_CONSISTENCY = "Metadata Consistency";
    static final String SIGNATURE = "Signature";

    private static final Pattern SEMVER = Pattern.compile("^\\d+\\.\\d+\\.\\d+(?:[-+][0-9A-Za-z.+-]*)?$");

    private final ContentHasher hasher;
    private final WorkspaceDiscovery discovery;
    private final ReceiptSigner signer;
    private final ProofGenConfig config;
    private final Clock clock;

    public VerificationResult verify(GenerationReceipt receipt, Path receiptPath) {
        List<VerificationCheck> checks = List.of(
                checkSchema(receipt),
                checkFingerprint(receipt),
                checkInputs(receipt),
                checkOutputs(receipt),
                checkGuards(receipt),
                checkMetadata(receipt),
                checkSignature(receipt));
        VerificationResult result = VerificationResult.of(String.valueOf(receiptPath), checks);
        log.info("Verified receipt {}: {} ({} failed checks)", receiptPath, result.result(), result.failures().size());
        return result;
    }

    /** Result for a receipt file that could not be read or parsed at all. */
    public VerificationResult unreadable(Path receiptPath, String reason) {
        String skipped = "Skipped: receipt could not be parsed";
        List<VerificationCheck> checks = List.of(
                VerificationCheck.fail(V1, SCHEMA_VERSION, "Receipt could not be parsed: " + reason),
                VerificationCheck.skip(V2, WORKSPACE_FINGERPRINT, skipped),
                VerificationCheck.skip(V3, INPUT_HASHES, skipped),
                VerificationCheck.skip(V4, OUTPUT_HASHES, skipped),
                VerificationCheck.skip(V5, GUARD_INTEGRITY, skipped),
                VerificationCheck.skip(V6, METADATA_CONSISTENCY, skipped),
                VerificationCheck.skip(V7, SIGNATURE, skipped));
        return VerificationResult.of(String.valueOf(receiptPath), checks);
    }

    // ---------------------------------------------------------------------
    // V1
    // ---------------------------------------------------------------------
    VerificationCheck checkSchema(GenerationReceipt receipt) {
        String version = receipt.version();
        if (version == null || version.isBlank()) {
            return VerificationCheck.fail(V1, SCHEMA_VERSION, "Receipt has no version");
        }
        if (!"1".equals(version.split("\\.", 2)[0])) {
            return VerificationCheck.fail(V1, SCHEMA_VERSION, "Unsupported receipt version " + version);
        }
        List<String> missing = new ArrayList<>();
        if (receipt.workspace() == null) {
            missing.add("workspace");
        }
        if (receipt.inputs() == null) {
            missing.add("inputs");
        }
        if (receipt.guards() == null) {
            missing.add("guards");
        }
        if (receipt.outputs() == null) {
            missing.add("outputs");
        }
        if (!missing.isEmpty()) {
            return VerificationCheck.fail(V1, SCHEMA_VERSION, "Missing sections: " + String.join(", ", missing));
        }
        return VerificationCheck.pass(V1, SCHEMA_VERSION, "Version " + version + " supported");
    }

    // ---------------------------------------------------------------------
    // V2
    // ---------------------------------------------------------------------
    VerificationCheck checkFingerprint(GenerationReceipt receipt) {
        Path root = workspaceRoot(receipt);
        if (root == null) {
            return VerificationCheck.fail(V2, WORKSPACE_FINGERPRINT, missingRootMessage(receipt));
        }
        String recorded = receipt.workspace().fingerprint();
        String current;
        try {
            current = discovery.fingerprint(root);
        }
        catch (ProofGenException e) {
            return VerificationCheck.fail(V2, WORKSPACE_FINGERPRINT, "Fingerprint not recomputable: " + e.getMessage());
        }
        if (!current.equals(recorded)) {
            return VerificationCheck.fail(V2, WORKSPACE_FINGERPRINT,
                    "Workspace changed: recorded " + recorded + ", current " + current);
        }
        return VerificationCheck.pass(V2, WORKSPACE_FINGERPRINT, "Fingerprint matches");
    }

    // ---------------------------------------------------------------------
    // V3
    // ---------------------------------------------------------------------
    VerificationCheck checkInputs(GenerationReceipt receipt) {
        if (receipt.inputs() == null) {
            return VerificationCheck.fail(V3, INPUT_HASHES, "Receipt has no inputs section");
        }
        Path root = workspaceRoot(receipt);
        if (root == null) {
            return VerificationCheck.fail(V3, INPUT_HASHES, missingRootMessage(receipt));
        }
        List<ReceiptFile> inputs = receipt.inputs().all();
        FileAudit audit = audit(root, inputs);
        if (audit.clean()) {
            return VerificationCheck.pass(V3, INPUT_HASHES, inputs.size() + " inputs match");
        }
        return VerificationCheck.fail(V3, INPUT_HASHES, audit.describe(inputs.size(), "inputs"));
    }

    // ---------------------------------------------------------------------
    // V4
    // ---------------------------------------------------------------------
    VerificationCheck checkOutputs(GenerationReceipt receipt) {
        if (receipt.outputs() == null) {
            return VerificationCheck.fail(V4, OUTPUT_HASHES, "Receipt has no outputs section");
        }
        Path root = workspaceRoot(receipt);
        if (root == null) {
            return VerificationCheck.fail(V4, OUTPUT_HASHES, missingRootMessage(receipt));
        }
        List<ReceiptFile> materialized = receipt.outputs().stream()
                .filter(ReceiptOutput::materialized)
                .map(o -> new ReceiptFile(o.path(), o.hash(), o.size()))
                .toList();
        int preview = receipt.outputs().size() - materialized.size();
        FileAudit audit = audit(root, materialized);
        if (audit.clean()) {
            String message = materialized.size() + " outputs match";
            return VerificationCheck.pass(V4, OUTPUT_HASHES,
                    preview > 0 ? message + ", " + preview + " preview outputs not materialized" : message);
        }
        return VerificationCheck.fail(V4, OUTPUT_HASHES, audit.describe(materialized.size(), "outputs"));
    }

    // ---------------------------------------------------------------------
    // V5
    // ---------------------------------------------------------------------
    VerificationCheck checkGuards(GenerationReceipt receipt) {
        List<ReceiptGuard> guards = receipt.guards();
        if (guards == null || guards.isEmpty()) {
            return VerificationCheck.fail(V5, GUARD_INTEGRITY, "Receipt records no guard verdicts");
        }
        List<String> notPassed = guards.stream()
                .filter(g -> g.verdict() != GuardStatus.PASS)
                .map(g -> g.id() + "=" + g.verdict())
                .toList();
        if (!notPassed.isEmpty()) {
            return VerificationCheck.fail(V5, GUARD_INTEGRITY, "Guards did not pass: " + String.join(", ", notPassed));
        }
        return VerificationCheck.pass(V5, GUARD_INTEGRITY, "All " + guards.size() + " guards passed");
    }

    // ---------------------------------------------------------------------
    // V6
    // ---------------------------------------------------------------------
    VerificationCheck checkMetadata(GenerationReceipt receipt) {
        List<String> problems = new ArrayList<>();
        if (receipt.timestamp() == null) {
            problems.add("timestamp missing");
        }
        else {
            try {
                Instant timestamp = Instant.parse(receipt.timestamp());
                Instant latest = Instant.now(clock).plus(Duration.ofSeconds(config.getReceipt().getMaxClockSkewSeconds()));
                if (timestamp.isAfter(latest)) {
                    problems.add("timestamp " + receipt.timestamp() + " is in the future");
                }
            }
            catch (DateTimeParseException e) {
                problems.add("timestamp " + receipt.timestamp() + " is not ISO-8601");
            }
        }
        if (!isSemver(receipt.version())) {
            problems.add("version " + receipt.version() + " is not semver");
        }
        if (!isSemver(receipt.compilerVersion())) {
            problems.add("compiler_version " + receipt.compilerVersion() + " is not semver");
        }
        if (receipt.mode() == null) {
            problems.add("mode missing or not preview|apply");
        }
        if (receipt.receiptId() == null || receipt.receiptId().isBlank()) {
            problems.add("receipt_id missing");
        }
        else {
            String computed = ReceiptIds.compute(hasher, receipt);
            if (!computed.equals(receipt.receiptId())) {
                problems.add("receipt_id does not match content (computed " + computed + ")");
            }
        }
        if (!problems.isEmpty()) {
            return VerificationCheck.fail(V6, METADATA_CONSISTENCY, String.join("; ", problems));
        }
        return VerificationCheck.pass(V6, METADATA_CONSISTENCY, "Metadata consistent");
    }

    // ---------------------------------------------------------------------
    // V7
    // ---------------------------------------------------------------------
    VerificationCheck checkSignature(GenerationReceipt receipt) {
        if (!receipt.signed()) {
            return VerificationCheck.skip(V7, SIGNATURE, "Receipt is not signed");
        }
        if (!signer.hasKey()) {
            return VerificationCheck.fail(V7, SIGNATURE, "Receipt is signed but no signing key is configured");
        }
        if (!signer.matches(receipt.receiptId(), receipt.signature())) {
            return VerificationCheck.fail(V7, SIGNATURE, "Signature does not match receipt id");
        }
        return VerificationCheck.pass(V7, SIGNATURE, "Signature valid");
    }

    private Path workspaceRoot(GenerationReceipt receipt) {
        if (receipt.workspace() == null || receipt.workspace().root() == null) {
            return null;
        }
        try {
            Path root = Path.of(receipt.workspace().root());
            return Files.isDirectory(root) ? root.toAbsolutePath().normalize() : null;
        }
        catch (InvalidPathException e) {
            return null;
        }
    }

    private static String missingRootMessage(GenerationReceipt receipt) {
        String root = receipt.workspace() == null ? null : receipt.workspace().root();
        return "Workspace root not found: " + root;
    }

    private static boolean isSemver(String value) {
        return value != null && SEMVER.matcher(value).matches();
    }

    private FileAudit audit(Path root, List<ReceiptFile> files) {
        FileAudit audit = new FileAudit();
        for (ReceiptFile file : files) {
            if (file.path() == null || !WorkspacePaths.isSafe(root, file.path())) {
                audit.mismatched.add(file.path() + " (outside workspace)");
                continue;
            }
            Path resolved = root.resolve(WorkspacePaths.normalize(file.path()));
            if (!Files.isRegularFile(resolved)) {
                audit.missing.add(file.path());
                continue;
            }
            try {
                if (!hasher.hash(Files.readAllBytes(resolved)).equals(file.hash())) {
                    audit.mismatched.add(file.path());
                }
            }
            catch (IOException e) {
                audit.mismatched.add(file.path() + " (unreadable: " + e.getMessage() + ")");
            }
        }
        return audit;
    }

    private static final class FileAudit {
        private final List<String> missing = new ArrayList<>();
        private final List<String> mismatched = new ArrayList<>();

        boolean clean() {
            return missing.isEmpty() && mismatched.isEmpty();
        }

        String describe(int total, String noun) {
            StringBuilder message = new StringBuilder()
                    .append(total).append(' ').append(noun).append(" checked, ")
                    .append(missing.size()).append(" missing, ")
                    .append(mismatched.size()).append(" mismatched");
            if (!missing.isEmpty()) {
                message.append("; missing: ").append(String.join(", ", missing));
            }
            if (!mismatched.isEmpty()) {
                message.append("; mismatched: ").append(String.join(", ", mismatched));
            }
            return message.toString();
        }
    }
}
