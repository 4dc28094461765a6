package com.github.salilvnair.proofgen.engine.tracker;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.hash.ContentHasher;
import com.github.salilvnair.proofgen.engine.workspace.WorkspacePaths;
import com.github.salilvnair.proofgen.engine.writer.AtomicFileWriter;
import com.github.salilvnair.proofgen.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Persisted map from output path to the hashes it was generated from.
 * <p>
 * Keys are workspace-relative paths with {@code /} separators. The state file may be hand-edited or deleted;
 * an unreadable file yields an empty tracker. {@link #save()} serializes writers of the same state file
 * (in-process lock plus a file lock), re-reads what is on disk and applies only this tracker's own changes
 * before replacing the file atomically.
 */
@Slf4j
public class ArtifactTracker {

    private static final TypeReference<TreeMap<String, ArtifactRecord>> STATE_TYPE = new TypeReference<>() {};
    // entries live only while some tracker is saving to that state file
    private static final Map<Path, SaveLock> SAVE_LOCKS = new ConcurrentHashMap<>();

    private final Path statePath;
    private final Path workspaceRoot;
    private final ContentHasher hasher;
    private final AtomicFileWriter writer;
    private final Clock clock;

    private final Map<String, ArtifactRecord> artifacts;
    private final Set<String> recorded = new LinkedHashSet<>();
    private final Set<String> removed = new LinkedHashSet<>();

    private ArtifactTracker(Path statePath,
                            Path workspaceRoot,
                            ContentHasher hasher,
                            AtomicFileWriter writer,
                            Clock clock,
                            Map<String, ArtifactRecord> artifacts) {
        this.statePath = statePath.toAbsolutePath().normalize();
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        this.hasher = hasher;
        this.writer = writer;
        this.clock = clock;
        this.artifacts = artifacts;
    }

    public static ArtifactTracker load(Path statePath,
                                       Path workspaceRoot,
                                       ContentHasher hasher,
                                       AtomicFileWriter writer,
                                       Clock clock) {
        return new ArtifactTracker(statePath, workspaceRoot, hasher, writer, clock, readState(statePath));
    }

    // ---------------------------------------------------------------------
    // Recording
    // ---------------------------------------------------------------------
    public synchronized void recordArtifact(Path path, String ontologyHash, String templateHash, List<String> dependencies) {
        String key = key(path);
        Path file = resolve(key);
        String artifactHash = "";
        if (Files.isRegularFile(file)) {
            artifactHash = hashFile(file);
        }
        artifacts.put(key, new ArtifactRecord(
                ontologyHash,
                templateHash,
                artifactHash,
                dependencies,
                Instant.now(clock).toString()));
        recorded.add(key);
        removed.remove(key);
    }

    public synchronized boolean removeArtifact(Path path) {
        String key = key(path);
        boolean existed = artifacts.remove(key) != null;
        if (existed) {
            removed.add(key);
            recorded.remove(key);
        }
        return existed;
    }

    public synchronized ArtifactRecord getRecord(Path path) {
        return artifacts.get(key(path));
    }

    public synchronized List<String> trackedPaths() {
        return new ArrayList<>(new TreeMap<>(artifacts).keySet());
    }

    // ---------------------------------------------------------------------
    // Staleness
    // ---------------------------------------------------------------------
    public synchronized boolean isStale(Path path, String ontologyHash, String templateHash) {
        String key = key(path);
        ArtifactRecord record = artifacts.get(key);
        if (record == null) {
            return true;
        }
        if (!record.ontologyHash().equals(ontologyHash) || !record.templateHash().equals(templateHash)) {
            return true;
        }
        Path file = resolve(key);
        if (!Files.isRegularFile(file)) {
            return true;
        }
        return !hashFile(file).equals(record.artifactHash());
    }

    public synchronized List<String> getStaleArtifacts(String currentOntologyHash) {
        List<String> stale = new ArrayList<>();
        for (Map.Entry<String, ArtifactRecord> entry : new TreeMap<>(artifacts).entrySet()) {
            if (isStale(Path.of(entry.getKey()), currentOntologyHash, entry.getValue().templateHash())) {
                stale.add(entry.getKey());
            }
        }
        return stale;
    }

    // ---------------------------------------------------------------------
    // Orphans
    // ---------------------------------------------------------------------
    public synchronized List<String> findOrphanedFiles(Path generatedRoot) {
        Path root = generatedRoot.isAbsolute() ? generatedRoot.normalize() : workspaceRoot.resolve(generatedRoot).normalize();
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                    .map(f -> WorkspacePaths.relativize(workspaceRoot, f))
                    .filter(k -> !artifacts.containsKey(k))
                    .sorted()
                    .toList();
        }
        catch (IOException e) {
            throw new ProofGenException(ProofGenErrorCode.INPUT_READ_FAILED,
                    "Failed to scan " + root + ": " + e.getMessage(), e);
        }
    }

    public List<String> cleanupOrphaned(Path generatedRoot, boolean dryRun) {
        List<String> orphans = findOrphanedFiles(generatedRoot);
        if (dryRun) {
            orphans.forEach(o -> log.info("[dry-run] would remove orphaned file {}", o));
            return orphans;
        }
        List<String> deleted = new ArrayList<>();
        for (String orphan : orphans) {
            try {
                Files.deleteIfExists(resolve(orphan));
                deleted.add(orphan);
                log.info("Removed orphaned file {}", orphan);
            }
            catch (IOException e) {
                log.warn("Failed to remove orphaned file {}: {}", orphan, e.getMessage());
            }
        }
        return deleted;
    }

    // ---------------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------------
    public void save() {
        SaveLock saveLock = acquire(statePath);
        try {
            Files.createDirectories(statePath.getParent());
            Path lockFile = statePath.resolveSibling(statePath.getFileName() + ".lock");
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                synchronized (this) {
                    TreeMap<String, ArtifactRecord> merged = readState(statePath);
                    removed.forEach(merged::remove);
                    for (String key : recorded) {
                        ArtifactRecord record = artifacts.get(key);
                        if (record != null) {
                            merged.put(key, record);
                        }
                    }
                    writer.write(statePath, JsonUtil.toPrettyJson(merged).getBytes(StandardCharsets.UTF_8));
                    artifacts.clear();
                    artifacts.putAll(merged);
                    recorded.clear();
                    removed.clear();
                    log.debug("Saved {} tracked artifacts to {}", merged.size(), statePath);
                }
            }
        }
        catch (IOException e) {
            throw new ProofGenException(ProofGenErrorCode.TRACKER_SAVE_FAILED,
                    "Failed to save artifact state " + statePath + ": " + e.getMessage(), e);
        }
        finally {
            release(statePath, saveLock);
        }
    }

    private static SaveLock acquire(Path key) {
        SaveLock saveLock = SAVE_LOCKS.compute(key, (k, existing) -> {
            SaveLock held = existing == null ? new SaveLock() : existing;
            held.holders++;
            return held;
        });
        saveLock.lock.lock();
        return saveLock;
    }

    private static void release(Path key, SaveLock saveLock) {
        saveLock.lock.unlock();
        SAVE_LOCKS.computeIfPresent(key, (k, held) -> --held.holders == 0 ? null : held);
    }

    static int activeSaveLocks() {
        return SAVE_LOCKS.size();
    }

    public synchronized int size() {
        return artifacts.size();
    }

    private static TreeMap<String, ArtifactRecord> readState(Path statePath) {
        if (!Files.isRegularFile(statePath)) {
            return new TreeMap<>();
        }
        try {
            TreeMap<String, ArtifactRecord> state = JsonUtil.mapper().readValue(statePath.toFile(), STATE_TYPE);
            if (state == null) {
                return new TreeMap<>();
            }
            state.values().removeIf(r -> r == null || r.ontologyHash() == null || r.templateHash() == null
                    || r.artifactHash() == null);
            return state;
        }
        catch (IOException e) {
            log.warn("{}: {} ({})", ProofGenErrorCode.TRACKER_STATE_CORRUPT.name(),
                    ProofGenErrorCode.TRACKER_STATE_CORRUPT.defaultMessage(), e.getMessage());
            return new TreeMap<>();
        }
    }

    private String key(Path path) {
        Path absolute = path.isAbsolute() ? path.normalize() : workspaceRoot.resolve(path).normalize();
        return WorkspacePaths.relativize(workspaceRoot, absolute);
    }

    private Path resolve(String key) {
        return workspaceRoot.resolve(key).normalize();
    }

    private String hashFile(Path file) {
        try {
            return hasher.hash(Files.readAllBytes(file));
        }
        catch (IOException e) {
            throw new ProofGenException(ProofGenErrorCode.INPUT_READ_FAILED,
                    "Failed to hash " + file + ": " + e.getMessage(), e);
        }
    }

    private static final class SaveLock {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by SAVE_LOCKS.compute
        private int holders;
    }
}
