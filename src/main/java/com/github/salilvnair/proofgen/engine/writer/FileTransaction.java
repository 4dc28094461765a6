package com.github.salilvnair.proofgen.engine.writer;

import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A batch of atomic writes that is undone as a whole unless {@link #commit()} is reached.
 * Existing files are backed up to {@code <name>.bak.tmp} before being replaced.
 */
@Slf4j
public class FileTransaction implements AutoCloseable {

    static final String BACKUP_SUFFIX = ".bak.tmp";

    private final AtomicFileWriter writer;
    private final List<Path> created = new ArrayList<>();
    private final Map<Path, Path> backups = new LinkedHashMap<>();
    private boolean committed;

    FileTransaction(AtomicFileWriter writer) {
        this.writer = writer;
    }

    public void write(Path target, byte[] content) {
        try {
            if (Files.exists(target)) {
                if (!backups.containsKey(target)) {
                    Path backup = target.resolveSibling(target.getFileName() + BACKUP_SUFFIX);
                    Files.copy(target, backup, StandardCopyOption.REPLACE_EXISTING);
                    backups.put(target, backup);
                }
            }
            else if (!created.contains(target)) {
                created.add(target);
            }
            writer.write(target, content);
        }
        catch (IOException e) {
            throw new ProofGenException(ProofGenErrorCode.OUTPUT_WRITE_FAILED,
                    "Failed to write " + target + ": " + e.getMessage(), e);
        }
    }

    public void commit() {
        committed = true;
        for (Path backup : backups.values()) {
            try {
                Files.deleteIfExists(backup);
            }
            catch (IOException e) {
                log.warn("Failed to delete backup {}: {}", backup, e.getMessage());
            }
        }
        backups.clear();
        created.clear();
    }

    public void rollback() {
        for (Map.Entry<Path, Path> entry : backups.entrySet()) {
            try {
                Files.move(entry.getValue(), entry.getKey(), StandardCopyOption.REPLACE_EXISTING);
            }
            catch (IOException e) {
                log.error("Failed to restore {} from {}: {}", entry.getKey(), entry.getValue(), e.getMessage());
            }
        }
        for (Path path : created) {
            try {
                Files.deleteIfExists(path);
            }
            catch (IOException e) {
                log.error("Failed to remove {} during rollback: {}", path, e.getMessage());
            }
        }
        if (!backups.isEmpty() || !created.isEmpty()) {
            log.warn("Rolled back {} restored and {} created files", backups.size(), created.size());
        }
        backups.clear();
        created.clear();
    }

    @Override
    public void close() {
        if (!committed) {
            rollback();
        }
    }
}
