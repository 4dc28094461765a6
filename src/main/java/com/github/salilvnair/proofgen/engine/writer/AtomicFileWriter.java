package com.github.salilvnair.proofgen.engine.writer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes through a sibling temp file followed by a move, so readers see either the old or the new content.
 */
@Slf4j
@Component
public class AtomicFileWriter {

    static final String TEMP_SUFFIX = ".tmp";

    public void write(Path target, byte[] content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, "." + target.getFileName(), TEMP_SUFFIX);
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            }
            catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported for {}, falling back to replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        finally {
            Files.deleteIfExists(temp);
        }
    }

    public FileTransaction begin() {
        return new FileTransaction(this);
    }
}
