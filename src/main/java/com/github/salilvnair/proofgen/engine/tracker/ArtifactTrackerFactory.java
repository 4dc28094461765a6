package com.github.salilvnair.proofgen.engine.tracker;

import com.github.salilvnair.proofgen.config.ProofGenConfig;
import com.github.salilvnair.proofgen.engine.hash.ContentHasher;
import com.github.salilvnair.proofgen.engine.writer.AtomicFileWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;

@RequiredArgsConstructor
@Component
public class ArtifactTrackerFactory {

    private final ProofGenConfig config;
    private final ContentHasher hasher;
    private final AtomicFileWriter writer;
    private final Clock clock;

    public ArtifactTracker load(Path workspaceRoot) {
        Path root = workspaceRoot.toAbsolutePath().normalize();
        return ArtifactTracker.load(root.resolve(config.getWorkspace().getStateFile()), root, hasher, writer, clock);
    }
}
