package com.github.salilvnair.proofgen.engine.report;

import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.writer.AtomicFileWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

/**
 * Whole-file unified diff: every changed file is one hunk replacing all old lines with all new lines.
 */
@RequiredArgsConstructor
@Component
public class DiffWriter {

    private static final String DEV_NULL = "/dev/null";

    private final AtomicFileWriter writer;

    public String render(String runId, List<FileChange> changes) {
        List<FileChange> changed = changes.stream()
                .filter(FileChange::changed)
                .sorted(Comparator.comparing(FileChange::path))
                .toList();
        StringBuilder out = new StringBuilder()
                .append("# proofgen run ").append(runId).append('\n')
                .append("# ").append(changed.size()).append(" files changed\n");
        for (FileChange change : changed) {
            out.append(hunk(change));
        }
        return out.toString();
    }

    public void write(Path target, String diff) {
        try {
            writer.write(target, diff.getBytes(StandardCharsets.UTF_8));
        }
        catch (IOException e) {
            throw new ProofGenException(ProofGenErrorCode.OUTPUT_WRITE_FAILED,
                    "Failed to write diff " + target + ": " + e.getMessage(), e);
        }
    }

    static String hunk(FileChange change) {
        List<String> oldLines = lines(change.before());
        List<String> newLines = lines(change.after());
        StringBuilder out = new StringBuilder()
                .append("--- ").append(change.before() == null ? DEV_NULL : "a/" + change.path()).append('\n')
                .append("+++ b/").append(change.path()).append('\n')
                .append("@@ -").append(range(oldLines.size()))
                .append(" +").append(range(newLines.size())).append(" @@\n");
        oldLines.forEach(l -> out.append('-').append(l).append('\n'));
        newLines.forEach(l -> out.append('+').append(l).append('\n'));
        return out.toString();
    }

    private static String range(int count) {
        return count == 0 ? "0,0" : "1," + count;
    }

    private static List<String> lines(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        return content.lines().toList();
    }
}
