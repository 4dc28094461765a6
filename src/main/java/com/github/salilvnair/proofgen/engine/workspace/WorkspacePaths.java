package com.github.salilvnair.proofgen.engine.workspace;

import lombok.experimental.UtilityClass;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/**
 * Lexical path rules shared by discovery, the path-safety and overlap guards, and the tracker.
 * Nothing here touches the filesystem.
 */
@UtilityClass
public class WorkspacePaths {

    private static final Pattern DRIVE_PREFIX = Pattern.compile("^[A-Za-z]:.*");

    public static boolean isAbsolute(String path) {
        if (path == null || path.isEmpty()) {
            return false;
        }
        return path.startsWith("/") || path.startsWith("\\") || DRIVE_PREFIX.matcher(path).matches();
    }

    public static boolean hasParentSegment(String path) {
        if (path == null) {
            return false;
        }
        for (String segment : path.replace('\\', '/').split("/")) {
            if ("..".equals(segment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Backslashes become {@code /}, {@code .} and empty segments are dropped and {@code ..} pops a segment.
     * Returns {@code null} when a {@code ..} would climb above the start.
     */
    public static String normalize(String path) {
        if (path == null) {
            return null;
        }
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.replace('\\', '/').split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (segments.isEmpty()) {
                    return null;
                }
                segments.removeLast();
                continue;
            }
            segments.addLast(segment);
        }
        return String.join("/", segments);
    }

    public static boolean escapesRoot(Path root, String path) {
        String normalized = normalize(path);
        if (normalized == null) {
            return true;
        }
        Path resolved = root.resolve(normalized).normalize();
        return !resolved.startsWith(root.normalize());
    }

    public static boolean isSafe(Path root, String path) {
        return path != null
                && !path.isBlank()
                && !isAbsolute(path)
                && !hasParentSegment(path)
                && !escapesRoot(root, path);
    }

    public static String relativize(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
