package com.github.salilvnair.proofgen.util;

import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.Map;

@UtilityClass
public final class LanguageUtil {

    public static final String UNKNOWN = "unknown";

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry("rs", "rust"),
            Map.entry("ts", "typescript"),
            Map.entry("js", "javascript"),
            Map.entry("java", "java"),
            Map.entry("py", "python"),
            Map.entry("go", "go"),
            Map.entry("yaml", "yaml"),
            Map.entry("yml", "yaml"),
            Map.entry("json", "json"),
            Map.entry("toml", "toml"),
            Map.entry("md", "markdown")
    );

    public static String detect(String path) {
        if (path == null) {
            return UNKNOWN;
        }
        String name = path.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return UNKNOWN;
        }
        return BY_EXTENSION.getOrDefault(name.substring(dot + 1).toLowerCase(Locale.ROOT), UNKNOWN);
    }
}
