package com.github.salilvnair.proofgen.engine.validate;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.github.salilvnair.proofgen.util.JsonUtil;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Structural checks only: JSON, TOML and YAML must parse; brace languages must have balanced delimiters
 * outside strings and comments. Other languages pass.
 */
@Component
public class SyntaxOutputValidator implements OutputValidator {

    private static final Set<String> BRACE_LANGUAGES = Set.of("rust", "java", "typescript", "javascript", "go");
    private static final TomlMapper TOML = new TomlMapper();

    @Override
    public List<String> validate(String path, String language, String content) {
        List<String> issues = new ArrayList<>();
        String text = content == null ? "" : content;
        switch (language == null ? "" : language) {
            case "json" -> {
                if (!text.isBlank() && !JsonUtil.isValidJson(text)) {
                    issues.add(path + ": invalid JSON");
                }
            }
            case "toml" -> {
                try {
                    TOML.readTree(text);
                }
                catch (Exception e) {
                    issues.add(path + ": invalid TOML: " + e.getMessage());
                }
            }
            case "yaml" -> {
                try {
                    new Yaml().loadAll(text).forEach(doc -> { });
                }
                catch (RuntimeException e) {
                    issues.add(path + ": invalid YAML: " + e.getMessage());
                }
            }
            default -> {
                if (language != null && BRACE_LANGUAGES.contains(language)) {
                    checkDelimiters(path, text, "rust".equals(language), issues);
                }
            }
        }
        return issues;
    }

    private void checkDelimiters(String path, String text, boolean rust, List<String> issues) {
        Deque<int[]> stack = new ArrayDeque<>();
        int line = 1;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            char next = i + 1 < text.length() ? text.charAt(i + 1) : '\0';
            if (c == '/' && next == '/') {
                while (i < text.length() && text.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }
            if (c == '/' && next == '*') {
                int end = text.indexOf("*/", i + 2);
                int stop = end < 0 ? text.length() : end + 2;
                line += count(text, i, stop);
                i = stop;
                continue;
            }
            if (c == '"' || c == '`' || (c == '\'' && (!rust || isRustCharLiteral(text, i)))) {
                int end = closingQuote(text, i, c);
                int stop = end < 0 ? text.length() : end + 1;
                line += count(text, i, stop);
                i = stop;
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                stack.push(new int[]{c, line});
            }
            else if (c == ')' || c == ']' || c == '}') {
                if (stack.isEmpty() || stack.peek()[0] != opening(c)) {
                    issues.add(path + ":" + line + ": unbalanced '" + c + "'");
                    return;
                }
                stack.pop();
            }
            else if (c == '\n') {
                line++;
            }
            i++;
        }
        if (!stack.isEmpty()) {
            int[] open = stack.peek();
            issues.add(path + ":" + open[1] + ": unclosed '" + (char) open[0] + "'");
        }
    }

    // 'a' or '\n' style literal; anything else is a lifetime
    private boolean isRustCharLiteral(String text, int i) {
        if (i + 2 < text.length() && text.charAt(i + 1) != '\\' && text.charAt(i + 2) == '\'') {
            return true;
        }
        return i + 1 < text.length() && text.charAt(i + 1) == '\\';
    }

    private int closingQuote(String text, int start, char quote) {
        for (int i = start + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
                continue;
            }
            if (c == quote) {
                return i;
            }
        }
        return -1;
    }

    private int count(String text, int from, int to) {
        int lines = 0;
        for (int i = from; i < to; i++) {
            if (text.charAt(i) == '\n') {
                lines++;
            }
        }
        return lines;
    }

    private static char opening(char closing) {
        return switch (closing) {
            case ')' -> '(';
            case ']' -> '[';
            default -> '{';
        };
    }
}
