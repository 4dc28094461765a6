package com.github.salilvnair.proofgen.template;

import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.exception.TemplateCompileException;
import com.github.salilvnair.proofgen.engine.query.QueryBindings;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.stereotype.Component;
import org.thymeleaf.context.Context;
import org.thymeleaf.spring6.SpringTemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.StringTemplateResolver;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Thymeleaf TEXT-mode templates. Legacy {@code {{var}}} and {@code #{expr}} placeholders are accepted and
 * rewritten to inline expressions before compiling.
 * <p>
 * Compiling checks block balance ({@code [# ...]} / {@code [/]}), inline expression termination and the
 * syntax of every {@code ${...}} / {@code *{...}} expression. Positions refer to the normalized template.
 */
@Component
public class ThymeleafTemplateRenderer implements TemplateRenderer {

    private static final Pattern LEGACY_VAR_PATTERN = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*}}");
    private static final Pattern LEGACY_EXPR_PATTERN = Pattern.compile("#\\{\\s*([^{}]+?)\\s*}");
    private static final Pattern SINGLE_BRACKET_EXPR_PATTERN = Pattern.compile("(?<!\\[)\\[\\s*\\$\\{\\s*([^{}]+?)\\s*}\\s*](?!])");
    private static final Set<String> RESERVED_KEYS = Set.of("rows", "vars", "first", "count", "template");

    private final SpringTemplateEngine templateEngine;
    private final SpelExpressionParser expressionParser = new SpelExpressionParser();

    public ThymeleafTemplateRenderer() {
        StringTemplateResolver resolver = new StringTemplateResolver();
        resolver.setTemplateMode(TemplateMode.TEXT);
        resolver.setCacheable(false);

        SpringTemplateEngine engine = new SpringTemplateEngine();
        engine.setTemplateResolver(resolver);
        engine.setEnableSpringELCompiler(true);
        this.templateEngine = engine;
    }

    @Override
    public CompiledTemplate compile(String name, String template) {
        String normalized = normalizeTemplate(template == null ? "" : template);
        List<String> expressions = new ArrayList<>();
        Deque<int[]> openBlocks = new ArrayDeque<>();
        int line = 1;
        int column = 1;
        int i = 0;
        while (i < normalized.length()) {
            char c = normalized.charAt(i);
            if (c == '[' && i + 1 < normalized.length()) {
                char next = normalized.charAt(i + 1);
                if (next == '[' || next == '(') {
                    String terminator = next == '[' ? "]]" : ")]";
                    int end = normalized.indexOf(terminator, i + 2);
                    if (end < 0) {
                        throw new TemplateCompileException(name, line, column, "unterminated inline expression");
                    }
                    checkExpressions(name, normalized, i + 2, end, line, column, expressions);
                    int[] advanced = advance(normalized, i, end + 2, line, column);
                    i = end + 2;
                    line = advanced[0];
                    column = advanced[1];
                    continue;
                }
                if (next == '#' || next == '/') {
                    int end = normalized.indexOf(']', i + 2);
                    if (end < 0) {
                        throw new TemplateCompileException(name, line, column, "unterminated block tag");
                    }
                    if (next == '/') {
                        if (openBlocks.isEmpty()) {
                            throw new TemplateCompileException(name, line, column, "closing block without matching [# ...]");
                        }
                        openBlocks.pop();
                    }
                    else {
                        checkExpressions(name, normalized, i + 2, end, line, column, expressions);
                        boolean selfClosing = normalized.charAt(end - 1) == '/';
                        if (!selfClosing) {
                            openBlocks.push(new int[]{line, column});
                        }
                    }
                    int[] advanced = advance(normalized, i, end + 1, line, column);
                    i = end + 1;
                    line = advanced[0];
                    column = advanced[1];
                    continue;
                }
            }
            if (c == '\n') {
                line++;
                column = 1;
            }
            else {
                column++;
            }
            i++;
        }
        if (!openBlocks.isEmpty()) {
            int[] open = openBlocks.peek();
            throw new TemplateCompileException(name, open[0], open[1], "block opened here is never closed with [/]");
        }
        return new CompiledTemplate(name, normalized, expressions);
    }

    @Override
    public String render(CompiledTemplate compiled, QueryBindings bindings) {
        if (compiled.source().isBlank()) {
            return compiled.source();
        }
        Context context = new Context();
        context.setVariables(buildVariables(compiled.name(), bindings));
        try {
            String rendered = templateEngine.process(compiled.source(), context);
            return rendered == null ? "" : rendered;
        }
        catch (RuntimeException e) {
            throw new ProofGenException(ProofGenErrorCode.TEMPLATE_RENDER_FAILED,
                    "Failed to render " + compiled.name() + ": " + e.getMessage(), e);
        }
    }

    /**
     * {@code rows}, {@code vars}, {@code first}, {@code count} and {@code template}; the first row's
     * columns are also exposed directly so single-row templates can write {@code {{name}}}.
     */
    public Map<String, Object> buildVariables(String templateName, QueryBindings bindings) {
        Map<String, Object> merged = new LinkedHashMap<>();
        List<Map<String, String>> rows = bindings == null ? List.of() : bindings.rows();
        Map<String, String> first = rows.isEmpty() ? Map.of() : rows.get(0);

        merged.put("rows", rows);
        merged.put("vars", bindings == null ? List.of() : bindings.variables());
        merged.put("first", first);
        merged.put("count", rows.size());
        merged.put("template", templateName);

        putFlattened(merged, first, RESERVED_KEYS);
        return merged;
    }

    private void checkExpressions(String name,
                                  String text,
                                  int from,
                                  int to,
                                  int line,
                                  int column,
                                  List<String> expressions) {
        int i = from;
        while (i < to - 1) {
            char c = text.charAt(i);
            if ((c == '$' || c == '*') && text.charAt(i + 1) == '{') {
                int close = matchingBrace(text, i + 1, to);
                int[] position = advance(text, from - 2, i, line, column);
                if (close < 0) {
                    throw new TemplateCompileException(name, position[0], position[1], "unterminated expression");
                }
                String expression = text.substring(i + 2, close).trim();
                if (expression.isEmpty()) {
                    throw new TemplateCompileException(name, position[0], position[1], "empty expression");
                }
                try {
                    expressionParser.parseExpression(expression);
                }
                catch (ParseException e) {
                    throw new TemplateCompileException(name, position[0], position[1],
                            "invalid expression '" + expression + "': " + e.getSimpleMessage(), e);
                }
                expressions.add(expression);
                i = close + 1;
                continue;
            }
            i++;
        }
    }

    private int matchingBrace(String text, int open, int limit) {
        int depth = 0;
        for (int i = open; i < limit; i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            }
            else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    // line/column after consuming text[from, to)
    private int[] advance(String text, int from, int to, int line, int column) {
        int l = line;
        int c = column;
        for (int i = Math.max(0, from); i < to; i++) {
            if (text.charAt(i) == '\n') {
                l++;
                c = 1;
            }
            else {
                c++;
            }
        }
        return new int[]{l, c};
    }

    private void putFlattened(Map<String, Object> target, Map<String, String> source, Set<String> reservedKeys) {
        if (source == null || source.isEmpty()) {
            return;
        }
        for (Map.Entry<String, String> entry : source.entrySet()) {
            if (entry.getKey() == null || reservedKeys.contains(entry.getKey())) {
                continue;
            }
            target.putIfAbsent(entry.getKey(), entry.getValue());
        }
    }

    private String normalizeTemplate(String template) {
        String normalized = replacePattern(template, LEGACY_VAR_PATTERN, "[[${$1}]]");
        normalized = replacePattern(normalized, LEGACY_EXPR_PATTERN, "[[${$1}]]");
        normalized = replacePattern(normalized, SINGLE_BRACKET_EXPR_PATTERN, "[[${$1}]]");
        return normalized;
    }

    private String replacePattern(String input, Pattern pattern, String replacement) {
        Matcher matcher = pattern.matcher(input);
        StringBuffer out = new StringBuffer();
        while (matcher.find()) {
            String resolvedReplacement = replacement.replace("$1", matcher.group(1).trim());
            matcher.appendReplacement(out, Matcher.quoteReplacement(resolvedReplacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
