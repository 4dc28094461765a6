package com.github.salilvnair.proofgen.template;

import com.github.salilvnair.proofgen.engine.exception.TemplateCompileException;
import com.github.salilvnair.proofgen.engine.query.QueryBindings;
import com.github.salilvnair.proofgen.support.TestWorkspaces;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThymeleafTemplateRendererTest {

    private final ThymeleafTemplateRenderer renderer = new ThymeleafTemplateRenderer();

    private final QueryBindings bindings = new QueryBindings(
            List.of("name"),
            List.of(Map.of("name", "Order"), Map.of("name", "User")));

    @Test
    void rendersLegacyDoubleBraceVariablesFromFirstRow() {
        CompiledTemplate compiled = renderer.compile("t.tera", "struct {{name}};");

        assertEquals("struct Order;", renderer.render(compiled, bindings));
    }

    @Test
    void rendersLegacyHashExpressions() {
        CompiledTemplate compiled = renderer.compile("t.tera", "rows=#{count}");

        assertEquals("rows=2", renderer.render(compiled, bindings));
    }

    @Test
    void iteratesRows() {
        CompiledTemplate compiled = renderer.compile("templates/a.rs.tera", TestWorkspaces.TEMPLATE);

        String rendered = renderer.render(compiled, bindings);

        assertTrue(rendered.contains("pub struct Order;"));
        assertTrue(rendered.contains("pub struct User;"));
        assertTrue(rendered.indexOf("Order") < rendered.indexOf("User"));
    }

    @Test
    void exposesTemplateNameAndVariables() {
        CompiledTemplate compiled = renderer.compile("templates/x.tera", "[(${template})] [(${vars[0]})]");

        assertEquals("templates/x.tera name", renderer.render(compiled, bindings));
    }

    @Test
    void compileCollectsExpressions() {
        CompiledTemplate compiled = renderer.compile("templates/a.rs.tera", TestWorkspaces.TEMPLATE);

        assertEquals(List.of("rows", "row['name']"), compiled.expressions());
    }

    @Test
    void unclosedBlockIsReportedAtItsOpeningLine() {
        TemplateCompileException ex = assertThrows(TemplateCompileException.class,
                () -> renderer.compile("t.tera", "header\n[# th:each=\"r : ${rows}\"]\nbody\n"));

        assertEquals(2, ex.getLine());
        assertEquals(1, ex.getColumn());
    }

    @Test
    void invalidExpressionIsReported() {
        TemplateCompileException ex = assertThrows(TemplateCompileException.class,
                () -> renderer.compile("t.tera", "line one\nvalue [(${first.name +})]"));

        assertEquals("t.tera", ex.getSource());
        assertEquals(2, ex.getLine());
    }

    @Test
    void unterminatedInlineExpressionIsReported() {
        assertThrows(TemplateCompileException.class, () -> renderer.compile("t.tera", "value [[${name}"));
    }
}
