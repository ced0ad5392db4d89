package org.pyjs.compiler.backend.output;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pyjs.compiler.api.CompilerOptions;
import org.pyjs.compiler.api.HelperLinking;
import org.pyjs.compiler.api.IndentStyle;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

public class OutputAssemblerTest {

    private static OutputAssembler assembler(CompilerOptions.Builder builder) {
        return new OutputAssembler(builder.build());
    }

    @Test
    @Tag("unit")
    void rendersNestedBlocksWithContinuations() {
        JsStatement statement = JsStatement.block("if (a)", List.of(JsStatement.of("x = 1")))
                .then("else", List.of(JsStatement.block("while (b)", List.of(JsStatement.of("b = f()")))));

        String out = assembler(CompilerOptions.builder().indentWidth(2)).render(List.of(statement), 0);

        assertThat(out).isEqualTo("""
                if (a) {
                  x = 1;
                } else {
                  while (b) {
                    b = f();
                  }
                }
                """);
    }

    @Test
    @Tag("unit")
    void rendersBareBlockWithoutHeader() {
        JsStatement statement = JsStatement.bareBlock(List.of(JsStatement.of("let i"),
                JsStatement.block("while (b)", List.of(JsStatement.of("i = f()")))));

        String out = assembler(CompilerOptions.builder().indentWidth(2)).render(List.of(statement), 0);

        assertThat(out).isEqualTo("""
                {
                  let i;
                  while (b) {
                    i = f();
                  }
                }
                """);
    }

    @Test
    @Tag("unit")
    void indentsWithTabs() {
        OutputAssembler assembler = assembler(CompilerOptions.builder().indentStyle(IndentStyle.TABS));

        assertThat(assembler.indentUnit()).isEqualTo("\t");
        assertThat(assembler.render(List.of(JsStatement.of("x")), 2)).isEqualTo("\t\tx;\n");
    }

    @Test
    @Tag("unit")
    void parenthesizesStatementsThatWouldParseAsDeclarations() {
        String out = assembler(CompilerOptions.builder())
                .render(List.of(JsStatement.of("function () {}"), JsStatement.of("{}")), 0);

        assertThat(out).isEqualTo("(function () {});\n({});\n");
    }

    @Test
    @Tag("unit")
    void indentsEveryLineOfMultilineCodeButNotBlankLines() {
        String out = assembler(CompilerOptions.builder())
                .render(List.of(JsStatement.of("f(function () {\n\n    return 1;\n})")), 1);

        assertThat(out).isEqualTo("    f(function () {\n\n        return 1;\n    });\n");
    }

    @Test
    @Tag("unit")
    void rendersComments() {
        String out = assembler(CompilerOptions.builder()).render(List.of(JsStatement.comment("note")), 0);

        assertThat(out).isEqualTo("// note\n");
    }

    @Test
    @Tag("unit")
    void inlineLinkingPrependsDefinitions() {
        String out = assembler(CompilerOptions.builder())
                .assemble(List.of(JsStatement.of("_pyfunc_len(x)")), Set.of("_pyfunc_len"));

        assertThat(out).startsWith("function ").contains("function _pyfunc_len(").endsWith("}\n_pyfunc_len(x);\n");
    }

    @Test
    @Tag("unit")
    void externalLinkingBindsHelpersFromTheModule() {
        String out = assembler(CompilerOptions.builder().helperLinking(HelperLinking.EXTERNAL).runtimeModuleName("rt"))
                .assemble(List.of(JsStatement.of("_pyfunc_len(x)")), Set.of("_pyfunc_len", "_pyfunc_abs"));

        assertThat(out).isEqualTo("""
                var _pyfunc_abs = rt._pyfunc_abs;
                var _pyfunc_len = rt._pyfunc_len;
                _pyfunc_len(x);
                """);
    }

    @Test
    @Tag("unit")
    void emptyProgramIsASingleNewline() {
        assertThat(assembler(CompilerOptions.builder()).assemble(List.of(), Set.of())).isEqualTo("\n");
    }
}
