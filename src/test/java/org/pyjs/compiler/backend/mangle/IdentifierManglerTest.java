package org.pyjs.compiler.backend.mangle;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pyjs.compiler.diagnostics.DiagnosticsEngine;
import org.pyjs.compiler.diagnostics.ReservedNameCollisionError;
import org.pyjs.compiler.frontend.parser.PythonParser;
import org.pyjs.compiler.frontend.parser.ast.SyntaxNode;
import org.pyjs.compiler.frontend.semantics.Scope;
import org.pyjs.compiler.frontend.semantics.ScopeAnalyzer;
import org.pyjs.compiler.frontend.semantics.ScopeTree;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class IdentifierManglerTest {

    private SyntaxNode module;
    private ScopeTree tree;

    private IdentifierMangler mangle(String source) {
        module = new PythonParser().parse(source, "test.py");
        tree = new ScopeAnalyzer(new DiagnosticsEngine(), List.of()).analyze(module);
        return new IdentifierMangler(tree).assign();
    }

    private String moduleName(IdentifierMangler mangler, String name) {
        return mangler.targetName(tree.moduleScope().lookup(name).orElseThrow());
    }

    @Test
    @Tag("unit")
    void keepsOrdinaryNames() {
        IdentifierMangler mangler = mangle("count = 1\n");

        assertThat(moduleName(mangler, "count")).isEqualTo("count");
        assertThat(mangler.renamed()).isEmpty();
    }

    @Test
    @Tag("unit")
    void renamesJavaScriptKeywordsAvoidingProgramNames() {
        IdentifierMangler mangler = mangle("""
                new = 1
                new_1 = 2
                function = 3
                """);

        assertThat(moduleName(mangler, "new")).isEqualTo("new_2");
        assertThat(moduleName(mangler, "new_1")).isEqualTo("new_1");
        assertThat(moduleName(mangler, "function")).isEqualTo("function_1");
        assertThat(mangler.renamed()).hasSize(2);
    }

    @Test
    @Tag("unit")
    void renamesRuntimePrefixedNames() {
        IdentifierMangler mangler = mangle("_pyfunc_len = 1\n");

        assertThat(moduleName(mangler, "_pyfunc_len")).isEqualTo("__pyfunc_len");
    }

    @Test
    @Tag("unit")
    void renamesHostGlobals() {
        IdentifierMangler mangler = mangle("Math = 1\narguments = 2\n");

        assertThat(moduleName(mangler, "Math")).isEqualTo("Math_1");
        assertThat(moduleName(mangler, "arguments")).isEqualTo("arguments_1");
    }

    @Test
    @Tag("unit")
    void renamesNumericConversionGlobals() {
        IdentifierMangler mangler = mangle("parseInt = 1\nparseFloat = 2\nisNaN = 3\nisFinite = 4\n");

        assertThat(moduleName(mangler, "parseInt")).isEqualTo("parseInt_1");
        assertThat(moduleName(mangler, "parseFloat")).isEqualTo("parseFloat_1");
        assertThat(moduleName(mangler, "isNaN")).isEqualTo("isNaN_1");
        assertThat(moduleName(mangler, "isFinite")).isEqualTo("isFinite_1");
    }

    @Test
    @Tag("unit")
    void renamesLocalThatHidesAGlobalNeededByNestedFunction() {
        IdentifierMangler mangler = mangle("""
                total = 0
                def f():
                    total = 1
                    def g():
                        global total
                        return total
                    return g
                """);

        Scope f = tree.scopeOf(module.child(1));
        Scope g = f.children().get(0);
        assertThat(moduleName(mangler, "total")).isEqualTo("total");
        assertThat(mangler.targetName(f.lookup("total").orElseThrow())).isEqualTo("total_1");
        assertThat(mangler.targetName(g.lookup("total").orElseThrow())).isEqualTo("total");
    }

    @Test
    @Tag("unit")
    void assignmentIsDeterministic() {
        String source = """
                new = 1
                def delete(this, var=2):
                    typeof = this + var
                    return typeof
                """;

        List<MangledName> first = mangle(source).renamed();
        List<MangledName> second = mangle(source).renamed();

        assertThat(second).isEqualTo(first);
        assertThat(first).extracting(MangledName::original)
                .containsExactly("new", "delete", "this", "var", "typeof");
    }

    @Test
    @Tag("unit")
    void failsWhenEveryCandidateIsTaken() {
        StringBuilder source = new StringBuilder("this = 0\n");
        for (int i = 1; i <= IdentifierMangler.MAX_ATTEMPTS; i++) {
            source.append("this_").append(i).append(" = ").append(i).append('\n');
        }

        assertThatThrownBy(() -> mangle(source.toString()))
                .isInstanceOf(ReservedNameCollisionError.class)
                .hasMessageContaining("'this'");
    }
}
