package org.pyjs.compiler;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.pyjs.compiler.api.CompilationException;
import org.pyjs.compiler.api.CompilerOptions;
import org.pyjs.compiler.api.Degradation;
import org.pyjs.compiler.api.HelperLinking;
import org.pyjs.compiler.api.IndentStyle;
import org.pyjs.compiler.api.Strictness;
import org.pyjs.compiler.api.TargetProfile;
import org.pyjs.compiler.api.TranslationResult;
import org.pyjs.compiler.diagnostics.NameResolutionError;
import org.pyjs.compiler.diagnostics.ParsingError;
import org.pyjs.compiler.diagnostics.SourcePosition;
import org.pyjs.compiler.diagnostics.UnsupportedConstructError;
import org.pyjs.compiler.frontend.parser.PythonParser;
import org.pyjs.compiler.frontend.parser.SourceParser;
import org.pyjs.compiler.frontend.parser.ast.SyntaxNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests the compile pipeline as a whole: option handling, strictness and target-profile gating.
 */
@ExtendWith(MockitoExtension.class)
public class CompilerTest extends CompilerTestBase {

    private static final String GENERATOR = """
            def numbers(n):
                i = 0
                while i < n:
                    yield i
                    i += 1
            total = sum(numbers(4))
            """;

    @Mock
    private SourceParser parser;

    @Test
    @Tag("unit")
    void compilingTwiceYieldsIdenticalOutput() throws Exception {
        String source = """
                class Point:
                    def __init__(self, x, y):
                        self.x = x
                        self.y = y
                def norm(p):
                    return [abs(v) for v in (p.x, p.y)]
                for q in [Point(1, -2), Point(-3, 4)]:
                    print(norm(q))
                """;

        TranslationResult first = compile(source);
        TranslationResult second = compile(source);

        assertThat(second.source()).isEqualTo(first.source());
        assertThat(second.usedHelpers()).isEqualTo(first.usedHelpers());
    }

    @Test
    @Tag("unit")
    void failFastStopsAtTheFirstError() {
        CompilationException e = catchThrowableOfType(() -> compile("""
                a = missing_one
                b = missing_two
                """), CompilationException.class);

        assertThat(e.getErrors()).hasSize(1);
        assertThat(e.getErrors().get(0)).isInstanceOf(NameResolutionError.class);
        assertThat(e.getErrors().get(0).getPosition().line()).isEqualTo(1);
        assertThat(e.getPartialSource()).isEmpty();
    }

    @Test
    @Tag("unit")
    void batchModeCollectsErrorsPerTopLevelStatement() {
        CompilerOptions options = es5().toBuilder().strictness(Strictness.BATCH).build();

        CompilationException e = catchThrowableOfType(() -> compile("""
                def good():
                    return 1
                def bad():
                    return missing
                x = 1 @ 2
                print(good())
                """, options), CompilationException.class);

        assertThat(e.getErrors()).hasSize(2);
        assertThat(e.getErrors().get(0)).isInstanceOf(NameResolutionError.class);
        assertThat(e.getErrors().get(1)).isInstanceOf(UnsupportedConstructError.class);
        assertThat(e.getPartialSource()).hasValueSatisfying(partial -> assertThat(partial)
                .contains("good")
                .doesNotContain("missing"));
        assertThat(e.getMessage()).contains("test.py:4").contains("test.py:5");
    }

    @Test
    @Tag("unit")
    void generatorRequiresGeneratorSupport() {
        assertThatThrownBy(() -> compile(GENERATOR))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("UnsupportedConstructError")
                .hasMessageContaining("numbers");
    }

    @Test
    @Tag("unit")
    void generatorUsesNativeGeneratorsWhenSupported() throws Exception {
        String js = compile(GENERATOR, es5().toBuilder().targetProfile(TargetProfile.ES2015).build()).source();

        assertThat(js).contains("function* ").contains("yield i");
    }

    @Test
    @Tag("integration")
    void eagerDegradationCollectsGeneratorValues() throws Exception {
        CompilerOptions options = es5().toBuilder().degradation(Degradation.EAGER).build();
        String js = compile(GENERATOR + "print(total, list(x * x for x in range(3)))\n", options).source();

        assertThat(js).doesNotContain("function*").doesNotContain("yield");
        assertThat(run(js)).isEqualTo("6 [0, 1, 4]");
    }

    @Test
    @Tag("unit")
    void asyncRequiresAsyncSupport() throws Exception {
        String source = """
                async def fetch(source):
                    value = await source()
                    return value
                """;

        assertThatThrownBy(() -> compile(source, es5().toBuilder().targetProfile(TargetProfile.ES2015).build()))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("fetch");
        String js = compile(source, es5().toBuilder().targetProfile(TargetProfile.ES2017).build()).source();
        assertThat(js).contains("async function").contains("await source()");
    }

    @Test
    @Tag("unit")
    void blockScopingProfileDeclaresWithLet() throws Exception {
        String js = compile("x = 1\n", es5().toBuilder().targetProfile(TargetProfile.ES2015).build()).source();

        assertThat(js).startsWith("let x;\n").contains("x = 1;");
    }

    @Test
    @Tag("unit")
    void es5DeclaresWithVar() throws Exception {
        assertThat(compile("x = 1\n").source()).isEqualTo("var x;\nx = 1;\n");
    }

    @Test
    @Tag("unit")
    void indentationFollowsOptions() throws Exception {
        String source = """
                def f(a):
                    return a
                """;

        String spaces = compile(source, es5().toBuilder().indentWidth(2).build()).source();
        String tabs = compile(source, es5().toBuilder().indentStyle(IndentStyle.TABS).build()).source();

        assertThat(spaces).contains("\n  return a;");
        assertThat(tabs).contains("\n\treturn a;");
    }

    @Test
    @Tag("unit")
    void externalLinkingImportsHelpersInsteadOfDefiningThem() throws Exception {
        CompilerOptions options = es5().toBuilder()
                .helperLinking(HelperLinking.EXTERNAL)
                .runtimeModuleName("rt")
                .build();

        TranslationResult result = compile("print(len([1]))\n", options);

        assertThat(result.usedHelpers()).contains("_pyfunc_len", "_pyfunc_print");
        assertThat(result.source())
                .contains("var _pyfunc_len = rt._pyfunc_len;")
                .doesNotContain("function _pyfunc_len");
    }

    @Test
    @Tag("unit")
    void inlineLinkingDefinesHelpersBeforeTheProgram() throws Exception {
        String js = compile("print(len([1]))\n").source();

        assertThat(js.indexOf("function _pyfunc_len")).isGreaterThanOrEqualTo(0)
                .isLessThan(js.indexOf("_pyfunc_print(_pyfunc_len("));
    }

    @Test
    @Tag("unit")
    void docstringsBecomeCommentsOnlyWhenEnabled() throws Exception {
        String source = """
                def f():
                    \"\"\"Returns one.\"\"\"
                    return 1
                """;

        assertThat(compile(source).source()).doesNotContain("Returns one.");
        assertThat(compile(source, es5().toBuilder().docstrings(true).build()).source())
                .contains("Returns one.");
    }

    @Test
    @Tag("unit")
    void allowedGlobalsResolveWithoutDefinitions() throws Exception {
        String source = "document.title = 'x'\n";

        assertThatThrownBy(() -> compile(source)).isInstanceOf(CompilationException.class);
        String js = compile(source, es5().toBuilder().allowedGlobals(List.of("document")).build()).source();
        assertThat(js).contains("document.title = \"x\"");
    }

    @Test
    @Tag("unit")
    void usesTheSuppliedParser() throws Exception {
        SyntaxNode module = new PythonParser().parse("y = 2\n", "given.py");
        when(parser.parse(anyString(), anyString())).thenReturn(module);

        TranslationResult result = new Compiler(es5()).compile("ignored", "given.py", parser);

        verify(parser).parse("ignored", "given.py");
        assertThat(result.source()).contains("y = 2;");
    }

    @Test
    @Tag("unit")
    void parseErrorsBecomeCompilationErrors() {
        ParsingError error = new ParsingError("Unexpected token", new SourcePosition("bad.py", 3, 7));
        when(parser.parse(anyString(), anyString())).thenThrow(error);

        CompilationException e = catchThrowableOfType(
                () -> new Compiler(es5()).compile("x = (", "bad.py", parser), CompilationException.class);

        assertThat(e.getErrors()).containsExactly(error);
        assertThat(e.getMessage()).startsWith("bad.py:3:7");
    }
}
