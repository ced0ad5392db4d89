package org.pyjs.compiler.backend.emit;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.pyjs.compiler.Compiler;
import org.pyjs.compiler.api.CompilationException;
import org.pyjs.compiler.api.CompilerOptions;
import org.pyjs.compiler.api.HelperLinking;
import org.pyjs.compiler.diagnostics.UnsupportedConstructError;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Checks the JavaScript emitted for individual expressions. Each expression is assigned to
 * {@code r}; free names are host globals so they need no declarations.
 */
public class ExpressionTranslatorTest {

    private static final CompilerOptions OPTIONS = CompilerOptions.builder()
            .helperLinking(HelperLinking.EXTERNAL)
            .allowedGlobals(List.of("a", "b", "c", "f", "g", "xs", "obj"))
            .build();

    private static String emit(String expression) throws CompilationException {
        String source = new Compiler(OPTIONS).compile("r = " + expression + "\n", "expr.py").source();
        String[] lines = source.split("\n");
        String last = lines[lines.length - 1];
        assertThat(last).startsWith("r = ").endsWith(";");
        return last.substring("r = ".length(), last.length() - 1);
    }

    @ParameterizedTest(name = "{0}")
    @Tag("unit")
    @CsvSource(delimiter = '|', value = {
            "a + b                | _pyfunc_op_add(a, b)",
            "a - b * c            | _pyfunc_op_sub(a, _pyfunc_op_mult(b, c))",
            "a - b - c            | _pyfunc_op_sub(_pyfunc_op_sub(a, b), c)",
            "1 - 2                | 1 - 2",
            "a / b                | _pyfunc_op_truediv(a, b)",
            "a // b               | _pyfunc_op_floordiv(a, b)",
            "a % b                | _pyfunc_op_mod(a, b)",
            "-a ** 2              | _pyfunc_op_neg(_pyfunc_op_pow(a, 2))",
            "-2                   | -2",
            "~a                   | _pyfunc_op_invert(a)",
            "- -a                 | _pyfunc_op_neg(_pyfunc_op_neg(a))",
            "a << 2 & b           | _pyfunc_op_and(_pyfunc_op_lshift(a, 2), b)",
            "a ^ b & c            | _pyfunc_op_xor(a, _pyfunc_op_and(b, c))",
            "not a                | !_pyfunc_truthy(a)",
            "a < 3                | _pyfunc_op_lt(a, 3)",
            "2 < 3                | 2 < 3",
            "a < b                | _pyfunc_op_lt(a, b)",
            "a == b               | _pyfunc_op_equals(a, b)",
            "a != b               | !_pyfunc_op_equals(a, b)",
            "a is None            | a == null",
            "a is not None        | a != null",
            "a is b               | _pyfunc_op_is(a, b)",
            "a in xs              | _pyfunc_op_contains(xs, a)",
            "a not in xs          | !_pyfunc_op_contains(xs, a)",
            "a < b < c            | _pyfunc_op_lt(a, b) && _pyfunc_op_lt(b, c)",
            "a if b else c        | _pyfunc_truthy(b) ? a : c",
            "a if b > 1 else c    | _pyfunc_op_gt(b, 1) ? a : c",
            "a and b              | _pyfunc_truthy(a) ? b : a",
            "a or b               | _pyfunc_truthy(a) ? a : b",
            "a < 1 and b > 2      | _pyfunc_op_lt(a, 1) && _pyfunc_op_gt(b, 2)",
            "True                 | true",
            "None                 | null",
            "0o17                 | 15",
            "1_000                | 1000",
            "0xFF                 | 0xFF",
            "2.5e3                | 2.5e3",
            "[a, 1]               | [a, 1]",
            "(a,)                 | [a]",
            "{1, 2}               | _pyfunc_set([1, 2])",
            "xs[0]                | _pyfunc_op_getitem(xs, 0)",
            "xs[1:]               | _pyfunc_op_slice(xs, 1, null, null)",
            "xs[::-1]             | _pyfunc_op_slice(xs, null, null, -1)",
            "obj.name             | obj.name",
            "obj.frob(1)          | obj.frob(1)",
            "obj.append(1)        | _pymeth_append.call(obj, 1)",
            "f(a, key=1)          | _pyfunc_op_call(f, null, [a], {\"key\": 1})",
            "f(*xs)               | _pyfunc_op_call(f, null, _pyfunc_iter(xs), null)",
            "f(a, *xs, **obj)     | _pyfunc_op_call(f, null, [a].concat(_pyfunc_iter(xs)), _pyfunc_op_kwmerge(obj))",
            "obj.frob(key=a)      | _pyfunc_op_callmethod(obj, \"frob\", [], {\"key\": a})",
            "len(xs)              | _pyfunc_len(xs)",
            "f\"x{a}\"            | \"x\" + _pyfunc_str(a)",
            "f\"{a!r:>4}\"        | _pyfunc_format(_pyfunc_repr(a), \">4\")"
    })
    void translatesExpression(String python, String javascript) throws CompilationException {
        assertThat(emit(python)).isEqualTo(javascript);
    }

    @Test
    @Tag("unit")
    void dictWithStringKeysIsAnObjectLiteral() throws CompilationException {
        assertThat(emit("{'k': 1, 'j': a}")).isEqualTo("{\"k\": 1, \"j\": a}");
        assertThat(emit("{a: 1}")).isEqualTo("_pyfunc_dict([[a, 1]])");
    }

    @Test
    @Tag("unit")
    void nonSimpleOperandsOfAndOrAreEvaluatedOnce() throws CompilationException {
        assertThat(emit("f() or b")).isEqualTo("_pyfunc_truthy(_pytmp_1 = f()) ? _pytmp_1 : b");
    }

    @Test
    @Tag("unit")
    void chainedComparisonStoresMiddleOperandInTemporary() throws CompilationException {
        assertThat(emit("f() < g() < c"))
                .isEqualTo("_pyfunc_op_lt(f(), _pytmp_1 = g()) && _pyfunc_op_lt(_pytmp_1, c)");
    }

    @Test
    @Tag("unit")
    void lambdaBecomesFunctionExpression() throws CompilationException {
        String source = new Compiler(OPTIONS).compile("r = lambda x: x + a\n", "expr.py").source();

        assertThat(source).endsWith("r = _pyfunc_op_def(\"<lambda>\", [\"x\"], {}, false, [], false, function (x) {\n"
                + "    return _pyfunc_op_add(x, a);\n"
                + "});\n");
    }

    @Test
    @Tag("unit")
    void escapesStringLiterals() throws CompilationException {
        assertThat(emit("'say \"hi\"\\n'")).isEqualTo("\"say \\\"hi\\\"\\n\"");
    }

    @Test
    @Tag("unit")
    void rejectsMatrixMultiplication() {
        CompilationException e = catchThrowableOfType(() -> emit("a @ b"), CompilationException.class);

        assertThat(e.getErrors()).singleElement().isInstanceOf(UnsupportedConstructError.class);
    }

    @Test
    @Tag("unit")
    void rejectsImaginaryLiterals() {
        CompilationException e = catchThrowableOfType(() -> emit("2j"), CompilationException.class);

        assertThat(e.getErrors()).singleElement().isInstanceOf(UnsupportedConstructError.class);
        assertThat(e.getMessage()).contains("Imaginary");
    }
}
