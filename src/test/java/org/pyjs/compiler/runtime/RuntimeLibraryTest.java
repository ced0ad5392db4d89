package org.pyjs.compiler.runtime;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mozilla.javascript.Context;
import org.pyjs.compiler.CompilerTestBase;
import org.pyjs.compiler.diagnostics.InternalInvariantError;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the helper catalog and, through the standalone module, the behavior of individual helpers.
 */
public class RuntimeLibraryTest extends CompilerTestBase {

    private static final String MODULE = RuntimeLibrary.moduleSource("rt");

    private String call(String expression) {
        return Context.toString(evaluate(MODULE, expression));
    }

    @Test
    @Tag("unit")
    void catalogIsClosedUnderDependencies() {
        for (String name : RuntimeLibrary.names()) {
            RuntimeHelper helper = RuntimeLibrary.get(name);
            assertThat(name).startsWith(RuntimeLibrary.RESERVED_PREFIX);
            assertThat(helper.source()).contains(name);
            assertThat(helper.dependencies()).allSatisfy(dependency ->
                    assertThat(RuntimeLibrary.contains(dependency)).as("%s needs %s", name, dependency).isTrue());
        }
    }

    @Test
    @Tag("unit")
    void closureIncludesTransitiveDependencies() {
        Set<String> closure = RuntimeLibrary.closure(List.of("_pyfunc_print"));

        assertThat(closure).contains("_pyfunc_print", "_pyfunc_str", "_pyfunc_repr", "_pyfunc_op_popkw");
    }

    @Test
    @Tag("unit")
    void loadOrderPlacesFunctionsFirstThenBaseClassesBeforeSubclasses() {
        List<String> order = RuntimeLibrary.loadOrder(List.of("_pyexc_KeyError", "_pyfunc_len")).stream()
                .map(RuntimeHelper::name).toList();

        assertThat(order).containsSubsequence(
                "_pyexc_BaseException", "_pyexc_Exception", "_pyexc_LookupError", "_pyexc_KeyError");
        int firstClass = order.indexOf("_pyexc_BaseException");
        assertThat(order.subList(0, firstClass)).allSatisfy(name ->
                assertThat(RuntimeLibrary.get(name).kind()).isEqualTo(RuntimeHelper.Kind.FUNCTION));
        assertThat(order.subList(0, firstClass)).isSorted();
    }

    @Test
    @Tag("unit")
    void unknownHelperIsAnInvariantViolation() {
        assertThatThrownBy(() -> RuntimeLibrary.get("_pyfunc_nope"))
                .isInstanceOf(InternalInvariantError.class)
                .hasMessageContaining("_pyfunc_nope");
    }

    @Test
    @Tag("unit")
    void definitionsAreDeterministic() {
        assertThat(RuntimeLibrary.definitions(List.of("_pyfunc_sorted", "_pyfunc_print")))
                .isEqualTo(RuntimeLibrary.definitions(List.of("_pyfunc_print", "_pyfunc_sorted")));
    }

    @Test
    @Tag("integration")
    void arithmeticFollowsPythonRounding() {
        assertThat(call("rt._pyfunc_op_floordiv(-7, 2)")).isEqualTo("-4");
        assertThat(call("rt._pyfunc_op_mod(-7, 3)")).isEqualTo("2");
        assertThat(call("rt._pyfunc_op_pow(2, 10)")).isEqualTo("1024");
    }

    @Test
    @Tag("integration")
    void divisionAndNegationRaiseInsteadOfProducingNaN() {
        assertThat(call("rt._pyfunc_op_truediv(7, 2)")).isEqualTo("3.5");
        assertThat(call("try { rt._pyfunc_op_truediv(1, 0); } catch (e) { e instanceof rt._pyexc_ZeroDivisionError; }"))
                .isEqualTo("true");
        assertThat(call("try { rt._pyfunc_op_sub('a', 1); } catch (e) { e instanceof rt._pyexc_TypeError; }"))
                .isEqualTo("true");
        assertThat(call("try { rt._pyfunc_op_neg('a'); } catch (e) { e instanceof rt._pyexc_TypeError; }"))
                .isEqualTo("true");
    }

    @Test
    @Tag("integration")
    void bitwiseOperatorsKeepBooleansAndWideIntegers() {
        assertThat(call("rt._pyfunc_op_and(true, false)")).isEqualTo("false");
        assertThat(call("rt._pyfunc_op_or(true, false)")).isEqualTo("true");
        assertThat(call("rt._pyfunc_op_and(true, 3)")).isEqualTo("1");
        assertThat(call("rt._pyfunc_op_or(4294967296, 1)")).isEqualTo("4294967297");
        assertThat(call("rt._pyfunc_op_and(-1, 255)")).isEqualTo("255");
        assertThat(call("rt._pyfunc_op_lshift(1, 40)")).isEqualTo("1099511627776");
        assertThat(call("rt._pyfunc_op_rshift(-9, 1)")).isEqualTo("-5");
        assertThat(call("rt._pyfunc_op_invert(5)")).isEqualTo("-6");
    }

    @Test
    @Tag("integration")
    void arrayOperandsOfBitwiseOperatorsAreSets() {
        assertThat(call("rt._pyfunc_op_or([1, 2], [2, 3]).join(',')")).isEqualTo("1,2,3");
        assertThat(call("rt._pyfunc_op_and([1, 2], [2, 3]).join(',')")).isEqualTo("2");
        assertThat(call("rt._pyfunc_op_sub([1, 2], [2, 3]).join(',')")).isEqualTo("1");
        assertThat(call("rt._pyfunc_op_xor([1, 2], [2, 3]).join(',')")).isEqualTo("1,3");
    }

    @Test
    @Tag("integration")
    void memberAccessOnNoneMapsToAttributeError() {
        assertThat(call("try { var x = null; x.foo(); } catch (e) { "
                + "rt._pyfunc_op_errtype(e) === rt._pyexc_AttributeError; }"))
                .isEqualTo("true");
        assertThat(call("try { undefined.real; } catch (e) { "
                + "rt._pyfunc_op_errtype(e) === rt._pyexc_AttributeError; }"))
                .isEqualTo("true");
        assertThat(call("try { var n = 1; n(); } catch (e) { rt._pyfunc_op_errtype(e) === rt._pyexc_TypeError; }"))
                .isEqualTo("true");
        assertThat(call("try { var f = null; f(); } catch (e) { rt._pyfunc_op_errtype(e) === rt._pyexc_TypeError; }"))
                .isEqualTo("true");
    }

    @Test
    @Tag("integration")
    void readingAnUnboundLocalRaises() {
        assertThat(call("rt._pyfunc_op_local(3, 'v')")).isEqualTo("3");
        assertThat(call("try { rt._pyfunc_op_local(rt._pyfunc_op_unbound, 'v'); } catch (e) { "
                + "(e instanceof rt._pyexc_UnboundLocalError) + ' ' + (e instanceof rt._pyexc_NameError); }"))
                .isEqualTo("true true");
    }

    @Test
    @Tag("integration")
    void reprRendersPythonLiterals() {
        assertThat(call("rt._pyfunc_repr([1, 'a', null, true])")).isEqualTo("[1, 'a', None, True]");
        assertThat(call("rt._pyfunc_str(2.5)")).isEqualTo("2.5");
    }

    @Test
    @Tag("integration")
    void equalityAndTruthinessAreStructural() {
        assertThat(call("rt._pyfunc_op_equals([1, [2]], [1, [2]])")).isEqualTo("true");
        assertThat(call("rt._pyfunc_truthy([])")).isEqualTo("false");
        assertThat(call("rt._pyfunc_truthy({})")).isEqualTo("false");
        assertThat(call("rt._pyfunc_truthy('x')")).isEqualTo("true");
    }

    @Test
    @Tag("integration")
    void containerMethodsFallBackToOwnMethods() {
        assertThat(call("var xs = [1]; rt._pymeth_append.call(xs, 2); xs.join(',')")).isEqualTo("1,2");
        assertThat(call("rt._pymeth_append.call({append: function (v) { return 'own ' + v; }}, 3)"))
                .isEqualTo("own 3");
    }

    @Test
    @Tag("integration")
    void exceptionsMatchTheirBaseClasses() {
        assertThat(call("rt._pyfunc_op_matches(new rt._pyexc_KeyError('k'), rt._pyexc_LookupError)"))
                .isEqualTo("true");
        assertThat(call("rt._pyfunc_op_matches(new rt._pyexc_KeyError('k'), rt._pyexc_ValueError)"))
                .isEqualTo("false");
    }
}
