package org.pyjs.compiler.frontend.semantics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pyjs.compiler.api.Strictness;
import org.pyjs.compiler.diagnostics.DiagnosticsEngine;
import org.pyjs.compiler.diagnostics.NameResolutionError;
import org.pyjs.compiler.diagnostics.UnsupportedConstructError;
import org.pyjs.compiler.frontend.parser.PythonParser;
import org.pyjs.compiler.frontend.parser.ast.SyntaxNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests scope construction and name resolution.
 */
public class ScopeAnalyzerTest {

    private SyntaxNode module;

    private ScopeTree analyze(String source) {
        return analyze(source, new DiagnosticsEngine(), List.of());
    }

    private ScopeTree analyze(String source, DiagnosticsEngine diagnostics, List<String> allowedGlobals) {
        module = new PythonParser().parse(source, "test.py");
        return new ScopeAnalyzer(diagnostics, allowedGlobals).analyze(module);
    }

    @Test
    @Tag("unit")
    void classifiesModuleLocalAndParameterBindings() {
        ScopeTree tree = analyze("""
                x = 1
                def f(a):
                    y = a
                    return x
                """);

        SyntaxNode def = module.child(1);
        Scope function = tree.scopeOf(def);
        assertThat(function.kind()).isEqualTo(ScopeKind.FUNCTION);
        assertThat(function.parent()).isSameAs(tree.moduleScope());
        assertThat(function.lookup("a")).hasValueSatisfying(b -> assertThat(b.kind()).isEqualTo(BindingKind.PARAMETER));
        assertThat(function.lookup("y")).hasValueSatisfying(b -> assertThat(b.kind()).isEqualTo(BindingKind.LOCAL));
        assertThat(function.lookup("x")).isEmpty();

        SyntaxNode returned = def.child(1).child(1).child(0);
        Binding x = tree.bindingOf(returned);
        assertThat(x.kind()).isEqualTo(BindingKind.MODULE);
        assertThat(x.scope()).isSameAs(tree.moduleScope());
        assertThat(tree.bindingOf(def).kind()).isEqualTo(BindingKind.MODULE);
    }

    @Test
    @Tag("unit")
    void comprehensionTargetsStayInTheirOwnScope() {
        ScopeTree tree = analyze("""
                xs = [1, 2]
                ys = [v * 2 for v in xs]
                """);

        SyntaxNode comprehension = module.child(1).child(1);
        Scope scope = tree.scopeOf(comprehension);
        assertThat(scope.kind()).isEqualTo(ScopeKind.COMPREHENSION);
        assertThat(scope.lookup("v")).isPresent();
        assertThat(tree.moduleScope().lookup("v")).isEmpty();
    }

    @Test
    @Tag("unit")
    void nonlocalResolvesToEnclosingFunctionBinding() {
        ScopeTree tree = analyze("""
                def outer():
                    count = 0
                    def inner():
                        nonlocal count
                        count += 1
                    return inner
                """);

        Scope outer = tree.scopeOf(module.child(0));
        Scope inner = outer.children().get(0);
        Binding declared = inner.lookup("count").orElseThrow();
        assertThat(declared.kind()).isEqualTo(BindingKind.ENCLOSING);
        assertThat(declared.resolve()).isSameAs(outer.lookup("count").orElseThrow());
    }

    @Test
    @Tag("unit")
    void globalResolvesToModuleBinding() {
        ScopeTree tree = analyze("""
                total = 0
                def bump():
                    global total
                    total = total + 1
                """);

        Binding declared = tree.scopeOf(module.child(1)).lookup("total").orElseThrow();
        assertThat(declared.kind()).isEqualTo(BindingKind.GLOBAL);
        assertThat(declared.resolve()).isSameAs(tree.moduleScope().lookup("total").orElseThrow());
    }

    @Test
    @Tag("unit")
    void resolvesBuiltinsAndAllowedGlobals() {
        ScopeTree tree = analyze("console.log(len([]))\n", new DiagnosticsEngine(), List.of("console"));

        SyntaxNode call = module.child(0).child(0);
        Binding console = tree.bindingOf(call.child(0).child(0));
        Binding len = tree.bindingOf(call.child(1).child(0));
        assertThat(console.kind()).isEqualTo(BindingKind.GLOBAL);
        assertThat(console.externalName()).isEqualTo("console");
        assertThat(len.kind()).isEqualTo(BindingKind.BUILTIN);
        assertThat(len.externalName()).isEqualTo("_pyfunc_len");
    }

    @Test
    @Tag("unit")
    void classBodyNamesAreNotVisibleToMethods() {
        assertThatThrownBy(() -> analyze("""
                class K:
                    size = 1
                    def get(self):
                        return size
                """))
                .isInstanceOf(NameResolutionError.class)
                .hasMessageContaining("size");
    }

    @Test
    @Tag("unit")
    void classBodyAssignmentsAreAttributes() {
        ScopeTree tree = analyze("""
                class K:
                    size = 1
                """);

        Scope cls = tree.scopeOf(module.child(0));
        assertThat(cls.kind()).isEqualTo(ScopeKind.CLASS);
        assertThat(cls.lookup("size")).hasValueSatisfying(
                b -> assertThat(b.kind()).isEqualTo(BindingKind.CLASS_ATTRIBUTE));
    }

    @Test
    @Tag("unit")
    void batchModeMarksOnlyFailingStatements() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(Strictness.BATCH);

        ScopeTree tree = analyze("""
                a = 1
                b = undefined_name
                c = a
                """, diagnostics, List.of());

        assertThat(diagnostics.getDiagnostics()).hasSize(1).first().isInstanceOf(NameResolutionError.class);
        assertThat(diagnostics.getDiagnostics().get(0).getPosition().line()).isEqualTo(2);
        assertThat(tree.isFailed(module.child(0))).isFalse();
        assertThat(tree.isFailed(module.child(1))).isTrue();
        assertThat(tree.isFailed(module.child(2))).isFalse();
    }

    @Test
    @Tag("unit")
    void recordsFunctionFlags() {
        ScopeTree tree = analyze("""
                class Base:
                    def run(self):
                        return 1
                class Child(Base):
                    def run(self):
                        return super().run()
                def gen():
                    yield 1
                async def task():
                    pass
                def make():
                    fs = []
                    for i in range(3):
                        fs.append(lambda: i)
                    return fs
                """);

        Scope childRun = tree.scopeOf(module.child(1)).children().get(0);
        assertThat(childRun.flags()).contains(ScopeFlag.USES_SUPER, ScopeFlag.HAS_RETURN_VALUE);
        assertThat(childRun.isMethod()).isTrue();
        assertThat(tree.scopeOf(module.child(2)).has(ScopeFlag.GENERATOR)).isTrue();
        assertThat(tree.scopeOf(module.child(3)).has(ScopeFlag.ASYNC)).isTrue();
        assertThat(tree.scopeOf(module.child(4)).has(ScopeFlag.CLOSURE_OVER_LOOP_VARIABLE)).isTrue();
    }

    @Test
    @Tag("unit")
    void rejectsDiamondInheritance() {
        assertThatThrownBy(() -> analyze("""
                class A:
                    pass
                class B(A):
                    pass
                class C(A):
                    pass
                class D(B, C):
                    pass
                """))
                .isInstanceOf(UnsupportedConstructError.class)
                .hasMessageContaining("diamond");
    }

    @Test
    @Tag("unit")
    void rejectsReturnOutsideFunction() {
        assertThatThrownBy(() -> analyze("return 1\n")).isInstanceOf(UnsupportedConstructError.class);
    }

    @Test
    @Tag("unit")
    void rejectsNonlocalWithoutEnclosingBinding() {
        assertThatThrownBy(() -> analyze("""
                def f():
                    nonlocal missing
                    missing = 1
                """))
                .isInstanceOf(NameResolutionError.class)
                .hasMessageContaining("missing");
    }

    @Test
    @Tag("unit")
    void variableBoundOnlyByForTargetsIsConfinedToItsLoops() {
        ScopeTree tree = analyze("""
                for i in [1, 2]:
                    for i in [3]:
                        pass
                n = 0
                for n in [1]:
                    pass
                def f(xs):
                    for x in xs:
                        g = lambda: x
                    else:
                        print(x)
                """);

        assertThat(tree.moduleScope().lookup("i")).hasValueSatisfying(b -> assertThat(b.isLoopScoped()).isTrue());
        assertThat(tree.moduleScope().lookup("n")).hasValueSatisfying(b -> assertThat(b.isLoopScoped()).isFalse());
        Scope f = tree.scopeOf(module.child(3));
        assertThat(f.lookup("x")).hasValueSatisfying(b -> assertThat(b.isLoopScoped()).isTrue());
        assertThat(f.lookup("g")).hasValueSatisfying(b -> assertThat(b.isLoopScoped()).isFalse());
    }

    @Test
    @Tag("unit")
    void rejectsLoopVariableReadAfterItsLoop() {
        assertThatThrownBy(() -> analyze("""
                def f(xs):
                    for x in xs:
                        pass
                    return x
                """))
                .isInstanceOf(NameResolutionError.class)
                .hasMessageContaining("'x'")
                .hasMessageContaining("outside its for loop");
    }

    @Test
    @Tag("unit")
    void loopVariableReboundThroughNonlocalStaysFunctionLevel() {
        ScopeTree tree = analyze("""
                def outer(xs):
                    def last():
                        nonlocal item
                        item = None
                    for item in xs:
                        pass
                    return item
                """);

        Scope outer = tree.scopeOf(module.child(0));
        assertThat(outer.lookup("item")).hasValueSatisfying(b -> assertThat(b.isLoopScoped()).isFalse());
    }
}
