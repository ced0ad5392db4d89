package org.pyjs.compiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.JavaScriptException;
import org.pyjs.compiler.api.HelperLinking;
import org.pyjs.compiler.api.TranslationResult;
import org.pyjs.compiler.runtime.RuntimeLibrary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Compiles complete programs and runs the output, checking observable behavior
 * against what the Python program prints or binds.
 */
public class EndToEndTest extends CompilerTestBase {

    @Test
    @Tag("integration")
    @DisplayName("A function with a default parameter returns a - b for a single argument")
    void functionWithDefaultParameter() throws Exception {
        String js = compile("""
                def foo(a, b=2):
                    return a - b
                """).source();

        assertThat(Context.toNumber(evaluate(js, "foo(5)"))).isEqualTo(3.0);
        assertThat(Context.toNumber(evaluate(js, "foo(5, 1)"))).isEqualTo(4.0);
        assertThatThrownBy(() -> evaluate(js, "foo()")).isInstanceOf(JavaScriptException.class);
    }

    @Test
    @Tag("integration")
    @DisplayName("A list comprehension yields [0, 2, 4] and its variable does not leak")
    void listComprehensionDoesNotLeak() throws Exception {
        String js = compile("result = [x*2 for x in range(3)]\n").source();

        assertThat(Context.toString(evaluate(js, "result.join(',')"))).isEqualTo("0,2,4");
        assertThat(Context.toString(evaluate(js, "typeof x"))).isEqualTo("undefined");
    }

    @Test
    @Tag("integration")
    @DisplayName("The first matching except clause wins")
    void firstMatchingHandlerWins() throws Exception {
        String js = compile("""
                try:
                    raise ValueError()
                except ValueError:
                    result = 1
                except Exception:
                    result = 2
                """).source();

        assertThat(Context.toNumber(evaluate(js, "result"))).isEqualTo(1.0);
    }

    @Test
    @Tag("integration")
    void chainedComparisonEvaluatesEachOperandOnce() throws Exception {
        String output = execute("""
                calls = []
                def f():
                    calls.append("f")
                    return 1
                def g():
                    calls.append("g")
                    return 2
                def h():
                    calls.append("h")
                    return 3
                print(f() < g() < h(), ",".join(calls))
                calls = []
                print(g() < f() < h(), ",".join(calls))
                """);

        assertThat(output).isEqualTo("True f,g,h\nFalse g,f");
    }

    @Test
    @Tag("integration")
    void chainedComparisonMentionsEachOperandOnceInOutput() throws Exception {
        String js = compile("""
                def f():
                    return 1
                def g():
                    return 2
                def h():
                    return 3
                ok = f() < g() < h()
                """, es5().toBuilder().helperLinking(HelperLinking.EXTERNAL).build()).source();

        assertThat(js).containsOnlyOnce("f()").containsOnlyOnce("g()").containsOnlyOnce("h()");
    }

    @Test
    @Tag("integration")
    void tupleAssignmentSwapsValues() throws Exception {
        String output = execute("""
                a, b = 1, 2
                a, b = b, a
                print(a, b)
                xs = [10, 20]
                xs[0], xs[1] = xs[1], xs[0]
                print(xs)
                """);

        assertThat(output).isEqualTo("2 1\n[20, 10]");
    }

    @Test
    @Tag("integration")
    void mutableDefaultIsSharedAcrossCalls() throws Exception {
        String output = execute("""
                def add(item, bucket=[]):
                    bucket.append(item)
                    return bucket
                first = add(1)
                second = add(2)
                print(first is second, len(second))
                own = add(3, [])
                print(len(own), len(add(4)))
                """);

        assertThat(output).isEqualTo("True 2\n1 3");
    }

    @Test
    @Tag("integration")
    void withExitRunsOnceWhenBodyRaises() throws Exception {
        String output = execute("""
                log = []
                class Manager:
                    def __enter__(self):
                        log.append("enter")
                        return self
                    def __exit__(self, exc_type, exc, tb):
                        log.append("exit")
                        return False
                try:
                    with Manager() as m:
                        log.append("body")
                        raise ValueError("boom")
                except ValueError as e:
                    log.append("caught " + str(e))
                with Manager():
                    log.append("quiet")
                print(",".join(log))
                """);

        assertThat(output).isEqualTo("enter,body,exit,caught boom,enter,quiet,exit");
    }

    @Test
    @Tag("integration")
    void exitReturningTrueSuppressesTheException() throws Exception {
        String output = execute("""
                class Suppress:
                    def __enter__(self):
                        return None
                    def __exit__(self, exc_type, exc, tb):
                        return True
                with Suppress():
                    raise KeyError("k")
                print("after")
                """);

        assertThat(output).isEqualTo("after");
    }

    @Test
    @Tag("integration")
    void classesSupportInheritanceAndSuper() throws Exception {
        String output = execute("""
                class Animal:
                    def __init__(self, name):
                        self.name = name
                    def speak(self):
                        return self.name + " makes a sound"
                class Dog(Animal):
                    def __init__(self, name, breed="mutt"):
                        super().__init__(name)
                        self.breed = breed
                    def speak(self):
                        return super().speak() + " (woof)"
                d = Dog("Rex")
                print(d.speak(), d.breed, isinstance(d, Animal))
                """);

        assertThat(output).isEqualTo("Rex makes a sound (woof) mutt True");
    }

    @Test
    @Tag("integration")
    void keywordAndStarArgumentsAreBound() throws Exception {
        String output = execute("""
                def describe(first, *rest, sep="-", **options):
                    return sep.join([str(first)] + [str(r) for r in rest]) + " " + str(len(options))
                print(describe(1, 2, 3, sep="+", colour="red"))
                args = [4, 5]
                print(describe(*args))
                """);

        assertThat(output).isEqualTo("1+2+3 1\n4-5 0");
    }

    @Test
    @Tag("integration")
    void closuresSeeNonlocalRebinding() throws Exception {
        String output = execute("""
                def counter():
                    count = 0
                    def step():
                        nonlocal count
                        count += 1
                        return count
                    return step
                tick = counter()
                tick()
                tick()
                print(tick())
                """);

        assertThat(output).isEqualTo("3");
    }

    @Test
    @Tag("integration")
    void loopElseRunsOnlyWithoutBreak() throws Exception {
        String output = execute("""
                for n in range(3):
                    pass
                else:
                    print("completed", n)
                for n in range(10):
                    if n == 4:
                        stopped = n
                        break
                else:
                    print("never")
                print("stopped", stopped)
                """);

        assertThat(output).isEqualTo("completed 2\nstopped 4");
    }

    @Test
    @Tag("integration")
    void containersFollowPythonSemantics() throws Exception {
        String output = execute("""
                d = {"a": 1}
                d["b"] = 2
                print(len(d), "b" in d, d.get("c", 0))
                s = {1, 2}
                s.add(2)
                print(len(s))
                print([1, 2] + [3], [0] * 3, "ab" * 2)
                print(sorted([3, 1, 2]), list(reversed([1, 2, 3])))
                print({k: v * 10 for k, v in d.items()})
                """);

        assertThat(output).isEqualTo("2 True 0\n2\n[1, 2, 3] [0, 0, 0] abab\n[1, 2, 3] [3, 2, 1]\n"
                + "{'a': 10, 'b': 20}");
    }

    @Test
    @Tag("integration")
    void formattedStringsRenderValues() throws Exception {
        String output = execute("""
                name = "pi"
                value = 3.14159
                print(f"{name}={value:.2f}", "%s:%d" % ("n", 7))
                """);

        assertThat(output).isEqualTo("pi=3.14 n:7");
    }

    @Test
    @Tag("integration")
    void truthinessFollowsPython() throws Exception {
        String output = execute("""
                print(bool([]), bool([0]), bool({}), bool(""), not 0)
                x = [] or "fallback"
                print(x)
                """);

        assertThat(output).isEqualTo("False True False False True\nfallback");
    }

    @Test
    @Tag("integration")
    void finallyRunsOnEveryExit() throws Exception {
        String output = execute("""
                def attempt(fail):
                    try:
                        if fail:
                            raise RuntimeError("bad")
                        return "ok"
                    except RuntimeError:
                        return "handled"
                    finally:
                        print("cleanup")
                print(attempt(False))
                print(attempt(True))
                """);

        assertThat(output).isEqualTo("cleanup\nok\ncleanup\nhandled");
    }

    @Test
    @Tag("integration")
    void withExitRunsOnceOnReturnContinueAndBreak() throws Exception {
        String output = execute("""
                log = []
                class Resource:
                    def __init__(self, name):
                        self.name = name
                    def __enter__(self):
                        log.append("enter " + self.name)
                        return self
                    def __exit__(self, exc_type, exc, tb):
                        log.append("exit " + self.name)
                        return False
                def early():
                    with Resource("r"):
                        return "returned"
                print(early())
                for i in range(3):
                    with Resource("c" + str(i)):
                        if i == 0:
                            continue
                        if i == 1:
                            break
                with Resource("outer") as a, Resource("inner") as b:
                    log.append(a.name + "+" + b.name)
                print(",".join(log))
                """);

        assertThat(output).isEqualTo("returned\nenter r,exit r,enter c0,exit c0,enter c1,exit c1,"
                + "enter outer,enter inner,outer+inner,exit inner,exit outer");
    }

    @Test
    @Tag("integration")
    void operatorsRaisePythonErrors() throws Exception {
        String output = execute("""
                def attempt(action):
                    try:
                        action()
                    except ZeroDivisionError:
                        return "zero"
                    except AttributeError:
                        return "attribute"
                    except TypeError:
                        return "type"
                    return "ok"
                print(attempt(lambda: 1 / 0), attempt(lambda: 7 // 0), attempt(lambda: 7 % 0))
                print(attempt(lambda: None < 3), attempt(lambda: "a" - 1), attempt(lambda: -"a"))
                print(attempt(lambda: None.real), attempt(lambda: 2 < 3))
                print(7 / 2, True & False, 6 ^ 3, 1 << 40, -7 >> 1, ~5)
                """);

        assertThat(output).isEqualTo("zero zero zero\ntype type type\nattribute ok\n"
                + "3.5 False 5 1099511627776 -4 -6");
    }

    @Test
    @Tag("integration")
    void setOperatorsCombineSets() throws Exception {
        String output = execute("""
                a = {1, 2, 3}
                b = {2, 3, 4}
                print(sorted(a | b), sorted(a & b), sorted(a - b), sorted(a ^ b))
                """);

        assertThat(output).isEqualTo("[1, 2, 3, 4] [2, 3] [1] [1, 4]");
    }

    @Test
    @Tag("integration")
    void readingAnUnassignedLocalRaisesUnboundLocalError() throws Exception {
        String output = execute("""
                def lookup(flag):
                    if flag:
                        value = 1
                    return value
                print(lookup(True))
                try:
                    lookup(False)
                except UnboundLocalError as e:
                    print("unbound: " + str(e))
                def drop():
                    item = 1
                    del item
                    try:
                        return item
                    except NameError:
                        return "deleted"
                print(drop())
                """);

        assertThat(output).isEqualTo("1\nunbound: local variable 'value' referenced before assignment\ndeleted");
    }

    @Test
    @Tag("integration")
    void loopVariableBoundElsewhereKeepsItsLastValue() throws Exception {
        String output = execute("""
                n = -1
                for n in range(3):
                    pass
                print(n)
                fs = []
                for i in range(3):
                    fs.append(lambda: i)
                print([f() for f in fs])
                """);

        assertThat(output).isEqualTo("2\n[2, 2, 2]");
    }

    @Test
    @Tag("integration")
    void uncaughtExceptionPropagates() throws Exception {
        String js = compile("""
                def boom():
                    raise ValueError("nope")
                boom()
                """).source();

        assertThatThrownBy(() -> run(js)).isInstanceOf(JavaScriptException.class);
    }

    @Test
    @Tag("integration")
    void externallyLinkedOutputRunsAgainstTheRuntimeModule() throws Exception {
        TranslationResult result = compile("print(len([1, 2, 3]))\n", es5().toBuilder()
                .helperLinking(HelperLinking.EXTERNAL).build());

        String output = run(RuntimeLibrary.moduleSource("pyjs_runtime") + result.source());

        assertThat(output).isEqualTo("3");
    }
}
