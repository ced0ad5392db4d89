package org.pyjs.compiler;

import org.mozilla.javascript.Context;
import org.mozilla.javascript.Scriptable;
import org.pyjs.compiler.api.CompilationException;
import org.pyjs.compiler.api.CompilerOptions;
import org.pyjs.compiler.api.TargetProfile;
import org.pyjs.compiler.api.TranslationResult;

/**
 * Shared helpers for tests that compile Python source and execute the output.
 * Execution uses Rhino with a {@code console.log} that collects printed lines.
 */
public abstract class CompilerTestBase {

    private static final String PRELUDE =
            "var __out = []; var console = { log: function (s) { __out.push(String(s)); } };";

    protected static CompilerOptions es5() {
        return CompilerOptions.defaults().toBuilder().targetProfile(TargetProfile.ES5).build();
    }

    protected TranslationResult compile(String source) throws CompilationException {
        return compile(source, es5());
    }

    protected TranslationResult compile(String source, CompilerOptions options) throws CompilationException {
        return new Compiler(options).compile(source, "test.py");
    }

    /**
     * Compiles with ES5 defaults, runs the output and returns everything it printed.
     */
    protected String execute(String source) throws CompilationException {
        return run(compile(source).source());
    }

    /**
     * Runs a script and returns the lines it logged, joined by newlines.
     */
    protected String run(String script) {
        return Context.toString(evaluate(script, "__out.join('\\n')"));
    }

    /**
     * Runs a script, then evaluates an expression in the same global scope.
     */
    protected Object evaluate(String script, String expression) {
        Context cx = Context.enter();
        try {
            cx.setLanguageVersion(Context.VERSION_ES6);
            cx.setOptimizationLevel(-1);
            Scriptable scope = cx.initStandardObjects();
            cx.evaluateString(scope, PRELUDE, "prelude.js", 1, null);
            cx.evaluateString(scope, script, "test.js", 1, null);
            return cx.evaluateString(scope, expression, "expression.js", 1, null);
        } finally {
            Context.exit();
        }
    }
}
