package org.pyjs.compiler.backend.emit;

import org.pyjs.compiler.backend.output.JsStatement;
import org.pyjs.compiler.diagnostics.InternalInvariantError;
import org.pyjs.compiler.runtime.RuntimeLibrary;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Accumulates the helper references of the fragments a translation step combines,
 * so that composed fragments carry the union of their parts' helpers.
 */
final class FragmentCollector {

    private final Set<String> helpers = new TreeSet<>();

    String use(CodeFragment fragment) {
        helpers.addAll(fragment.helpers());
        return fragment.code();
    }

    String use(CodeFragment fragment, Precedence context) {
        helpers.addAll(fragment.helpers());
        return fragment.wrap(context);
    }

    List<JsStatement> use(StatementFragment fragment) {
        helpers.addAll(fragment.helpers());
        return fragment.statements();
    }

    /**
     * Records a reference to a runtime helper.
     * @param name The helper name.
     * @return The name, for use in generated code.
     * @throws InternalInvariantError if the catalog has no such helper.
     */
    String helper(String name) {
        if (!RuntimeLibrary.contains(name)) {
            throw new InternalInvariantError("Reference to unknown runtime helper '" + name + "'");
        }
        helpers.add(name);
        return name;
    }

    void addAll(Set<String> names) {
        names.forEach(this::helper);
    }

    CodeFragment build(String code, Precedence precedence) {
        return new CodeFragment(code, precedence, helpers);
    }

    StatementFragment build(List<JsStatement> statements) {
        return new StatementFragment(statements, helpers);
    }

    Set<String> helpers() {
        return helpers;
    }
}
