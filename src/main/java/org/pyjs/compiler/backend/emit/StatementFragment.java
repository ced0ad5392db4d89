package org.pyjs.compiler.backend.emit;

import org.pyjs.compiler.backend.output.JsStatement;

import java.util.List;
import java.util.Set;

/**
 * The translation of one source statement: zero or more JavaScript statements and the runtime
 * helpers they reference.
 */
public record StatementFragment(List<JsStatement> statements, Set<String> helpers) {

    public StatementFragment {
        statements = List.copyOf(statements);
        helpers = Set.copyOf(helpers);
    }
}
