package org.pyjs.compiler.backend.emit;

import org.pyjs.compiler.diagnostics.InternalInvariantError;

import java.util.Set;

/**
 * A translated expression: its code, how tightly it binds and the runtime helpers it references.
 *
 * @param code       The JavaScript expression text. May span several lines.
 * @param precedence The binding strength of the outermost operator.
 * @param helpers    The runtime helpers referenced anywhere inside the expression.
 */
public record CodeFragment(String code, Precedence precedence, Set<String> helpers) {

    public CodeFragment {
        if (precedence == null) {
            throw new InternalInvariantError("Code fragment without precedence: " + code);
        }
        if (code == null) {
            throw new InternalInvariantError("Code fragment without code");
        }
        helpers = Set.copyOf(helpers);
    }

    public static CodeFragment of(String code, Precedence precedence) {
        return new CodeFragment(code, precedence, Set.of());
    }

    /**
     * Returns the code, parenthesized if it binds more loosely than the context requires.
     * @param context The minimum precedence an operand needs in its position.
     * @return The code, possibly wrapped.
     */
    public String wrap(Precedence context) {
        return precedence.isLooserThan(context) ? "(" + code + ")" : code;
    }

    @Override
    public String toString() {
        return code;
    }
}
