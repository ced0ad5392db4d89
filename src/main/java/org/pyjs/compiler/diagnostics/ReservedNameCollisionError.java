package org.pyjs.compiler.diagnostics;

/**
 * The mangler could not produce a unique target-safe name.
 * This is an internal invariant breach and is not expected for real programs.
 */
public class ReservedNameCollisionError extends TranslationError {

    public ReservedNameCollisionError(String message, SourcePosition position) {
        super(message, position);
    }
}
