package org.pyjs.compiler.diagnostics;

/**
 * A name reference has no reachable binding.
 */
public class NameResolutionError extends TranslationError {

    public NameResolutionError(String message, SourcePosition position) {
        super(message, position);
    }
}
