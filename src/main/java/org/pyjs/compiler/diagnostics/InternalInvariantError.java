package org.pyjs.compiler.diagnostics;

/**
 * A contract violation detected during translation, such as a code fragment
 * without a precedence tag or a reference to an unknown runtime helper.
 */
public class InternalInvariantError extends TranslationError {

    public InternalInvariantError(String message, SourcePosition position) {
        super(message, position);
    }

    public InternalInvariantError(String message) {
        super(message, SourcePosition.UNKNOWN);
    }
}
