package org.pyjs.compiler.diagnostics;

/**
 * A syntax node kind, or a feature of a supported kind, has no translation
 * under the active configuration.
 */
public class UnsupportedConstructError extends TranslationError {

    public UnsupportedConstructError(String message, SourcePosition position) {
        super(message, position);
    }
}
