package org.pyjs.compiler.diagnostics;

/**
 * Raised by the bundled source parser when the input is not valid for the supported subset.
 */
public class ParsingError extends TranslationError {

    public ParsingError(String message, SourcePosition position) {
        super(message, position);
    }
}
