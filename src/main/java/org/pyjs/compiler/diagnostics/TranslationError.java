package org.pyjs.compiler.diagnostics;

/**
 * Base class of all errors raised while translating a program.
 * Every error carries the source position of the offending node.
 */
public abstract class TranslationError extends RuntimeException {

    private final SourcePosition position;

    protected TranslationError(String message, SourcePosition position) {
        super(message);
        this.position = position == null ? SourcePosition.UNKNOWN : position;
    }

    protected TranslationError(String message, SourcePosition position, Throwable cause) {
        super(message, cause);
        this.position = position == null ? SourcePosition.UNKNOWN : position;
    }

    /**
     * Gets the position of the node that caused this error.
     * @return The source position, never null.
     */
    public SourcePosition getPosition() {
        return position;
    }

    /**
     * Formats this error as a single diagnostic line: {@code file:line:col: Type: message}.
     * @return The formatted line.
     */
    public String format() {
        return position + ": " + getClass().getSimpleName() + ": " + getMessage();
    }
}
