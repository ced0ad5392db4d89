package org.pyjs.compiler.diagnostics;

/**
 * A location in a source file, used only for diagnostics.
 *
 * @param fileName The name of the source file, or {@code "<unknown>"} for synthetic input.
 * @param line     The 1-based line number, or 0 if unknown.
 * @param column   The 1-based column number, or 0 if unknown.
 */
public record SourcePosition(String fileName, int line, int column) {

    /** Position used for nodes that do not originate from source text. */
    public static final SourcePosition UNKNOWN = new SourcePosition("<unknown>", 0, 0);

    @Override
    public String toString() {
        return fileName + ":" + line + ":" + column;
    }
}
