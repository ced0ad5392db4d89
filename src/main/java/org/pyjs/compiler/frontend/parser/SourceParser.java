package org.pyjs.compiler.frontend.parser;

import org.pyjs.compiler.diagnostics.TranslationError;
import org.pyjs.compiler.frontend.parser.ast.SyntaxNode;

/**
 * The upstream syntax-tree producer consumed by the compiler.
 * Implementations turn source text into a {@code MODULE} node.
 */
@FunctionalInterface
public interface SourceParser {

    /**
     * Parses a complete module.
     *
     * @param source   The source text.
     * @param fileName The file name recorded in node positions.
     * @return The MODULE node.
     * @throws TranslationError if the source cannot be parsed.
     */
    SyntaxNode parse(String source, String fileName);
}
