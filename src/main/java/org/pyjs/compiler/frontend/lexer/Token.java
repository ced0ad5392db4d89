package org.pyjs.compiler.frontend.lexer;

import org.pyjs.compiler.diagnostics.SourcePosition;

/**
 * A lexical token.
 *
 * @param type     The token category.
 * @param text     The token text as written (operator, name, literal source).
 * @param value    The decoded literal value for STRING tokens, otherwise null.
 * @param line     The 1-based line.
 * @param column   The 1-based column.
 * @param fileName The source file name.
 */
public record Token(TokenType type, String text, Object value, int line, int column, String fileName) {

    public SourcePosition position() {
        return new SourcePosition(fileName, line, column);
    }

    /**
     * @param op Operator or delimiter text.
     * @return true if this is the given operator token.
     */
    public boolean isOperator(String op) {
        return type == TokenType.OPERATOR && text.equals(op);
    }

    /**
     * @param keyword Keyword text.
     * @return true if this is the given keyword token.
     */
    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equals(keyword);
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + line + ":" + column;
    }
}
