package org.pyjs.compiler.frontend.lexer;

/**
 * Token categories produced by the {@link Lexer}.
 */
public enum TokenType {
    NAME,
    KEYWORD,
    NUMBER,
    STRING,
    /** Operators and delimiters; the token text identifies which one. */
    OPERATOR,
    NEWLINE,
    INDENT,
    DEDENT,
    END_OF_FILE
}
