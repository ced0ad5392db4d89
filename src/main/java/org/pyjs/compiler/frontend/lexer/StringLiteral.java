package org.pyjs.compiler.frontend.lexer;

/**
 * The decoded value of a string token.
 *
 * @param content   The string content with escapes processed (unless raw).
 * @param formatted True for f-strings, whose content still contains replacement fields.
 * @param bytes     True for bytes literals, which the translator rejects.
 */
public record StringLiteral(String content, boolean formatted, boolean bytes) {
}
