package org.pyjs.compiler.backend.emit;

import org.pyjs.compiler.diagnostics.SourcePosition;
import org.pyjs.compiler.diagnostics.UnsupportedConstructError;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders literal values as JavaScript source.
 */
final class JsLiterals {

    private JsLiterals() {
    }

    /**
     * @param value A string value.
     * @return A double-quoted JavaScript string literal denoting the same value.
     */
    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\u2028', '\u2029' -> sb.append(String.format("\\u%04x", (int) c));
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    static String quoteAll(List<String> values) {
        return values.stream().map(JsLiterals::quote).collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * Converts a numeric literal as written in the source to JavaScript.
     * @param text The literal text.
     * @param position Where the literal occurs.
     * @return The JavaScript literal.
     * @throws UnsupportedConstructError for imaginary literals.
     */
    static String number(String text, SourcePosition position) {
        String plain = text.replace("_", "");
        String lower = plain.toLowerCase(Locale.ROOT);
        if (lower.endsWith("j")) {
            throw new UnsupportedConstructError("Imaginary literal '" + text + "' is not supported", position);
        }
        if (lower.startsWith("0o")) {
            return new BigInteger(plain.substring(2), 8).toString();
        }
        if (lower.startsWith("0b")) {
            return new BigInteger(plain.substring(2), 2).toString();
        }
        if (lower.startsWith("0x")) {
            return "0x" + plain.substring(2);
        }
        if (!lower.contains(".") && !lower.contains("e")) {
            return new BigInteger(plain).toString();
        }
        return plain;
    }
}
