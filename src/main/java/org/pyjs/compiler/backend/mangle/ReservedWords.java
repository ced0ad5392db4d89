package org.pyjs.compiler.backend.mangle;

import java.util.Set;

/**
 * Identifiers that generated code must never bind: JavaScript reserved words, restricted
 * identifiers, and the host globals the runtime library relies on.
 */
public final class ReservedWords {

    private static final Set<String> KEYWORDS = Set.of(
            "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete",
            "do", "else", "enum", "export", "extends", "false", "finally", "for", "function", "if",
            "implements", "import", "in", "instanceof", "interface", "let", "new", "null", "package",
            "private", "protected", "public", "return", "static", "super", "switch", "this", "throw",
            "true", "try", "typeof", "var", "void", "while", "with", "yield", "await");

    private static final Set<String> RESTRICTED = Set.of(
            "arguments", "eval", "undefined", "NaN", "Infinity");

    private static final Set<String> RUNTIME_GLOBALS = Set.of(
            "Object", "Array", "String", "Number", "Boolean", "Math", "JSON", "Error", "TypeError",
            "RangeError", "ReferenceError", "SyntaxError", "Symbol", "Function", "Date", "RegExp",
            "console", "parseInt", "parseFloat", "isNaN", "isFinite");

    private ReservedWords() {
    }

    /**
     * @param name A candidate identifier.
     * @return true if generated code may not use it as a variable name.
     */
    public static boolean isReserved(String name) {
        return KEYWORDS.contains(name) || RESTRICTED.contains(name) || RUNTIME_GLOBALS.contains(name);
    }
}
