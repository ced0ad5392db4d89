package org.pyjs.compiler.api;

/**
 * The indentation unit used by the output assembler.
 */
public enum IndentStyle {
    SPACES,
    TABS
}
