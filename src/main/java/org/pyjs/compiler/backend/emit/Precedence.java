package org.pyjs.compiler.backend.emit;

/**
 * JavaScript operator precedence levels, loosest first.
 */
public enum Precedence {
    SEQUENCE,
    /** Assignment, {@code yield} and function expressions. */
    ASSIGNMENT,
    CONDITIONAL,
    LOGICAL_OR,
    LOGICAL_AND,
    BITWISE_OR,
    BITWISE_XOR,
    BITWISE_AND,
    EQUALITY,
    RELATIONAL,
    SHIFT,
    ADDITIVE,
    MULTIPLICATIVE,
    /** Prefix operators and {@code await}. */
    UNARY,
    /** Member access and calls. */
    CALL,
    /** Literals, names and parenthesized expressions. */
    PRIMARY;

    /**
     * @return The next tighter level, used for the right operand of a left-associative operator.
     */
    public Precedence tighter() {
        Precedence[] levels = values();
        return ordinal() + 1 < levels.length ? levels[ordinal() + 1] : this;
    }

    public boolean isLooserThan(Precedence other) {
        return ordinal() < other.ordinal();
    }
}
