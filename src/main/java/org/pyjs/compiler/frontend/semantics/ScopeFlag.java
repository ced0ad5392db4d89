package org.pyjs.compiler.frontend.semantics;

/**
 * Facts about a scope discovered during analysis.
 */
public enum ScopeFlag {
    /** The function body contains {@code yield} or {@code yield from}. */
    GENERATOR,
    /** The function was declared with {@code async def}. */
    ASYNC,
    /** A nested function or lambda captures a {@code for} target of this scope. */
    CLOSURE_OVER_LOOP_VARIABLE,
    /** The method calls {@code super()}. */
    USES_SUPER,
    /** The function contains {@code return <value>}. */
    HAS_RETURN_VALUE
}
