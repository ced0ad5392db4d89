package org.pyjs.compiler.frontend.semantics;

/**
 * The kind of lexical region a {@link Scope} represents.
 */
public enum ScopeKind {
    MODULE,
    FUNCTION,
    /** Class body; its bindings become prototype attributes, not lexical variables. */
    CLASS,
    COMPREHENSION,
    LAMBDA
}
