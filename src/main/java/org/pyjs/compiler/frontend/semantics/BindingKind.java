package org.pyjs.compiler.frontend.semantics;

/**
 * The resolved nature of a name.
 */
public enum BindingKind {
    /** Assigned inside a function, lambda or comprehension. */
    LOCAL,
    PARAMETER,
    /** Declared {@code nonlocal}; captures a binding of an enclosing function. */
    ENCLOSING,
    /** Assigned at module level. */
    MODULE,
    /**
     * Declared {@code global} (captures a module binding), or a host global such as
     * {@code console} that has no binding in the program.
     */
    GLOBAL,
    /** Assigned in a class body; lives on the prototype. */
    CLASS_ATTRIBUTE,
    /** A builtin backed by the runtime library. */
    BUILTIN
}
