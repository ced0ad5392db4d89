package org.pyjs.compiler.api;

/**
 * How the runtime helpers referenced by generated code are made available.
 */
public enum HelperLinking {
    /** Helper definitions are prepended to the generated code. */
    INLINE,
    /** Helpers are imported from a shared runtime module referenced by a stable name. */
    EXTERNAL
}
