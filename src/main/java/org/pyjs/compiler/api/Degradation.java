package org.pyjs.compiler.api;

/**
 * Policy for constructs the active target profile cannot express natively.
 */
public enum Degradation {
    /** Fail with an unsupported-construct error. */
    NONE,
    /**
     * Lower generator expressions and statement-only generator functions to eagerly
     * built arrays. Opt-in, since it changes evaluation order.
     */
    EAGER
}
