package org.pyjs.compiler.api;

/**
 * How translation errors propagate within one compile call.
 */
public enum Strictness {
    /** The first error aborts the call. */
    FAIL_FAST,
    /** Errors are collected per top-level statement and reported together. */
    BATCH
}
