package org.pyjs.compiler.api;

/**
 * Native constructs a target profile may declare support for.
 */
public enum TargetFeature {
    /** {@code function*} and {@code yield}. */
    GENERATORS,
    /** {@code async function} and {@code await}. */
    ASYNC,
    /** {@code let} declarations. */
    BLOCK_SCOPING
}
