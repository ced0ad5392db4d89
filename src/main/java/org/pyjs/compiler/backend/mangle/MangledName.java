package org.pyjs.compiler.backend.mangle;

/**
 * The emitted name chosen for one binding.
 *
 * @param original The name as written in the source.
 * @param target   The name used in the generated code.
 */
public record MangledName(String original, String target) {

    public boolean isRenamed() {
        return !original.equals(target);
    }

    @Override
    public String toString() {
        return isRenamed() ? original + " -> " + target : original;
    }
}
