package org.pyjs.compiler.runtime;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One named definition of the runtime support library.
 *
 * @param name         The emitted name, carrying one of the reserved runtime prefixes.
 * @param kind         Whether the definition is a hoisted function or a class built at load time.
 * @param source       The JavaScript source of the definition.
 * @param dependencies The other helpers the source references, sorted by name.
 */
public record RuntimeHelper(String name, Kind kind, String source, SortedSet<String> dependencies) {

    /**
     * How a helper becomes available when its definitions are loaded.
     */
    public enum Kind {
        /** A function declaration; usable anywhere in the emitted text once it is present. */
        FUNCTION,
        /** A constructor plus load-time statements; its base classes must be loaded before it. */
        CLASS
    }

    public RuntimeHelper {
        dependencies = Collections.unmodifiableSortedSet(new TreeSet<>(dependencies));
    }
}
