package org.pyjs.compiler.api;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The outcome of a successful compile call.
 *
 * @param source      The generated JavaScript text.
 * @param usedHelpers The runtime helper names referenced directly by the generated code,
 *                    sorted by name. Callers linking helpers externally must provide these.
 */
public record TranslationResult(String source, SortedSet<String> usedHelpers) {

    public TranslationResult {
        usedHelpers = Collections.unmodifiableSortedSet(new TreeSet<>(usedHelpers));
    }
}
