package org.pyjs.compiler.runtime;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Maps the builtin names of the source language to the runtime expressions that implement them.
 * Immutable after class initialization.
 */
public final class Builtins {

    /** The name that is only valid as {@code super().method(...)}. */
    public static final String SUPER = "super";

    /** The decorator that turns a class-body function into a method without a receiver. */
    public static final String STATICMETHOD = "staticmethod";

    private static final Map<String, String> BUILTINS;

    static {
        Map<String, String> map = new TreeMap<>();
        for (String function : new String[] {
                "print", "len", "range", "str", "repr", "int", "float", "bool", "list", "tuple",
                "dict", "set", "abs", "min", "max", "sum", "sorted", "reversed", "enumerate", "zip",
                "map", "filter", "any", "all", "isinstance", "hasattr", "getattr", "setattr",
                "callable", "round", "chr", "ord"}) {
            map.put(function, RuntimeLibrary.FUNCTION_PREFIX + function);
        }
        for (String exception : ExceptionHelpers.EXCEPTION_NAMES) {
            map.put(exception, RuntimeLibrary.EXCEPTION_PREFIX + exception);
        }
        map.put(STATICMETHOD, RuntimeLibrary.FUNCTION_PREFIX + "op_staticmethod");
        map.put("object", "Object");
        map.put(SUPER, SUPER);
        BUILTINS = Collections.unmodifiableMap(map);
    }

    private Builtins() {
    }

    /**
     * @param name A source-language name.
     * @return The emitted expression for the builtin, if the name is one.
     */
    public static Optional<String> lookup(String name) {
        return Optional.ofNullable(BUILTINS.get(name));
    }

    /**
     * @return The builtin names in sorted order.
     */
    public static Iterable<String> names() {
        return BUILTINS.keySet();
    }
}
