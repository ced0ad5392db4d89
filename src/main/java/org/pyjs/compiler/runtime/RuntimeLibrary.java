package org.pyjs.compiler.runtime;

import org.pyjs.compiler.diagnostics.InternalInvariantError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The catalog of runtime support helpers that generated code calls into.
 *
 * <p>The catalog is built once when the class is initialized and is immutable afterwards,
 * so it is safe to share between concurrent compilations. Dependencies between helpers are
 * derived from the helper sources themselves: every reserved-prefix identifier in a helper's
 * source must name another catalog entry.</p>
 *
 * <p>Load order is deterministic. Function helpers are hoisted declarations and come first,
 * sorted by name. Class helpers follow, each one after the classes it extends, with ties
 * broken by name.</p>
 */
public final class RuntimeLibrary {

    private static final Logger LOG = LoggerFactory.getLogger(RuntimeLibrary.class);

    /** Version of the helper contract; bumped whenever a helper's calling convention changes. */
    public static final String VERSION = "1.0.0";

    /** Prefix reserved for all runtime names. Source identifiers with this prefix get renamed. */
    public static final String RESERVED_PREFIX = "_py";
    public static final String FUNCTION_PREFIX = "_pyfunc_";
    public static final String METHOD_PREFIX = "_pymeth_";
    public static final String EXCEPTION_PREFIX = "_pyexc_";

    private static final Pattern REFERENCE = Pattern.compile("_py(?:func|meth|exc)_[A-Za-z0-9_]+");

    private static final Map<String, RuntimeHelper> CATALOG;

    static {
        Registry registry = new Registry();
        CoreHelpers.register(registry);
        OperatorHelpers.register(registry);
        IterationHelpers.register(registry);
        ContainerHelpers.register(registry);
        StringHelpers.register(registry);
        BuiltinHelpers.register(registry);
        MethodHelpers.register(registry);
        ClassHelpers.register(registry);
        ExceptionHelpers.register(registry);
        CATALOG = registry.build();
        LOG.debug("Runtime library {} initialized with {} helpers", VERSION, CATALOG.size());
    }

    private RuntimeLibrary() {
    }

    public static boolean contains(String name) {
        return CATALOG.containsKey(name);
    }

    /**
     * @param name A helper name.
     * @return The helper.
     * @throws InternalInvariantError if no helper has that name.
     */
    public static RuntimeHelper get(String name) {
        RuntimeHelper helper = CATALOG.get(name);
        if (helper == null) {
            throw new InternalInvariantError("Unknown runtime helper '" + name + "'");
        }
        return helper;
    }

    /**
     * @return All helper names, sorted.
     */
    public static SortedSet<String> names() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(CATALOG.keySet()));
    }

    /**
     * Computes the transitive dependency closure of a set of helpers.
     * @param names The helpers referenced directly.
     * @return The referenced helpers plus everything they need, sorted by name.
     * @throws InternalInvariantError if a name is not in the catalog.
     */
    public static SortedSet<String> closure(Collection<String> names) {
        SortedSet<String> result = new TreeSet<>();
        Deque<String> pending = new ArrayDeque<>(names);
        while (!pending.isEmpty()) {
            String name = pending.pop();
            if (result.add(name)) {
                pending.addAll(get(name).dependencies());
            }
        }
        return result;
    }

    /**
     * Orders the closure of the given helpers for loading.
     * @param names The helpers referenced directly.
     * @return The helpers to load, in load order.
     */
    public static List<RuntimeHelper> loadOrder(Collection<String> names) {
        SortedSet<String> closure = closure(names);
        List<RuntimeHelper> ordered = new ArrayList<>();
        for (String name : closure) {
            RuntimeHelper helper = CATALOG.get(name);
            if (helper.kind() == RuntimeHelper.Kind.FUNCTION) {
                ordered.add(helper);
            }
        }
        Set<String> placed = new LinkedHashSet<>();
        for (String name : closure) {
            placeClass(CATALOG.get(name), closure, placed, ordered);
        }
        return ordered;
    }

    private static void placeClass(RuntimeHelper helper, Set<String> closure, Set<String> placed,
                                   List<RuntimeHelper> out) {
        if (helper.kind() != RuntimeHelper.Kind.CLASS || !placed.add(helper.name())) {
            return;
        }
        for (String dependency : helper.dependencies()) {
            if (closure.contains(dependency)) {
                placeClass(CATALOG.get(dependency), closure, placed, out);
            }
        }
        out.add(helper);
    }

    /**
     * Renders the definitions of the given helpers and their dependencies.
     * @param names The helpers referenced directly.
     * @return The helper sources in load order, each followed by a newline.
     */
    public static String definitions(Collection<String> names) {
        StringBuilder sb = new StringBuilder();
        for (RuntimeHelper helper : loadOrder(names)) {
            sb.append(helper.source());
        }
        return sb.toString();
    }

    /**
     * Renders the complete library as a standalone script that defines one global object.
     * Generated code linked externally reads its helpers from that object.
     * @param moduleName The name of the global variable holding the library.
     * @return The library source.
     */
    public static String moduleSource(String moduleName) {
        StringBuilder sb = new StringBuilder();
        sb.append("// runtime library ").append(VERSION).append('\n');
        sb.append("var ").append(moduleName).append(" = (function () {\n");
        for (RuntimeHelper helper : loadOrder(CATALOG.keySet())) {
            for (String line : helper.source().split("\n", -1)) {
                if (!line.isEmpty()) {
                    sb.append("    ").append(line);
                }
                sb.append('\n');
            }
        }
        sb.append("    return {\n");
        List<String> entries = new ArrayList<>();
        for (String name : CATALOG.keySet()) {
            entries.add("        " + name + ": " + name);
        }
        sb.append(String.join(",\n", entries)).append('\n');
        sb.append("    };\n");
        sb.append("})();\n");
        return sb.toString();
    }

    /**
     * Collects helper definitions while the catalog is being built.
     */
    static final class Registry {

        private final Map<String, RuntimeHelper.Kind> kinds = new TreeMap<>();
        private final Map<String, String> sources = new TreeMap<>();

        void function(String name, String source) {
            add(name, RuntimeHelper.Kind.FUNCTION, source);
        }

        void type(String name, String source) {
            add(name, RuntimeHelper.Kind.CLASS, source);
        }

        private void add(String name, RuntimeHelper.Kind kind, String source) {
            if (!name.startsWith(RESERVED_PREFIX)) {
                throw new InternalInvariantError("Runtime helper '" + name + "' lacks the reserved prefix");
            }
            if (sources.putIfAbsent(name, source) != null) {
                throw new InternalInvariantError("Runtime helper '" + name + "' is defined twice");
            }
            kinds.put(name, kind);
        }

        Map<String, RuntimeHelper> build() {
            Map<String, RuntimeHelper> catalog = new TreeMap<>();
            for (Map.Entry<String, String> entry : sources.entrySet()) {
                String name = entry.getKey();
                SortedSet<String> dependencies = new TreeSet<>();
                Matcher matcher = REFERENCE.matcher(entry.getValue());
                while (matcher.find()) {
                    String reference = matcher.group();
                    if (!sources.containsKey(reference)) {
                        throw new InternalInvariantError(
                                "Runtime helper '" + name + "' references unknown helper '" + reference + "'");
                    }
                    if (!reference.equals(name)) {
                        dependencies.add(reference);
                    }
                }
                catalog.put(name, new RuntimeHelper(name, kinds.get(name), entry.getValue(), dependencies));
            }
            return Collections.unmodifiableMap(catalog);
        }
    }
}
