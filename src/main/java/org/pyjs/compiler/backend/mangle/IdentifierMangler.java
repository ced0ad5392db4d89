package org.pyjs.compiler.backend.mangle;

import org.pyjs.compiler.diagnostics.InternalInvariantError;
import org.pyjs.compiler.diagnostics.ReservedNameCollisionError;
import org.pyjs.compiler.frontend.semantics.Binding;
import org.pyjs.compiler.frontend.semantics.BindingKind;
import org.pyjs.compiler.frontend.semantics.Scope;
import org.pyjs.compiler.frontend.semantics.ScopeTree;
import org.pyjs.compiler.runtime.RuntimeLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assigns every variable binding of a program the name it carries in the generated code.
 *
 * <p>A name is kept as written unless it is a reserved word, collides with a runtime helper,
 * starts with the reserved runtime prefix, or was marked by the analyzer as shadowing a
 * global that a nested function needs. Renamed candidates must not equal any identifier of
 * the program, any runtime helper, or any emitted name already assigned in the same scope or
 * a scope visible from it.</p>
 *
 * <p>All names are assigned up front by {@link #assign()}, in scope pre-order and binding
 * declaration order, so the result does not depend on emission order.</p>
 */
public class IdentifierMangler {

    private static final Logger LOG = LoggerFactory.getLogger(IdentifierMangler.class);

    static final int MAX_ATTEMPTS = 1000;

    private final ScopeTree tree;
    private final Map<Binding, MangledName> names = new IdentityHashMap<>();
    private final Map<Scope, Set<String>> targetsByScope = new HashMap<>();
    private boolean assigned;

    /**
     * @param tree The analyzed program.
     */
    public IdentifierMangler(ScopeTree tree) {
        this.tree = tree;
    }

    /**
     * Assigns a target name to every module, local and parameter binding.
     * @return this mangler.
     * @throws ReservedNameCollisionError if no unique name can be found for a binding.
     */
    public IdentifierMangler assign() {
        if (assigned) {
            return this;
        }
        for (Scope scope : tree.scopesInPreOrder()) {
            for (Binding binding : scope.bindings()) {
                if (isMangled(binding.kind())) {
                    MangledName name = new MangledName(binding.name(), chooseTarget(binding, scope));
                    names.put(binding, name);
                    targetsByScope.computeIfAbsent(scope, s -> new HashSet<>()).add(name.target());
                    if (name.isRenamed()) {
                        LOG.debug("Renamed '{}' in {} to '{}'", name.original(), scope, name.target());
                    }
                }
            }
        }
        assigned = true;
        return this;
    }

    /**
     * Resolves the emitted name of a binding.
     * @param binding A binding recorded in the scope tree.
     * @return The name generated code uses to refer to it.
     * @throws InternalInvariantError if the binding has no emitted name.
     */
    public String targetName(Binding binding) {
        return switch (binding.kind()) {
            case BUILTIN -> binding.externalName();
            case GLOBAL -> binding.target() == null ? binding.externalName() : targetName(binding.target());
            case ENCLOSING -> {
                if (binding.target() == null) {
                    throw new InternalInvariantError("Nonlocal '" + binding.name() + "' was never linked",
                            binding.position());
                }
                yield targetName(binding.target());
            }
            case CLASS_ATTRIBUTE -> binding.name();
            case MODULE, LOCAL, PARAMETER -> {
                MangledName name = names.get(binding);
                if (name == null) {
                    throw new InternalInvariantError("No emitted name assigned to " + binding, binding.position());
                }
                yield name.target();
            }
        };
    }

    /**
     * @return The renamed bindings in assignment order.
     */
    public List<MangledName> renamed() {
        List<MangledName> result = new ArrayList<>();
        for (Scope scope : tree.scopesInPreOrder()) {
            for (Binding binding : scope.bindings()) {
                MangledName name = names.get(binding);
                if (name != null && name.isRenamed()) {
                    result.add(name);
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static boolean isMangled(BindingKind kind) {
        return kind == BindingKind.MODULE || kind == BindingKind.LOCAL || kind == BindingKind.PARAMETER;
    }

    private String chooseTarget(Binding binding, Scope scope) {
        String original = binding.name();
        boolean prefixed = original.startsWith(RuntimeLibrary.RESERVED_PREFIX);
        boolean needsRename = prefixed || binding.isShadowing() || ReservedWords.isReserved(original)
                || RuntimeLibrary.contains(original);
        if (!needsRename) {
            return original;
        }
        String base = prefixed ? "_" + original : original;
        if (prefixed && isAvailable(base, scope)) {
            return base;
        }
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            String candidate = base + "_" + attempt;
            if (isAvailable(candidate, scope)) {
                return candidate;
            }
        }
        throw new ReservedNameCollisionError("Could not find a unique emitted name for '" + original + "' in "
                + scope + " after " + MAX_ATTEMPTS + " attempts", binding.position());
    }

    private boolean isAvailable(String candidate, Scope scope) {
        return !tree.names().contains(candidate)
                && !candidate.startsWith(RuntimeLibrary.RESERVED_PREFIX)
                && !ReservedWords.isReserved(candidate)
                && !RuntimeLibrary.contains(candidate)
                && !isTaken(candidate, scope);
    }

    private boolean isTaken(String candidate, Scope scope) {
        for (Scope s = scope; s != null; s = s.parent()) {
            if (targetsByScope.getOrDefault(s, Set.of()).contains(candidate)) {
                return true;
            }
        }
        return false;
    }
}
