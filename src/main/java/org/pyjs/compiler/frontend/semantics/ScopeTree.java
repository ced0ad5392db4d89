package org.pyjs.compiler.frontend.semantics;

import org.pyjs.compiler.diagnostics.InternalInvariantError;
import org.pyjs.compiler.frontend.parser.ast.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The result of scope analysis: the scope tree plus node-identity keyed annotations.
 *
 * <p>Scope-introducing nodes (module, def, class, lambda, comprehensions) map to their
 * {@link Scope}. NAME nodes, parameters, except handlers and def/class statements map to
 * the {@link Binding} they reference or declare.</p>
 */
public final class ScopeTree {

    private final Scope moduleScope;
    private final Map<SyntaxNode, Scope> scopes = new IdentityHashMap<>();
    private final Map<SyntaxNode, Binding> bindings = new IdentityHashMap<>();
    private final Set<SyntaxNode> failedStatements = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<String> names = new HashSet<>();

    ScopeTree(Scope moduleScope) {
        this.moduleScope = moduleScope;
        scopes.put(moduleScope.node(), moduleScope);
    }

    public Scope moduleScope() {
        return moduleScope;
    }

    /**
     * @param node A scope-introducing node.
     * @return Its scope.
     * @throws InternalInvariantError if the node was not analyzed.
     */
    public Scope scopeOf(SyntaxNode node) {
        Scope scope = scopes.get(node);
        if (scope == null) {
            throw new InternalInvariantError("No scope recorded for " + node.kind() + " node", node.position());
        }
        return scope;
    }

    /**
     * @param node A NAME, PARAM, EXCEPT_HANDLER, FUNCTION_DEF or CLASS_DEF node.
     * @return The binding it references or declares.
     * @throws InternalInvariantError if the node was never resolved.
     */
    public Binding bindingOf(SyntaxNode node) {
        Binding binding = bindings.get(node);
        if (binding == null) {
            throw new InternalInvariantError("Unresolved " + node.kind() + " '" + node.text() + "'", node.position());
        }
        return binding;
    }

    public Optional<Binding> findBinding(SyntaxNode node) {
        return Optional.ofNullable(bindings.get(node));
    }

    /**
     * @return Every scope in pre-order, module first.
     */
    public List<Scope> scopesInPreOrder() {
        List<Scope> result = new ArrayList<>();
        collect(moduleScope, result);
        return result;
    }

    private static void collect(Scope scope, List<Scope> out) {
        out.add(scope);
        for (Scope child : scope.children()) {
            collect(child, out);
        }
    }

    /**
     * @return true if analysis of this top-level statement failed in batch mode.
     */
    public boolean isFailed(SyntaxNode statement) {
        return failedStatements.contains(statement);
    }

    /**
     * @return Every identifier that occurs in the program, declared or referenced.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(names);
    }

    void recordScope(SyntaxNode node, Scope scope) {
        scopes.put(node, scope);
    }

    void recordBinding(SyntaxNode node, Binding binding) {
        bindings.put(node, binding);
    }

    void recordName(String name) {
        names.add(name);
    }

    void markFailed(SyntaxNode statement) {
        failedStatements.add(statement);
    }
}
