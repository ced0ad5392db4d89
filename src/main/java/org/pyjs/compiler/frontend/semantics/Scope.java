package org.pyjs.compiler.frontend.semantics;

import org.pyjs.compiler.frontend.parser.ast.SyntaxNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One lexical region of the program. Scopes form a tree rooted at the module scope.
 * Bindings keep their declaration order, which drives deterministic output.
 */
public final class Scope {

    private final ScopeKind kind;
    private final String name;
    private final SyntaxNode node;
    private final Scope parent;
    private final List<Scope> children = new ArrayList<>();
    private final Map<String, Binding> bindings = new LinkedHashMap<>();
    private final Set<ScopeFlag> flags = EnumSet.noneOf(ScopeFlag.class);

    Scope(ScopeKind kind, String name, SyntaxNode node, Scope parent) {
        this.kind = kind;
        this.name = name;
        this.node = node;
        this.parent = parent;
        if (parent != null) {
            parent.children.add(this);
        }
    }

    public ScopeKind kind() {
        return kind;
    }

    /**
     * @return The function or class name, or a descriptive label for anonymous scopes.
     */
    public String name() {
        return name;
    }

    /**
     * @return The node that introduced this scope.
     */
    public SyntaxNode node() {
        return node;
    }

    /**
     * @return The parent scope, or null for the module scope.
     */
    public Scope parent() {
        return parent;
    }

    public List<Scope> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Looks up a binding declared in this scope only.
     * @param name The original name.
     * @return The binding, if declared here.
     */
    public Optional<Binding> lookup(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    /**
     * @return All bindings in declaration order.
     */
    public Collection<Binding> bindings() {
        return Collections.unmodifiableCollection(bindings.values());
    }

    Binding define(Binding binding) {
        bindings.put(binding.name(), binding);
        return binding;
    }

    public boolean has(ScopeFlag flag) {
        return flags.contains(flag);
    }

    void set(ScopeFlag flag) {
        flags.add(flag);
    }

    public Set<ScopeFlag> flags() {
        return Collections.unmodifiableSet(flags);
    }

    /**
     * @return true for scopes that become a JavaScript function (function, lambda, comprehension).
     */
    public boolean isFunctionLike() {
        return kind == ScopeKind.FUNCTION || kind == ScopeKind.LAMBDA || kind == ScopeKind.COMPREHENSION;
    }

    /**
     * @return true for a function defined directly in a class body.
     */
    public boolean isMethod() {
        return kind == ScopeKind.FUNCTION && parent != null && parent.kind == ScopeKind.CLASS;
    }

    @Override
    public String toString() {
        return kind + " " + name;
    }
}
