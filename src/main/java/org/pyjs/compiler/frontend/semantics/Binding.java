package org.pyjs.compiler.frontend.semantics;

import org.pyjs.compiler.diagnostics.SourcePosition;
import org.pyjs.compiler.frontend.parser.ast.SyntaxNode;

import java.util.Optional;

/**
 * The resolved nature of one name in one scope.
 *
 * <p>A binding is owned by the scope that declares it. {@link BindingKind#ENCLOSING} and
 * {@link BindingKind#GLOBAL} declarations point at the binding they capture through
 * {@link #target()}; host globals and builtins have no target and carry their emitted
 * name in {@link #externalName()}.</p>
 */
public final class Binding {

    private final String name;
    private final BindingKind kind;
    private final Scope scope;
    private final SourcePosition position;
    private final ParameterKind parameterKind;
    private final SyntaxNode defaultValue;
    private final String externalName;

    private Binding target;
    private boolean loopVariable;
    private boolean boundOutsideLoop;
    private boolean shadowing;

    private Binding(String name, BindingKind kind, Scope scope, SourcePosition position,
                    ParameterKind parameterKind, SyntaxNode defaultValue, String externalName) {
        this.name = name;
        this.kind = kind;
        this.scope = scope;
        this.position = position;
        this.parameterKind = parameterKind;
        this.defaultValue = defaultValue;
        this.externalName = externalName;
    }

    static Binding variable(String name, BindingKind kind, Scope scope, SourcePosition position) {
        return new Binding(name, kind, scope, position, null, null, null);
    }

    static Binding parameter(String name, Scope scope, SourcePosition position,
                             ParameterKind parameterKind, SyntaxNode defaultValue) {
        return new Binding(name, BindingKind.PARAMETER, scope, position, parameterKind, defaultValue, null);
    }

    static Binding external(String name, BindingKind kind, String externalName) {
        return new Binding(name, kind, null, SourcePosition.UNKNOWN, null, null, externalName);
    }

    public String name() {
        return name;
    }

    public BindingKind kind() {
        return kind;
    }

    /**
     * @return The owning scope, or null for builtins and host globals.
     */
    public Scope scope() {
        return scope;
    }

    public SourcePosition position() {
        return position;
    }

    public Optional<ParameterKind> parameterKind() {
        return Optional.ofNullable(parameterKind);
    }

    /**
     * @return The default value expression of a parameter, if it has one.
     */
    public Optional<SyntaxNode> defaultValue() {
        return defaultValue == null || defaultValue.isEmpty() ? Optional.empty() : Optional.of(defaultValue);
    }

    /**
     * @return The emitted name of a builtin or host global.
     */
    public String externalName() {
        return externalName;
    }

    /**
     * @return The captured binding of a {@code global} or {@code nonlocal} declaration, or null.
     */
    public Binding target() {
        return target;
    }

    void setTarget(Binding target) {
        this.target = target;
    }

    /**
     * Follows {@code global}/{@code nonlocal} declarations to the binding that owns the storage.
     * @return The owning binding.
     */
    public Binding resolve() {
        Binding current = this;
        while (current.target != null) {
            current = current.target;
        }
        return current;
    }

    /**
     * @return true if this is the owner of a JavaScript variable declared in its scope.
     */
    public boolean isDeclaredVariable() {
        return kind == BindingKind.LOCAL || kind == BindingKind.MODULE;
    }

    public boolean isLoopVariable() {
        return loopVariable;
    }

    void markLoopVariable() {
        this.loopVariable = true;
    }

    void markBoundOutsideLoop() {
        this.boundOutsideLoop = true;
    }

    /**
     * A variable of a module or function that only {@code for} targets bind lives in the block
     * of its loop: it is declared there and cannot be referenced after the loop.
     *
     * @return true if this binding is confined to the {@code for} statements that bind it.
     */
    public boolean isLoopScoped() {
        return loopVariable && !boundOutsideLoop && isDeclaredVariable()
                && (scope.kind() == ScopeKind.MODULE || scope.kind() == ScopeKind.FUNCTION);
    }

    /**
     * @return true if this binding hides a module name that a nested {@code global} declaration needs.
     */
    public boolean isShadowing() {
        return shadowing;
    }

    void markShadowing() {
        this.shadowing = true;
    }

    @Override
    public String toString() {
        return kind + " " + name;
    }
}
