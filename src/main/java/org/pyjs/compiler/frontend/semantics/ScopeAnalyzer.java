package org.pyjs.compiler.frontend.semantics;

import org.pyjs.compiler.diagnostics.DiagnosticsEngine;
import org.pyjs.compiler.diagnostics.InternalInvariantError;
import org.pyjs.compiler.diagnostics.NameResolutionError;
import org.pyjs.compiler.diagnostics.TranslationError;
import org.pyjs.compiler.diagnostics.UnsupportedConstructError;
import org.pyjs.compiler.frontend.parser.ast.NodeKind;
import org.pyjs.compiler.frontend.parser.ast.SyntaxNode;
import org.pyjs.compiler.runtime.Builtins;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the {@link ScopeTree} for a module and resolves every name reference to a {@link Binding}.
 *
 * <p>Analysis runs in two passes over the whole module. Pass 1 creates every scope and collects
 * every binding-producing construct, so an assignment anywhere in a function makes the name local
 * to the whole function. Pass 2 resolves references and performs the context checks (return,
 * yield, await and super placement, inheritance diamonds). Errors are reported per top-level
 * statement through the {@link DiagnosticsEngine}; in batch mode a failing statement is marked
 * in the tree and the remaining statements are still analyzed.</p>
 */
public class ScopeAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ScopeAnalyzer.class);

    private final DiagnosticsEngine diagnostics;
    private final Set<String> allowedGlobals;
    private final Map<String, Binding> externals = new HashMap<>();
    private final Map<Binding, List<Binding>> moduleClassBases = new IdentityHashMap<>();
    private final List<Binding> activeLoopVariables = new ArrayList<>();
    private ScopeTree tree;

    /**
     * @param diagnostics    Receives analysis errors.
     * @param allowedGlobals Host globals that unbound names may refer to.
     */
    public ScopeAnalyzer(DiagnosticsEngine diagnostics, Collection<String> allowedGlobals) {
        this.diagnostics = diagnostics;
        this.allowedGlobals = new LinkedHashSet<>(allowedGlobals);
    }

    /**
     * Analyzes a module.
     * @param module The MODULE node.
     * @return The scope tree with all resolutions recorded.
     */
    public ScopeTree analyze(SyntaxNode module) {
        if (!module.is(NodeKind.MODULE)) {
            throw new InternalInvariantError("Expected a MODULE node but got " + module.kind(), module.position());
        }
        Scope moduleScope = new Scope(ScopeKind.MODULE, "<module>", module, null);
        tree = new ScopeTree(moduleScope);

        for (SyntaxNode statement : module.children()) {
            try {
                collectStatement(statement, moduleScope);
            } catch (TranslationError e) {
                tree.markFailed(statement);
                diagnostics.report(e);
            }
        }
        markShadowedGlobals();
        markNonlocalTargets();
        for (SyntaxNode statement : module.children()) {
            if (tree.isFailed(statement)) {
                continue;
            }
            try {
                resolve(statement, moduleScope);
            } catch (TranslationError e) {
                tree.markFailed(statement);
                diagnostics.report(e);
            }
        }
        LOG.debug("Scope analysis found {} scopes", tree.scopesInPreOrder().size());
        return tree;
    }

    // --- pass 1: scopes and bindings ---

    private void collectStatement(SyntaxNode node, Scope scope) {
        switch (node.kind()) {
            case BLOCK -> node.children().forEach(child -> collectStatement(child, scope));
            case ASSIGN -> {
                for (int i = 0; i < node.childCount() - 1; i++) {
                    collectTarget(node.child(i), scope, false);
                }
                node.children().forEach(child -> collectExpression(child, scope));
            }
            case AUG_ASSIGN, DELETE -> {
                node.children().forEach(child -> collectTarget(child, scope, false));
                node.children().forEach(child -> collectExpression(child, scope));
            }
            case ANN_ASSIGN -> {
                collectTarget(node.child(0), scope, false);
                collectExpression(node.child(0), scope);
                collectExpression(node.child(2), scope);
            }
            case FOR, ASYNC_FOR -> {
                collectTarget(node.child(0), scope, true);
                collectExpression(node.child(0), scope);
                collectExpression(node.child(1), scope);
                collectStatement(node.child(2), scope);
                collectStatement(node.child(3), scope);
            }
            case WITH, ASYNC_WITH -> {
                for (SyntaxNode child : node.children()) {
                    if (child.is(NodeKind.WITH_ITEM)) {
                        collectExpression(child.child(0), scope);
                        collectTarget(child.child(1), scope, false);
                        collectExpression(child.child(1), scope);
                    } else {
                        collectStatement(child, scope);
                    }
                }
            }
            case TRY -> {
                for (SyntaxNode child : node.children()) {
                    if (child.is(NodeKind.EXCEPT_HANDLER)) {
                        collectExpression(child.child(0), scope);
                        if (child.text() != null) {
                            tree.recordBinding(child, bind(scope, child.text(), child, false));
                        }
                        collectStatement(child.child(1), scope);
                    } else {
                        collectStatement(child, scope);
                    }
                }
            }
            case IF, WHILE -> {
                collectExpression(node.child(0), scope);
                collectStatement(node.child(1), scope);
                collectStatement(node.child(2), scope);
            }
            case FUNCTION_DEF, ASYNC_FUNCTION_DEF -> collectFunction(node, scope);
            case CLASS_DEF -> collectClass(node, scope);
            case GLOBAL -> node.names().forEach(name -> declareGlobal(name, node, scope));
            case NONLOCAL -> node.names().forEach(name -> declareNonlocal(name, node, scope));
            case EXPR_STMT, RETURN, RAISE, ASSERT -> node.children().forEach(child -> collectExpression(child, scope));
            default -> {
                // PASS, BREAK, CONTINUE, IMPORT and EMPTY declare nothing
            }
        }
    }

    private void collectExpression(SyntaxNode node, Scope scope) {
        switch (node.kind()) {
            case NAME -> tree.recordName(node.text());
            case LAMBDA -> collectLambda(node, scope);
            case LIST_COMP, SET_COMP, GENERATOR_EXP, DICT_COMP -> collectComprehension(node, scope);
            default -> node.children().forEach(child -> collectExpression(child, scope));
        }
    }

    private void collectTarget(SyntaxNode target, Scope scope, boolean loopTarget) {
        switch (target.kind()) {
            case NAME -> bind(scope, target.text(), target, loopTarget);
            case TUPLE, LIST -> target.children().forEach(child -> collectTarget(child, scope, loopTarget));
            case STARRED -> collectTarget(target.child(0), scope, loopTarget);
            default -> {
                // attribute and subscript targets bind no name
            }
        }
    }

    private Binding bind(Scope scope, String name, SyntaxNode declaration, boolean loopTarget) {
        tree.recordName(name);
        Binding binding = scope.lookup(name).orElseGet(() -> {
            BindingKind kind = switch (scope.kind()) {
                case MODULE -> BindingKind.MODULE;
                case CLASS -> BindingKind.CLASS_ATTRIBUTE;
                default -> BindingKind.LOCAL;
            };
            return scope.define(Binding.variable(name, kind, scope, declaration.position()));
        });
        if (loopTarget) {
            binding.markLoopVariable();
        } else {
            binding.markBoundOutsideLoop();
        }
        return binding;
    }

    private void collectFunction(SyntaxNode node, Scope scope) {
        SyntaxNode parameters = node.child(0);
        collectExpression(node.child(2), scope);
        collectDefaults(parameters, scope);
        tree.recordBinding(node, bind(scope, node.text(), node, false));

        Scope function = new Scope(ScopeKind.FUNCTION, node.text(), node, scope);
        tree.recordScope(node, function);
        if (node.is(NodeKind.ASYNC_FUNCTION_DEF)) {
            function.set(ScopeFlag.ASYNC);
        }
        declareParameters(parameters, function);
        collectStatement(node.child(1), function);
    }

    private void collectLambda(SyntaxNode node, Scope scope) {
        SyntaxNode parameters = node.child(0);
        collectDefaults(parameters, scope);
        Scope lambda = new Scope(ScopeKind.LAMBDA, "<lambda>", node, scope);
        tree.recordScope(node, lambda);
        declareParameters(parameters, lambda);
        collectExpression(node.child(1), lambda);
    }

    private void collectClass(SyntaxNode node, Scope scope) {
        collectExpression(node.child(0), scope);
        collectExpression(node.child(2), scope);
        tree.recordBinding(node, bind(scope, node.text(), node, false));
        Scope body = new Scope(ScopeKind.CLASS, node.text(), node, scope);
        tree.recordScope(node, body);
        collectStatement(node.child(1), body);
    }

    private void collectComprehension(SyntaxNode node, Scope scope) {
        List<SyntaxNode> clauses = node.comprehensionClauses();
        collectExpression(clauses.get(0).child(1), scope);

        Scope comprehension = new Scope(ScopeKind.COMPREHENSION,
                "<" + node.kind().name().toLowerCase(Locale.ROOT) + ">", node, scope);
        tree.recordScope(node, comprehension);
        for (int i = 0; i < clauses.size(); i++) {
            SyntaxNode clause = clauses.get(i);
            collectTarget(clause.child(0), comprehension, true);
            for (int c = 0; c < clause.childCount(); c++) {
                if (c == 1 && i == 0) {
                    continue;
                }
                collectExpression(clause.child(c), comprehension);
            }
        }
        for (SyntaxNode element : node.comprehensionElements()) {
            collectExpression(element, comprehension);
        }
    }

    private void collectDefaults(SyntaxNode parameters, Scope scope) {
        for (SyntaxNode parameter : parameters.children()) {
            parameter.children().forEach(child -> collectExpression(child, scope));
        }
    }

    private void declareParameters(SyntaxNode parameters, Scope function) {
        for (SyntaxNode parameter : parameters.children()) {
            ParameterKind kind = switch (parameter.kind()) {
                case PARAM -> ParameterKind.POSITIONAL;
                case KWONLY_PARAM -> ParameterKind.KEYWORD_ONLY;
                case VARARGS_PARAM -> ParameterKind.VARARGS;
                case KWARGS_PARAM -> ParameterKind.KWARGS;
                default -> throw new InternalInvariantError("Unexpected parameter node " + parameter.kind(),
                        parameter.position());
            };
            SyntaxNode defaultValue = parameter.childCount() > 0 ? parameter.child(0) : null;
            tree.recordName(parameter.text());
            Binding binding = function.define(Binding.parameter(parameter.text(), function,
                    parameter.position(), kind, defaultValue));
            tree.recordBinding(parameter, binding);
        }
    }

    private void declareGlobal(String name, SyntaxNode node, Scope scope) {
        if (scope.kind() == ScopeKind.MODULE) {
            throw new NameResolutionError("'global " + name + "' is not allowed at module level", node.position());
        }
        checkDeclaration(name, node, scope, "global");
        Scope module = tree.moduleScope();
        Binding moduleBinding = module.lookup(name)
                .orElseGet(() -> module.define(Binding.variable(name, BindingKind.MODULE, module, node.position())));
        moduleBinding.markBoundOutsideLoop();
        Binding declaration = Binding.variable(name, BindingKind.GLOBAL, scope, node.position());
        declaration.setTarget(moduleBinding);
        scope.define(declaration);
        tree.recordName(name);
    }

    private void declareNonlocal(String name, SyntaxNode node, Scope scope) {
        if (scope.kind() == ScopeKind.MODULE) {
            throw new NameResolutionError("'nonlocal " + name + "' is not allowed at module level", node.position());
        }
        checkDeclaration(name, node, scope, "nonlocal");
        scope.define(Binding.variable(name, BindingKind.ENCLOSING, scope, node.position()));
        tree.recordName(name);
    }

    private static void checkDeclaration(String name, SyntaxNode node, Scope scope, String keyword) {
        Optional<Binding> existing = scope.lookup(name);
        if (existing.isEmpty()) {
            return;
        }
        BindingKind kind = existing.get().kind();
        if (kind == BindingKind.PARAMETER) {
            throw new NameResolutionError("Name '" + name + "' is parameter and " + keyword, node.position());
        }
        BindingKind same = keyword.equals("global") ? BindingKind.GLOBAL : BindingKind.ENCLOSING;
        if (kind != same) {
            throw new NameResolutionError("Name '" + name + "' is assigned to before " + keyword + " declaration",
                    node.position());
        }
    }

    /**
     * Marks function locals that would hide, in the emitted code, a module binding
     * that a nested {@code global} declaration refers to.
     */
    private void markShadowedGlobals() {
        for (Scope scope : tree.scopesInPreOrder()) {
            for (Binding binding : scope.bindings()) {
                if (binding.kind() != BindingKind.GLOBAL || binding.target() == null) {
                    continue;
                }
                for (Scope outer = scope.parent(); outer != null && outer.kind() != ScopeKind.MODULE; outer = outer.parent()) {
                    if (outer.kind() == ScopeKind.CLASS) {
                        continue;
                    }
                    outer.lookup(binding.name())
                            .filter(b -> b.kind() == BindingKind.LOCAL || b.kind() == BindingKind.PARAMETER)
                            .ifPresent(b -> {
                                b.markShadowing();
                                LOG.debug("Local '{}' in {} shadows a global used by {}", b.name(), b.scope(), scope);
                            });
                }
            }
        }
    }

    /**
     * A variable rebound through {@code nonlocal} is written outside its own {@code for} statements,
     * so it is never confined to a loop block.
     */
    private void markNonlocalTargets() {
        for (Scope scope : tree.scopesInPreOrder()) {
            for (Binding binding : scope.bindings()) {
                if (binding.kind() != BindingKind.ENCLOSING) {
                    continue;
                }
                for (Scope outer = scope.parent(); outer != null && outer.kind() != ScopeKind.MODULE; outer = outer.parent()) {
                    Optional<Binding> found = outer.kind() == ScopeKind.CLASS ? Optional.empty() : outer.lookup(binding.name());
                    if (found.isPresent()) {
                        found.get().markBoundOutsideLoop();
                        break;
                    }
                }
            }
        }
    }

    // --- pass 2: resolution and context checks ---

    private void resolve(SyntaxNode node, Scope scope) {
        switch (node.kind()) {
            case EMPTY, GLOBAL, IMPORT -> {
            }
            case NAME -> resolveName(node, scope);
            case FUNCTION_DEF, ASYNC_FUNCTION_DEF -> {
                resolve(node.child(2), scope);
                resolve(node.child(0), scope);
                resolve(node.child(1), tree.scopeOf(node));
            }
            case LAMBDA -> {
                resolve(node.child(0), scope);
                resolve(node.child(1), tree.scopeOf(node));
            }
            case CLASS_DEF -> {
                resolve(node.child(0), scope);
                resolve(node.child(2), scope);
                checkInheritance(node, scope);
                resolve(node.child(1), tree.scopeOf(node));
            }
            case LIST_COMP, SET_COMP, GENERATOR_EXP, DICT_COMP -> resolveComprehension(node, scope);
            case FOR, ASYNC_FOR -> resolveLoop(node, scope);
            case ANN_ASSIGN -> {
                resolve(node.child(0), scope);
                resolve(node.child(2), scope);
            }
            case RETURN -> {
                if (scope.kind() != ScopeKind.FUNCTION) {
                    throw new UnsupportedConstructError("'return' outside function", node.position());
                }
                if (!node.child(0).isEmpty()) {
                    scope.set(ScopeFlag.HAS_RETURN_VALUE);
                }
                resolve(node.child(0), scope);
            }
            case YIELD, YIELD_FROM -> {
                checkYield(node, scope);
                resolve(node.child(0), scope);
            }
            case AWAIT -> {
                if (scope.kind() != ScopeKind.FUNCTION || !scope.has(ScopeFlag.ASYNC)) {
                    throw new UnsupportedConstructError("'await' outside async function", node.position());
                }
                resolve(node.child(0), scope);
            }
            case NONLOCAL -> node.names().forEach(name -> linkNonlocal(name, node, scope));
            case CALL -> {
                SyntaxNode callee = node.child(0);
                if (callee.is(NodeKind.NAME) && Builtins.SUPER.equals(callee.text())
                        && scope.lookup(Builtins.SUPER).isEmpty()) {
                    checkSuper(node, scope);
                }
                node.children().forEach(child -> resolve(child, scope));
            }
            default -> node.children().forEach(child -> resolve(child, scope));
        }
    }

    /**
     * Resolves a {@code for} statement. Its loop-scoped targets are visible to the target, the
     * body and the {@code else} clause, including functions defined there.
     */
    private void resolveLoop(SyntaxNode node, Scope scope) {
        resolve(node.child(1), scope);
        List<Binding> introduced = new ArrayList<>();
        collectLoopScoped(node.child(0), scope, introduced);
        activeLoopVariables.addAll(introduced);
        try {
            resolve(node.child(0), scope);
            resolve(node.child(2), scope);
            resolve(node.child(3), scope);
        } finally {
            introduced.forEach(activeLoopVariables::remove);
        }
    }

    private void collectLoopScoped(SyntaxNode target, Scope scope, List<Binding> out) {
        switch (target.kind()) {
            case NAME -> lookup(target.text(), scope).filter(Binding::isLoopScoped).ifPresent(out::add);
            case TUPLE, LIST -> target.children().forEach(child -> collectLoopScoped(child, scope, out));
            case STARRED -> collectLoopScoped(target.child(0), scope, out);
            default -> {
            }
        }
    }

    private void resolveComprehension(SyntaxNode node, Scope scope) {
        List<SyntaxNode> clauses = node.comprehensionClauses();
        resolve(clauses.get(0).child(1), scope);
        Scope comprehension = tree.scopeOf(node);
        for (int i = 0; i < clauses.size(); i++) {
            SyntaxNode clause = clauses.get(i);
            for (int c = 0; c < clause.childCount(); c++) {
                if (c == 1 && i == 0) {
                    continue;
                }
                resolve(clause.child(c), comprehension);
            }
        }
        for (SyntaxNode element : node.comprehensionElements()) {
            resolve(element, comprehension);
        }
    }

    private void resolveName(SyntaxNode node, Scope scope) {
        String name = node.text();
        Binding binding = lookup(name, scope)
                .orElseThrow(() -> new NameResolutionError("Name '" + name + "' is not defined", node.position()));
        if (binding.isLoopScoped() && !activeLoopVariables.contains(binding)) {
            throw new NameResolutionError("Loop variable '" + name + "' is not defined outside its for loop",
                    node.position());
        }
        tree.recordBinding(node, binding);
        noteLoopCapture(binding, scope);
    }

    /**
     * Resolves a name from the given scope outward. Class scopes are only visible to their own body.
     */
    private Optional<Binding> lookup(String name, Scope scope) {
        Optional<Binding> own = scope.lookup(name);
        if (own.isPresent()) {
            return own;
        }
        for (Scope outer = scope.parent(); outer != null; outer = outer.parent()) {
            if (outer.kind() == ScopeKind.CLASS) {
                continue;
            }
            Optional<Binding> found = outer.lookup(name);
            if (found.isPresent()) {
                return found;
            }
        }
        Optional<String> builtin = Builtins.lookup(name);
        if (builtin.isPresent()) {
            return Optional.of(externals.computeIfAbsent(name,
                    n -> Binding.external(n, BindingKind.BUILTIN, builtin.get())));
        }
        if (allowedGlobals.contains(name)) {
            return Optional.of(externals.computeIfAbsent(name, n -> Binding.external(n, BindingKind.GLOBAL, n)));
        }
        return Optional.empty();
    }

    private void noteLoopCapture(Binding binding, Scope scope) {
        Scope owner = binding.scope();
        if (!binding.isLoopVariable() || owner == null || owner == scope || owner.has(ScopeFlag.CLOSURE_OVER_LOOP_VARIABLE)) {
            return;
        }
        for (Scope s = scope; s != null && s != owner; s = s.parent()) {
            if (s.kind() == ScopeKind.FUNCTION || s.kind() == ScopeKind.LAMBDA) {
                owner.set(ScopeFlag.CLOSURE_OVER_LOOP_VARIABLE);
                LOG.debug("{} captures loop variable '{}' of {}", scope, binding.name(), owner);
                return;
            }
        }
    }

    private void linkNonlocal(String name, SyntaxNode node, Scope scope) {
        Binding declaration = scope.lookup(name)
                .orElseThrow(() -> new InternalInvariantError("Nonlocal '" + name + "' was not declared", node.position()));
        for (Scope outer = scope.parent(); outer != null && outer.kind() != ScopeKind.MODULE; outer = outer.parent()) {
            if (outer.kind() == ScopeKind.CLASS) {
                continue;
            }
            Optional<Binding> found = outer.lookup(name)
                    .filter(b -> b.kind() == BindingKind.LOCAL || b.kind() == BindingKind.PARAMETER
                            || b.kind() == BindingKind.ENCLOSING);
            if (found.isPresent()) {
                declaration.setTarget(found.get());
                return;
            }
        }
        throw new NameResolutionError("No binding for nonlocal '" + name + "' found", node.position());
    }

    private static void checkYield(SyntaxNode node, Scope scope) {
        switch (scope.kind()) {
            case FUNCTION -> scope.set(ScopeFlag.GENERATOR);
            case COMPREHENSION -> throw new UnsupportedConstructError("'yield' inside a comprehension", node.position());
            case LAMBDA -> throw new UnsupportedConstructError("'yield' inside a lambda", node.position());
            default -> throw new UnsupportedConstructError("'yield' outside function", node.position());
        }
    }

    private static void checkSuper(SyntaxNode call, Scope scope) {
        if (call.childCount() != 1) {
            throw new UnsupportedConstructError("super() with arguments is not supported", call.position());
        }
        if (!scope.isMethod()) {
            throw new UnsupportedConstructError("super() outside a method", call.position());
        }
        scope.set(ScopeFlag.USES_SUPER);
    }

    /**
     * Rejects diamonds among module-level classes whose bases are plain names of other
     * module-level classes. Other hierarchies are checked by the runtime at definition time.
     */
    private void checkInheritance(SyntaxNode classDef, Scope scope) {
        if (scope.kind() != ScopeKind.MODULE) {
            return;
        }
        List<Binding> bases = new ArrayList<>();
        for (SyntaxNode base : classDef.child(0).children()) {
            if (!base.is(NodeKind.NAME)) {
                continue;
            }
            Binding binding = tree.bindingOf(base);
            if (moduleClassBases.containsKey(binding)) {
                bases.add(binding);
            }
        }
        Set<Binding> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Binding base : bases) {
            for (Binding ancestor : ancestors(base)) {
                if (!seen.add(ancestor)) {
                    throw new UnsupportedConstructError("Class '" + classDef.text()
                            + "' inherits '" + ancestor.name() + "' more than once (multiple-inheritance diamond)",
                            classDef.position());
                }
            }
        }
        moduleClassBases.put(tree.bindingOf(classDef), bases);
    }

    private Set<Binding> ancestors(Binding cls) {
        Set<Binding> result = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Binding> pending = new ArrayList<>();
        pending.add(cls);
        while (!pending.isEmpty()) {
            Binding next = pending.remove(pending.size() - 1);
            if (result.add(next)) {
                pending.addAll(moduleClassBases.getOrDefault(next, List.of()));
            }
        }
        return result;
    }
}
