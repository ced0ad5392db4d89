package org.pyjs.compiler.backend.emit;

import org.pyjs.compiler.api.Degradation;
import org.pyjs.compiler.api.TargetFeature;
import org.pyjs.compiler.backend.output.JsStatement;
import org.pyjs.compiler.diagnostics.SourcePosition;
import org.pyjs.compiler.diagnostics.UnsupportedConstructError;
import org.pyjs.compiler.frontend.parser.ast.NodeKind;
import org.pyjs.compiler.frontend.parser.ast.SyntaxNode;
import org.pyjs.compiler.frontend.semantics.Binding;
import org.pyjs.compiler.frontend.semantics.BindingKind;
import org.pyjs.compiler.frontend.semantics.Scope;
import org.pyjs.compiler.frontend.semantics.ScopeFlag;
import org.pyjs.compiler.runtime.Builtins;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.function.Function;

import static org.pyjs.compiler.backend.emit.ExpressionTranslator.helperName;
import static org.pyjs.compiler.backend.emit.Precedence.ASSIGNMENT;
import static org.pyjs.compiler.backend.emit.Precedence.CALL;
import static org.pyjs.compiler.backend.emit.Precedence.SEQUENCE;
import static org.pyjs.compiler.backend.emit.TranslationContext.BASE_PARAMETER;
import static org.pyjs.compiler.backend.emit.TranslationContext.CLASS_VARIABLE;
import static org.pyjs.compiler.backend.emit.TranslationContext.MIXINS_PARAMETER;

/**
 * Translates function definitions, lambdas and class definitions.
 *
 * <p>Functions with parameters are wrapped in {@code _pyfunc_op_def}, which binds keyword
 * arguments and defaults at call time. Defaults are evaluated once, where the function is
 * defined. Classes become an immediately invoked function that builds the constructor, links
 * its bases and assigns the body's members to the prototype.</p>
 */
final class FunctionTranslator {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionTranslator.class);

    static final String LAMBDA_NAME = "<lambda>";

    private final TranslationContext ctx;
    private final StatementTranslator statements;

    FunctionTranslator(TranslationContext ctx, StatementTranslator statements) {
        this.ctx = ctx;
        this.statements = statements;
    }

    private ExpressionTranslator expressions() {
        return statements.expressions();
    }

    List<JsStatement> define(SyntaxNode node, FragmentCollector c) {
        Scope scope = ctx.tree().scopeOf(node);
        List<SyntaxNode> decorators = node.child(2).children();
        List<String> applied = decorators(decorators, c);
        boolean receiver = scope.isMethod() && decorators.stream().noneMatch(this::isStaticMethod);
        SyntaxNode body = node.child(1);
        CodeFragment function = function(node.text(), scope, node.child(0), receiver,
                fc -> statements.body(body, fc), node.position());
        String value = decorate(applied, c.use(function, ASSIGNMENT));
        Binding binding = ctx.tree().bindingOf(node);
        ctx.assigned(binding);
        return List.of(JsStatement.of(ctx.reference(binding) + " = " + value));
    }

    CodeFragment lambda(SyntaxNode node) {
        Scope scope = ctx.tree().scopeOf(node);
        return function(LAMBDA_NAME, scope, node.child(0), false,
                fc -> List.of(JsStatement.of("return " + fc.use(expressions().translate(node.child(1)), SEQUENCE))),
                node.position());
    }

    List<JsStatement> defineClass(SyntaxNode node, FragmentCollector c) {
        Scope scope = ctx.tree().scopeOf(node);
        List<SyntaxNode> bases = node.child(0).children();
        for (SyntaxNode base : bases) {
            if (base.is(NodeKind.KEYWORD) || base.is(NodeKind.STARRED) || base.is(NodeKind.DOUBLE_STARRED)) {
                throw new UnsupportedConstructError("Class '" + node.text()
                        + "' uses keyword or unpacked arguments in its bases", base.position());
            }
        }
        List<String> applied = decorators(node.child(2).children(), c);
        String base = bases.isEmpty() ? "Object" : c.use(expressions().translate(bases.get(0)), ASSIGNMENT);
        StringJoiner mixins = new StringJoiner(", ", "[", "]");
        for (SyntaxNode mixin : bases.subList(Math.min(1, bases.size()), bases.size())) {
            mixins.add(c.use(expressions().translate(mixin), ASSIGNMENT));
        }

        FragmentCollector fc = new FragmentCollector();
        TranslationContext.Frame frame = new TranslationContext.Frame(scope, null);
        ctx.enter(frame);
        List<JsStatement> members;
        try {
            members = statements.body(node.child(1), fc);
        } finally {
            ctx.exit(frame);
        }
        List<String> declared = new ArrayList<>();
        declared.add(CLASS_VARIABLE);
        declared.addAll(frame.temporaries());

        List<JsStatement> iife = new ArrayList<>();
        iife.add(JsStatement.of(statements.declarationKeyword() + " " + String.join(", ", declared)));
        String constructor = "function () {\n" + ctx.assembler().render(List.of(JsStatement.of("return "
                + fc.helper(helperName("op_instantiate")) + "(" + CLASS_VARIABLE + ", this, arguments)")), 1) + "}";
        iife.add(JsStatement.of(CLASS_VARIABLE + " = " + constructor));
        iife.add(JsStatement.of(fc.helper(helperName("op_extends")) + "(" + CLASS_VARIABLE + ", " + BASE_PARAMETER
                + ", " + JsLiterals.quote(node.text()) + ", " + MIXINS_PARAMETER + ")"));
        iife.addAll(members);
        iife.add(JsStatement.of("return " + fc.helper(helperName("op_expose")) + "(" + CLASS_VARIABLE + ")"));

        String code = "(function (" + BASE_PARAMETER + ", " + MIXINS_PARAMETER + ") {\n"
                + ctx.assembler().render(iife, 1) + "})(" + base + ", " + mixins + ")";
        String value = decorate(applied, c.use(fc.build(code, CALL), ASSIGNMENT));
        LOG.debug("Translated class '{}' with {} base(s)", node.text(), bases.size());
        Binding binding = ctx.tree().bindingOf(node);
        ctx.assigned(binding);
        return List.of(JsStatement.of(ctx.reference(binding) + " = " + value));
    }

    /**
     * Emits a function expression for a def or lambda.
     *
     * @param name The name reported by argument-binding errors.
     * @param scope The function's scope.
     * @param parameters The PARAMETERS node.
     * @param receiver true if the first positional parameter receives {@code this}.
     * @param body Produces the body statements inside the function's frame.
     * @param position Where the function is defined.
     * @return The function, wrapped in the argument binder when it takes parameters.
     */
    private CodeFragment function(String name, Scope scope, SyntaxNode parameters, boolean receiver,
                                  Function<FragmentCollector, List<JsStatement>> body, SourcePosition position) {
        boolean generator = scope.has(ScopeFlag.GENERATOR);
        boolean async = scope.has(ScopeFlag.ASYNC);
        if (async && generator) {
            throw new UnsupportedConstructError("Asynchronous generator '" + name + "' is not supported", position);
        }
        if (async && !ctx.supports(TargetFeature.ASYNC)) {
            throw new UnsupportedConstructError("Asynchronous function '" + name + "' requires the "
                    + TargetFeature.ASYNC + " target feature", position);
        }

        List<SyntaxNode> params = new ArrayList<>(parameters.children());
        String self = null;
        if (receiver && !params.isEmpty() && params.get(0).is(NodeKind.PARAM)) {
            self = ctx.reference(ctx.tree().bindingOf(params.remove(0)));
        }

        FragmentCollector fc = new FragmentCollector();
        List<String> positional = new ArrayList<>();
        List<String> keywordOnly = new ArrayList<>();
        List<String> jsParameters = new ArrayList<>();
        StringJoiner defaults = new StringJoiner(", ", "{", "}");
        boolean varargs = false;
        boolean kwargs = false;
        for (SyntaxNode param : params) {
            Binding binding = ctx.tree().bindingOf(param);
            jsParameters.add(ctx.reference(binding));
            switch (param.kind()) {
                case PARAM -> positional.add(param.text());
                case KWONLY_PARAM -> keywordOnly.add(param.text());
                case VARARGS_PARAM -> varargs = true;
                case KWARGS_PARAM -> kwargs = true;
                default -> throw new UnsupportedConstructError("Unexpected parameter " + param.kind(),
                        param.position());
            }
            if (param.childCount() > 0 && !param.child(0).isEmpty()) {
                defaults.add(JsLiterals.quote(param.text()) + ": "
                        + fc.use(expressions().translate(param.child(0)), ASSIGNMENT));
            }
        }

        TranslationContext.Frame frame = new TranslationContext.Frame(scope, self);
        ctx.enter(frame);
        boolean eager = false;
        List<JsStatement> statementsOut = new ArrayList<>();
        try {
            if (generator && !ctx.supports(TargetFeature.GENERATORS)) {
                if (ctx.options().degradation() != Degradation.EAGER || !isEagerCompatible(scope)) {
                    throw new UnsupportedConstructError("Generator function '" + name + "' requires the "
                            + TargetFeature.GENERATORS + " target feature", position);
                }
                eager = true;
                frame.setAccumulator(ctx.declareTemporary());
                statementsOut.add(JsStatement.of(frame.accumulator() + " = []"));
            }
            statementsOut.addAll(body.apply(fc));
            if (eager) {
                statementsOut.add(JsStatement.of("return " + frame.accumulator()));
            }
        } finally {
            ctx.exit(frame);
        }

        List<JsStatement> full = new ArrayList<>();
        if (self != null) {
            full.add(JsStatement.of(statements.declarationKeyword() + " " + self + " = this"));
        }
        statements.declarations(frame, fc).ifPresent(full::add);
        full.addAll(statementsOut);

        String rendered = ctx.assembler().render(full, 1);
        String keyword = (async ? "async " : "") + "function" + (generator && !eager ? "*" : "");
        String code = keyword + " (" + String.join(", ", jsParameters) + ") "
                + (rendered.isEmpty() ? "{}" : "{\n" + rendered + "}");
        if (params.isEmpty()) {
            return fc.build(code, ASSIGNMENT);
        }
        String wrapped = fc.helper(helperName("op_def")) + "(" + JsLiterals.quote(name) + ", "
                + JsLiterals.quoteAll(positional) + ", " + defaults + ", " + varargs + ", "
                + JsLiterals.quoteAll(keywordOnly) + ", " + kwargs + ", " + code + ")";
        return fc.build(wrapped, CALL);
    }

    /**
     * A generator can run eagerly when it never returns a value and every yield is a statement of
     * its own, so the yielded values can be collected into an array.
     */
    private boolean isEagerCompatible(Scope scope) {
        return !scope.has(ScopeFlag.HAS_RETURN_VALUE) && yieldsAreStatements(scope.node().child(1), false);
    }

    private static boolean yieldsAreStatements(SyntaxNode node, boolean statementLevel) {
        switch (node.kind()) {
            case YIELD, YIELD_FROM -> {
                if (!statementLevel) {
                    return false;
                }
            }
            case FUNCTION_DEF, ASYNC_FUNCTION_DEF, CLASS_DEF, LAMBDA, LIST_COMP, SET_COMP, DICT_COMP,
                 GENERATOR_EXP -> {
                return true;
            }
            default -> {
            }
        }
        boolean expressionStatement = node.is(NodeKind.EXPR_STMT);
        for (SyntaxNode child : node.children()) {
            if (!yieldsAreStatements(child, expressionStatement)) {
                return false;
            }
        }
        return true;
    }

    private List<String> decorators(List<SyntaxNode> decorators, FragmentCollector c) {
        List<String> applied = new ArrayList<>();
        for (SyntaxNode decorator : decorators) {
            applied.add(c.use(expressions().translate(decorator), CALL));
        }
        return applied;
    }

    private static String decorate(List<String> decorators, String value) {
        String result = value;
        for (int i = decorators.size() - 1; i >= 0; i--) {
            result = decorators.get(i) + "(" + result + ")";
        }
        return result;
    }

    private boolean isStaticMethod(SyntaxNode decorator) {
        if (!decorator.is(NodeKind.NAME)) {
            return false;
        }
        return ctx.tree().findBinding(decorator)
                .map(binding -> binding.kind() == BindingKind.BUILTIN && Builtins.STATICMETHOD.equals(binding.name()))
                .orElse(false);
    }
}
