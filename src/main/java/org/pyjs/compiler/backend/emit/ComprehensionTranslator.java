package org.pyjs.compiler.backend.emit;

import org.pyjs.compiler.api.Degradation;
import org.pyjs.compiler.api.TargetFeature;
import org.pyjs.compiler.backend.output.JsStatement;
import org.pyjs.compiler.diagnostics.UnsupportedConstructError;
import org.pyjs.compiler.frontend.parser.ast.NodeKind;
import org.pyjs.compiler.frontend.parser.ast.SyntaxNode;
import org.pyjs.compiler.runtime.RuntimeLibrary;

import java.util.ArrayList;
import java.util.List;

import static org.pyjs.compiler.backend.emit.ExpressionTranslator.ITER;
import static org.pyjs.compiler.backend.emit.ExpressionTranslator.helperName;
import static org.pyjs.compiler.backend.emit.Precedence.ASSIGNMENT;
import static org.pyjs.compiler.backend.emit.Precedence.CALL;

/**
 * Translates comprehensions into immediately invoked functions, so loop targets stay local to
 * the comprehension. The outermost iterable is evaluated by the caller and passed in as the
 * function's argument; inner iterables and conditions are evaluated inside.
 */
final class ComprehensionTranslator {

    private final TranslationContext ctx;
    private final StatementTranslator statements;

    ComprehensionTranslator(TranslationContext ctx, StatementTranslator statements) {
        this.ctx = ctx;
        this.statements = statements;
    }

    private ExpressionTranslator expressions() {
        return statements.expressions();
    }

    CodeFragment translate(SyntaxNode node) {
        boolean lazy = node.is(NodeKind.GENERATOR_EXP) && ctx.supports(TargetFeature.GENERATORS);
        if (node.is(NodeKind.GENERATOR_EXP) && !lazy && ctx.options().degradation() != Degradation.EAGER) {
            throw new UnsupportedConstructError("Generator expression requires the " + TargetFeature.GENERATORS
                    + " target feature", node.position());
        }
        List<SyntaxNode> clauses = node.comprehensionClauses();
        FragmentCollector c = new FragmentCollector();
        String first = c.helper(ITER) + "(" + c.use(expressions().translate(clauses.get(0).child(1)), ASSIGNMENT)
                + ")";

        TranslationContext.Frame frame = new TranslationContext.Frame(ctx.tree().scopeOf(node), null);
        ctx.enter(frame);
        String source;
        String result;
        List<JsStatement> loop;
        try {
            source = ctx.nextTemporary();
            result = lazy ? null : ctx.declareTemporary();
            loop = clause(node, clauses, 0, source, result, c);
        } finally {
            ctx.exit(frame);
        }

        List<JsStatement> body = new ArrayList<>();
        statements.declarations(frame, c).ifPresent(body::add);
        if (result != null) {
            body.add(JsStatement.of(result + " = " + initialValue(node)));
        }
        body.addAll(loop);
        if (result != null) {
            body.add(JsStatement.of("return " + result));
        }
        String code = "(function" + (lazy ? "*" : "") + " (" + source + ") {\n"
                + ctx.assembler().render(body, 1) + "})(" + first + ")";
        return c.build(code, CALL);
    }

    private List<JsStatement> clause(SyntaxNode node, List<SyntaxNode> clauses, int index, String source,
                                     String result, FragmentCollector c) {
        SyntaxNode clause = clauses.get(index);
        String iterable = index == 0 ? source
                : c.helper(ITER) + "(" + c.use(expressions().translate(clause.child(1)), ASSIGNMENT) + ")";
        return List.of(statements.indexedLoop(clause.child(0), iterable, () -> {
            List<String> conditions = new ArrayList<>();
            for (SyntaxNode condition : clause.children().subList(2, clause.childCount())) {
                conditions.add(c.use(expressions().condition(condition)));
            }
            List<JsStatement> inner = index == clauses.size() - 1
                    ? List.of(element(node, result, c))
                    : clause(node, clauses, index + 1, source, result, c);
            for (int i = conditions.size() - 1; i >= 0; i--) {
                inner = List.of(JsStatement.block("if (" + conditions.get(i) + ")", inner));
            }
            return inner;
        }, c));
    }

    private JsStatement element(SyntaxNode node, String result, FragmentCollector c) {
        List<SyntaxNode> elements = node.comprehensionElements();
        String value = c.use(expressions().translate(elements.get(0)), ASSIGNMENT);
        return switch (node.kind()) {
            case LIST_COMP -> JsStatement.of(result + ".push(" + value + ")");
            case GENERATOR_EXP -> JsStatement.of(result == null ? "yield " + value : result + ".push(" + value + ")");
            case SET_COMP -> JsStatement.of(c.helper(RuntimeLibrary.METHOD_PREFIX + "add")
                    + ".call(" + result + ", " + value + ")");
            case DICT_COMP -> JsStatement.of(c.helper(helperName("op_setitem")) + "(" + result + ", " + value + ", "
                    + c.use(expressions().translate(elements.get(1)), ASSIGNMENT) + ")");
            default -> throw new UnsupportedConstructError(node.kind() + " is not a comprehension", node.position());
        };
    }

    private static String initialValue(SyntaxNode node) {
        return node.is(NodeKind.DICT_COMP) ? "{}" : "[]";
    }
}
