package org.pyjs.compiler.backend.emit;

import org.pyjs.compiler.api.TargetFeature;
import org.pyjs.compiler.backend.output.JsStatement;
import org.pyjs.compiler.diagnostics.DiagnosticsEngine;
import org.pyjs.compiler.diagnostics.InternalInvariantError;
import org.pyjs.compiler.diagnostics.TranslationError;
import org.pyjs.compiler.diagnostics.UnsupportedConstructError;
import org.pyjs.compiler.frontend.parser.ast.NodeKind;
import org.pyjs.compiler.frontend.parser.ast.SyntaxNode;
import org.pyjs.compiler.frontend.semantics.Binding;
import org.pyjs.compiler.frontend.semantics.BindingKind;
import org.pyjs.compiler.runtime.ExceptionHelpers;
import org.pyjs.compiler.runtime.RuntimeLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

import static org.pyjs.compiler.backend.emit.ExpressionTranslator.ITER;
import static org.pyjs.compiler.backend.emit.ExpressionTranslator.TRUTHY;
import static org.pyjs.compiler.backend.emit.ExpressionTranslator.helperName;
import static org.pyjs.compiler.backend.emit.Precedence.ASSIGNMENT;
import static org.pyjs.compiler.backend.emit.Precedence.CALL;
import static org.pyjs.compiler.backend.emit.Precedence.PRIMARY;
import static org.pyjs.compiler.backend.emit.Precedence.SEQUENCE;
import static org.pyjs.compiler.backend.emit.Precedence.UNARY;

/**
 * Translates statement nodes into JavaScript statements.
 *
 * <p>This is the entry point of emission: it owns the expression, function and comprehension
 * translators, which call back into it for nested blocks, loops and assignment targets.</p>
 */
public class StatementTranslator {

    private static final Logger LOG = LoggerFactory.getLogger(StatementTranslator.class);

    private final TranslationContext ctx;
    private final FunctionTranslator functions;
    private final ComprehensionTranslator comprehensions;
    private final ExpressionTranslator expressions;

    /**
     * @param ctx The per-call translation state.
     */
    public StatementTranslator(TranslationContext ctx) {
        this.ctx = ctx;
        this.functions = new FunctionTranslator(ctx, this);
        this.comprehensions = new ComprehensionTranslator(ctx, this);
        this.expressions = new ExpressionTranslator(ctx, functions, comprehensions);
    }

    ExpressionTranslator expressions() {
        return expressions;
    }

    /**
     * Translates a whole module. Each top-level statement is translated independently; a failing
     * statement is reported to the diagnostics engine, which aborts the call in fail-fast mode
     * and otherwise lets the remaining statements proceed.
     *
     * @param module The MODULE node.
     * @param diagnostics Receives translation errors.
     * @return The program and the helpers referenced by the statements that translated.
     */
    public ModuleTranslation translateModule(SyntaxNode module, DiagnosticsEngine diagnostics) {
        List<SyntaxNode> statements = module.children();
        List<JsStatement> header = new ArrayList<>();
        List<JsStatement> body = new ArrayList<>();
        Set<String> helpers = new TreeSet<>();
        int start = 0;
        if (isDocstring(statements)) {
            start = 1;
            if (ctx.options().docstrings()) {
                header.addAll(docComments(statements.get(0).child(0).text()));
            }
        }
        for (SyntaxNode statement : statements.subList(start, statements.size())) {
            if (ctx.tree().isFailed(statement)) {
                LOG.debug("Skipping statement at {} that failed analysis", statement.position());
                continue;
            }
            try {
                StatementFragment fragment = translate(statement);
                body.addAll(fragment.statements());
                helpers.addAll(fragment.helpers());
            } catch (TranslationError e) {
                ctx.resetToModuleFrame();
                diagnostics.report(e);
            }
        }
        FragmentCollector c = new FragmentCollector();
        declarations(ctx.moduleFrame(), c).ifPresent(header::add);
        helpers.addAll(c.helpers());
        header.addAll(body);
        return new ModuleTranslation(header, helpers);
    }

    /**
     * Translates one statement.
     * @param statement A statement node.
     * @return The emitted statements and the helpers they reference.
     */
    public StatementFragment translate(SyntaxNode statement) {
        FragmentCollector c = new FragmentCollector();
        return c.build(statement(statement, c));
    }

    private List<JsStatement> statement(SyntaxNode node, FragmentCollector c) {
        return switch (node.kind()) {
            case EXPR_STMT -> expressionStatement(node, c);
            case ASSIGN -> assignment(node, c);
            case AUG_ASSIGN -> augmentedAssignment(node, c);
            case ANN_ASSIGN -> node.child(2).isEmpty() ? List.of() : assign(node.child(0), node.child(2), c);
            case DELETE -> delete(node, c);
            case PASS, GLOBAL, NONLOCAL, EMPTY -> List.of();
            case BREAK -> jump(node, true);
            case CONTINUE -> jump(node, false);
            case RETURN -> returnStatement(node, c);
            case RAISE -> raise(node, c);
            case ASSERT -> assertion(node, c);
            case IF -> ifStatement(node, c);
            case WHILE -> whileLoop(node, c);
            case FOR -> forLoop(node, c);
            case TRY -> tryStatement(node, c);
            case WITH -> with(node.children().subList(0, node.childCount() - 1), 0,
                    node.child(node.childCount() - 1), c);
            case FUNCTION_DEF, ASYNC_FUNCTION_DEF -> functions.define(node, c);
            case CLASS_DEF -> functions.defineClass(node, c);
            case BLOCK -> block(node, c);
            case ASYNC_FOR -> throw new UnsupportedConstructError("'async for' is not supported", node.position());
            case ASYNC_WITH -> throw new UnsupportedConstructError("'async with' is not supported", node.position());
            case IMPORT -> throw new UnsupportedConstructError("'import' is not supported: "
                    + String.join(", ", node.names()), node.position());
            case MODULE, EXCEPT_HANDLER, WITH_ITEM, DECORATORS, PARAMETERS, PARAM, VARARGS_PARAM, KWONLY_PARAM,
                 KWARGS_PARAM, ARGUMENTS, KEYWORD, STARRED, DOUBLE_STARRED, NAME, NUMBER, STRING, FSTRING,
                 FORMATTED_VALUE, CONSTANT, ATTRIBUTE, SUBSCRIPT, SLICE, CALL, BINARY_OP, UNARY_OP, BOOL_OP, COMPARE,
                 IF_EXP, LAMBDA, LIST, TUPLE, SET, DICT, LIST_COMP, SET_COMP, DICT_COMP, GENERATOR_EXP, COMP_FOR,
                 YIELD, YIELD_FROM, AWAIT ->
                    throw new InternalInvariantError(node.kind() + " node is not a statement", node.position());
        };
    }

    /**
     * Translates the statements of a block. Variables first assigned inside the block do not
     * count as assigned after it.
     */
    List<JsStatement> block(SyntaxNode block, FragmentCollector c) {
        if (block.isEmpty()) {
            return List.of();
        }
        TranslationContext.Frame frame = ctx.frame();
        Set<Binding> assigned = frame.assignedSnapshot();
        List<JsStatement> out = new ArrayList<>();
        try {
            for (SyntaxNode statement : block.children()) {
                out.addAll(statement(statement, c));
            }
        } finally {
            frame.restoreAssigned(assigned);
        }
        return out;
    }

    /**
     * Translates a function or class body, whose first statement may be a docstring.
     */
    List<JsStatement> body(SyntaxNode block, FragmentCollector c) {
        List<SyntaxNode> statements = block.children();
        if (!isDocstring(statements)) {
            return block(block, c);
        }
        List<JsStatement> out = new ArrayList<>();
        if (ctx.options().docstrings()) {
            out.addAll(docComments(statements.get(0).child(0).text()));
        }
        for (SyntaxNode statement : statements.subList(1, statements.size())) {
            out.addAll(statement(statement, c));
        }
        return out;
    }

    /**
     * Declares the variables of a frame: its own bindings, then its temporaries. Locals read
     * through the unbound check start out unbound. With block scoping, loop-scoped variables
     * are declared by their loops instead.
     *
     * @return The declaration, or empty if the frame declares nothing.
     */
    Optional<JsStatement> declarations(TranslationContext.Frame frame, FragmentCollector c) {
        boolean blockScoped = ctx.supports(TargetFeature.BLOCK_SCOPING);
        List<String> names = new ArrayList<>();
        for (Binding binding : frame.scope().bindings()) {
            if (binding.isDeclaredVariable() && !(blockScoped && binding.isLoopScoped())) {
                names.add(declarator(frame, binding, c));
            }
        }
        names.addAll(frame.temporaries());
        if (names.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(JsStatement.of(declarationKeyword() + " " + String.join(", ", names)));
    }

    private String declarator(TranslationContext.Frame frame, Binding binding, FragmentCollector c) {
        String name = ctx.reference(binding);
        return frame.isGuarded(binding) ? name + " = " + c.helper(TranslationContext.UNBOUND) : name;
    }

    String declarationKeyword() {
        return ctx.supports(TargetFeature.BLOCK_SCOPING) ? "let" : "var";
    }

    private static boolean isDocstring(List<SyntaxNode> statements) {
        return !statements.isEmpty() && statements.get(0).is(NodeKind.EXPR_STMT)
                && statements.get(0).child(0).is(NodeKind.STRING);
    }

    /**
     * Renders a docstring as line comments, removing the indentation its continuation lines share.
     */
    static List<JsStatement> docComments(String text) {
        String[] lines = text.strip().split("\n", -1);
        int indent = Integer.MAX_VALUE;
        for (int i = 1; i < lines.length; i++) {
            if (!lines[i].isBlank()) {
                indent = Math.min(indent, lines[i].length() - lines[i].stripLeading().length());
            }
        }
        List<JsStatement> comments = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            String line = i == 0 || lines[i].isBlank() ? lines[i].strip() : lines[i].substring(indent);
            comments.add(JsStatement.comment(line.stripTrailing()));
        }
        return comments;
    }

    // --- simple statements ---

    private List<JsStatement> expressionStatement(SyntaxNode node, FragmentCollector c) {
        SyntaxNode expression = node.child(0);
        String accumulator = ctx.frame().accumulator();
        if (accumulator != null && expression.is(NodeKind.YIELD)) {
            String value = expression.child(0).isEmpty() ? "null"
                    : c.use(expressions.translate(expression.child(0)), ASSIGNMENT);
            return List.of(JsStatement.of(accumulator + ".push(" + value + ")"));
        }
        if (accumulator != null && expression.is(NodeKind.YIELD_FROM)) {
            String items = c.helper(ITER) + "(" + c.use(expressions.translate(expression.child(0)), ASSIGNMENT) + ")";
            return List.of(JsStatement.of(accumulator + ".push.apply(" + accumulator + ", " + items + ")"));
        }
        if (expression.is(NodeKind.STRING)) {
            return List.of();
        }
        return List.of(JsStatement.of(c.use(expressions.translate(expression), SEQUENCE)));
    }

    private List<JsStatement> jump(SyntaxNode node, boolean isBreak) {
        TranslationContext.Loop loop = ctx.frame().loops().peek();
        String keyword = isBreak ? "break" : "continue";
        if (loop == null) {
            throw new UnsupportedConstructError("'" + keyword + "' outside loop", node.position());
        }
        if (isBreak && loop.elseFlag() != null) {
            return List.of(JsStatement.of(loop.elseFlag() + " = false"), JsStatement.of(keyword));
        }
        return List.of(JsStatement.of(keyword));
    }

    private List<JsStatement> returnStatement(SyntaxNode node, FragmentCollector c) {
        String accumulator = ctx.frame().accumulator();
        if (accumulator != null) {
            return List.of(JsStatement.of("return " + accumulator));
        }
        if (node.child(0).isEmpty()) {
            return List.of(JsStatement.of("return null"));
        }
        return List.of(JsStatement.of("return " + c.use(expressions.translate(node.child(0)), SEQUENCE)));
    }

    private List<JsStatement> raise(SyntaxNode node, FragmentCollector c) {
        SyntaxNode exception = node.child(0);
        if (exception.isEmpty()) {
            String active = ctx.frame().errorVariables().peek();
            if (active == null) {
                throw new UnsupportedConstructError("Bare 'raise' is only supported inside an except handler",
                        node.position());
            }
            return List.of(JsStatement.of("throw " + active));
        }
        String value = c.use(expressions.translate(exception), ASSIGNMENT);
        SyntaxNode cause = node.child(1);
        if (!cause.isEmpty()) {
            value += ", " + c.use(expressions.translate(cause), ASSIGNMENT);
        }
        return List.of(JsStatement.of("throw " + c.helper(helperName("op_raise")) + "(" + value + ")"));
    }

    private List<JsStatement> assertion(SyntaxNode node, FragmentCollector c) {
        String test = c.use(expressions.condition(node.child(0)), UNARY);
        String message = node.child(1).isEmpty() ? "" : c.use(expressions.translate(node.child(1)), ASSIGNMENT);
        String error = c.helper(RuntimeLibrary.EXCEPTION_PREFIX + "AssertionError");
        return List.of(JsStatement.block("if (!" + test + ")",
                List.of(JsStatement.of("throw " + error + "(" + message + ")"))));
    }

    private List<JsStatement> delete(SyntaxNode node, FragmentCollector c) {
        List<JsStatement> out = new ArrayList<>();
        for (SyntaxNode target : node.children()) {
            out.addAll(deleteTarget(target, c));
        }
        return out;
    }

    private List<JsStatement> deleteTarget(SyntaxNode target, FragmentCollector c) {
        return switch (target.kind()) {
            case NAME -> {
                Binding binding = ctx.tree().bindingOf(target);
                String reference = ctx.reference(binding);
                if (ctx.mayBeUnbound(binding)) {
                    TranslationContext.Frame frame = ctx.frame();
                    String check = ctx.read(binding, c);
                    frame.unassign(binding);
                    yield List.of(JsStatement.of(check), JsStatement.of(reference + " = "
                            + c.helper(TranslationContext.UNBOUND)));
                }
                yield List.of(JsStatement.of(binding.kind() == BindingKind.CLASS_ATTRIBUTE
                        ? "delete " + reference
                        : reference + " = undefined"));
            }
            case ATTRIBUTE -> List.of(JsStatement.of("delete "
                    + c.use(expressions.translate(target.child(0)), CALL) + "." + target.text()));
            case SUBSCRIPT -> {
                if (target.child(1).is(NodeKind.SLICE)) {
                    throw new UnsupportedConstructError("Deleting a slice is not supported", target.position());
                }
                String object = c.use(expressions.translate(target.child(0)), ASSIGNMENT);
                String key = c.use(expressions.translate(target.child(1)), ASSIGNMENT);
                yield List.of(JsStatement.of(c.helper(helperName("op_delitem")) + "(" + object + ", " + key + ")"));
            }
            case TUPLE, LIST -> {
                List<JsStatement> out = new ArrayList<>();
                for (SyntaxNode element : target.children()) {
                    out.addAll(deleteTarget(element, c));
                }
                yield out;
            }
            default -> throw new UnsupportedConstructError("Cannot delete " + target.kind(), target.position());
        };
    }

    // --- assignment ---

    private List<JsStatement> assignment(SyntaxNode node, FragmentCollector c) {
        List<SyntaxNode> targets = node.children().subList(0, node.childCount() - 1);
        SyntaxNode value = node.child(node.childCount() - 1);
        if (targets.size() == 1) {
            return assign(targets.get(0), value, c);
        }
        List<JsStatement> out = new ArrayList<>();
        String temporary = ctx.declareTemporary();
        out.add(JsStatement.of(temporary + " = " + c.use(expressions.translate(value), ASSIGNMENT)));
        for (SyntaxNode target : targets) {
            out.addAll(assignCode(target, temporary, c));
        }
        return out;
    }

    /**
     * Assigns an expression to a target. A literal tuple assigned to a tuple target of the same
     * shape is evaluated into one array first, so all values are read before any target is written.
     */
    private List<JsStatement> assign(SyntaxNode target, SyntaxNode value, FragmentCollector c) {
        if (isSequence(target) && isSequence(value) && target.childCount() == value.childCount()
                && !hasStarred(target) && !hasStarred(value)) {
            List<JsStatement> out = new ArrayList<>();
            String temporary = ctx.declareTemporary();
            out.add(JsStatement.of(temporary + " = " + c.use(expressions.translate(value), ASSIGNMENT)));
            for (int i = 0; i < target.childCount(); i++) {
                out.addAll(assignCode(target.child(i), temporary + "[" + i + "]", c));
            }
            return out;
        }
        return assignCode(target, c.use(expressions.translate(value), ASSIGNMENT), c);
    }

    /**
     * Assigns already translated code to a target.
     * @param target An assignment target node.
     * @param value The value expression, evaluated exactly once by the emitted statements.
     * @param c Receives helper references.
     * @return The assignment statements.
     */
    List<JsStatement> assignCode(SyntaxNode target, String value, FragmentCollector c) {
        return switch (target.kind()) {
            case NAME -> {
                Binding binding = ctx.tree().bindingOf(target);
                ctx.assigned(binding);
                yield List.of(JsStatement.of(ctx.reference(binding) + " = " + value));
            }
            case ATTRIBUTE -> List.of(JsStatement.of(
                    c.use(expressions.translate(target.child(0)), CALL) + "." + target.text() + " = " + value));
            case SUBSCRIPT -> {
                if (target.child(1).is(NodeKind.SLICE)) {
                    throw new UnsupportedConstructError("Assignment to a slice is not supported", target.position());
                }
                String object = c.use(expressions.translate(target.child(0)), ASSIGNMENT);
                String key = c.use(expressions.translate(target.child(1)), ASSIGNMENT);
                yield List.of(JsStatement.of(c.helper(helperName("op_setitem")) + "(" + object + ", " + key + ", "
                        + value + ")"));
            }
            case TUPLE, LIST -> unpack(target, value, c);
            case STARRED -> throw new UnsupportedConstructError(
                    "A starred assignment target must be in a list or tuple", target.position());
            default -> throw new UnsupportedConstructError("Cannot assign to " + target.kind(), target.position());
        };
    }

    private List<JsStatement> unpack(SyntaxNode target, String value, FragmentCollector c) {
        List<SyntaxNode> elements = target.children();
        int starred = -1;
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i).is(NodeKind.STARRED)) {
                if (starred >= 0) {
                    throw new UnsupportedConstructError("Multiple starred expressions in assignment",
                            elements.get(i).position());
                }
                starred = i;
            }
        }
        String temporary = ctx.declareTemporary();
        String items = starred < 0
                ? c.helper(helperName("unpack")) + "(" + value + ", " + elements.size() + ")"
                : c.helper(helperName("unpack_star")) + "(" + value + ", " + starred + ", "
                        + (elements.size() - starred - 1) + ")";
        List<JsStatement> out = new ArrayList<>();
        out.add(JsStatement.of(temporary + " = " + items));
        for (int i = 0; i < elements.size(); i++) {
            SyntaxNode element = elements.get(i);
            SyntaxNode inner = element.is(NodeKind.STARRED) ? element.child(0) : element;
            out.addAll(assignCode(inner, temporary + "[" + i + "]", c));
        }
        return out;
    }

    private List<JsStatement> augmentedAssignment(SyntaxNode node, FragmentCollector c) {
        SyntaxNode target = node.child(0);
        String operator = node.text();
        List<JsStatement> out = new ArrayList<>();
        switch (target.kind()) {
            case NAME -> {
                Binding binding = ctx.tree().bindingOf(target);
                String reference = ctx.reference(binding);
                CodeFragment current = ctx.mayBeUnbound(binding)
                        ? readThroughCheck(binding)
                        : CodeFragment.of(reference, PRIMARY);
                out.add(JsStatement.of(reference + " = " + c.use(combine(operator, current, node), ASSIGNMENT)));
                ctx.assigned(binding);
            }
            case ATTRIBUTE -> {
                String object = once(target.child(0), out, c);
                String member = object + "." + target.text();
                CodeFragment current = CodeFragment.of(member, CALL);
                out.add(JsStatement.of(member + " = " + c.use(combine(operator, current, node), ASSIGNMENT)));
            }
            case SUBSCRIPT -> {
                if (target.child(1).is(NodeKind.SLICE)) {
                    throw new UnsupportedConstructError("Augmented assignment to a slice is not supported",
                            target.position());
                }
                String object = once(target.child(0), out, c);
                String key = once(target.child(1), out, c);
                CodeFragment current = CodeFragment.of(
                        c.helper(helperName("op_getitem")) + "(" + object + ", " + key + ")", CALL);
                out.add(JsStatement.of(c.helper(helperName("op_setitem")) + "(" + object + ", " + key + ", "
                        + c.use(combine(operator, current, node), ASSIGNMENT) + ")"));
            }
            default -> throw new UnsupportedConstructError("Cannot apply '" + operator + "=' to " + target.kind(),
                    target.position());
        }
        return out;
    }

    private CodeFragment readThroughCheck(Binding binding) {
        FragmentCollector c = new FragmentCollector();
        return c.build(ctx.read(binding, c), CALL);
    }

    private CodeFragment combine(String operator, CodeFragment current, SyntaxNode node) {
        CodeFragment value = expressions.translate(node.child(1));
        if ("+".equals(operator)) {
            FragmentCollector c = new FragmentCollector();
            return c.build(c.helper(helperName("op_iadd")) + "(" + c.use(current, ASSIGNMENT) + ", "
                    + c.use(value, ASSIGNMENT) + ")", CALL);
        }
        return expressions.binaryOperation(operator, current, value, node.position());
    }

    /**
     * Evaluates a sub-expression once: simple ones are used directly, others go through a temporary.
     */
    private String once(SyntaxNode node, List<JsStatement> out, FragmentCollector c) {
        CodeFragment value = expressions.translate(node);
        if (ExpressionTranslator.isSimple(node)) {
            return c.use(value, CALL);
        }
        String temporary = ctx.declareTemporary();
        out.add(JsStatement.of(temporary + " = " + c.use(value, ASSIGNMENT)));
        return temporary;
    }

    private static boolean isSequence(SyntaxNode node) {
        return node.is(NodeKind.TUPLE) || node.is(NodeKind.LIST);
    }

    private static boolean hasStarred(SyntaxNode node) {
        return node.children().stream().anyMatch(child -> child.is(NodeKind.STARRED));
    }

    // --- control flow ---

    private List<JsStatement> ifStatement(SyntaxNode node, FragmentCollector c) {
        JsStatement statement = JsStatement.block("if (" + c.use(expressions.condition(node.child(0))) + ")",
                block(node.child(1), c));
        SyntaxNode orelse = node.child(2);
        while (!orelse.isEmpty()) {
            if (orelse.childCount() == 1 && orelse.child(0).is(NodeKind.IF)) {
                SyntaxNode elif = orelse.child(0);
                statement = statement.then("else if (" + c.use(expressions.condition(elif.child(0))) + ")",
                        block(elif.child(1), c));
                orelse = elif.child(2);
            } else {
                statement = statement.then("else", block(orelse, c));
                break;
            }
        }
        return List.of(statement);
    }

    private List<JsStatement> whileLoop(SyntaxNode node, FragmentCollector c) {
        List<JsStatement> out = new ArrayList<>();
        String flag = elseFlag(node.child(2), out);
        String test = c.use(expressions.condition(node.child(0)));
        List<JsStatement> body = inLoop(flag, () -> block(node.child(1), c));
        out.add(JsStatement.block("while (" + test + ")", body));
        if (flag != null) {
            out.add(JsStatement.block("if (" + flag + ")", block(node.child(2), c)));
        }
        return out;
    }

    private List<JsStatement> forLoop(SyntaxNode node, FragmentCollector c) {
        TranslationContext.Frame frame = ctx.frame();
        List<Binding> scoped = new ArrayList<>();
        if (ctx.supports(TargetFeature.BLOCK_SCOPING)) {
            loopScopedTargets(node.child(0), frame, scoped);
        }
        frame.blockDeclared().addAll(scoped);
        Set<Binding> assigned = frame.assignedSnapshot();
        List<JsStatement> out = new ArrayList<>();
        try {
            String flag = elseFlag(node.child(3), out);
            String iterable = c.helper(ITER) + "(" + c.use(expressions.translate(node.child(1)), ASSIGNMENT) + ")";
            out.add(indexedLoop(node.child(0), iterable, () -> inLoop(flag, () -> block(node.child(2), c)), c));
            frame.restoreAssigned(assigned);
            if (flag != null) {
                out.add(JsStatement.block("if (" + flag + ")", block(node.child(3), c)));
            }
        } finally {
            frame.restoreAssigned(assigned);
            frame.blockDeclared().removeAll(scoped);
        }
        if (scoped.isEmpty()) {
            return out;
        }
        List<String> names = new ArrayList<>();
        for (Binding binding : scoped) {
            names.add(declarator(frame, binding, c));
        }
        List<JsStatement> scopedBlock = new ArrayList<>();
        scopedBlock.add(JsStatement.of(declarationKeyword() + " " + String.join(", ", names)));
        scopedBlock.addAll(out);
        return List.of(JsStatement.bareBlock(scopedBlock));
    }

    /**
     * Collects the loop-scoped variables a {@code for} target binds that no enclosing loop
     * block of the frame declares yet.
     */
    private void loopScopedTargets(SyntaxNode target, TranslationContext.Frame frame, List<Binding> out) {
        switch (target.kind()) {
            case NAME -> {
                Binding binding = ctx.tree().bindingOf(target);
                if (binding.isLoopScoped() && binding.scope() == frame.scope()
                        && !frame.blockDeclared().contains(binding) && !out.contains(binding)) {
                    out.add(binding);
                }
            }
            case TUPLE, LIST -> target.children().forEach(child -> loopScopedTargets(child, frame, out));
            case STARRED -> loopScopedTargets(target.child(0), frame, out);
            default -> {
            }
        }
    }

    /**
     * Emits an index-based loop over an array expression, assigning the target at the top of each
     * iteration. With block scoping the array and index are {@code let}-declared in the loop header
     * and are not visible after the loop.
     *
     * @param target The loop target.
     * @param array Code evaluating to the array to iterate.
     * @param body Produces the loop body; called after the target assignment is translated.
     * @param c Receives helper references.
     * @return The loop statement.
     */
    JsStatement indexedLoop(SyntaxNode target, String array, Supplier<List<JsStatement>> body, FragmentCollector c) {
        boolean blockScoped = ctx.supports(TargetFeature.BLOCK_SCOPING);
        String items = blockScoped ? ctx.nextTemporary() : ctx.declareTemporary();
        String index = blockScoped ? ctx.nextTemporary() : ctx.declareTemporary();
        String header = "for (" + (blockScoped ? "let " : "") + items + " = " + array + ", " + index + " = 0; "
                + index + " < " + items + ".length; " + index + "++)";
        List<JsStatement> statements = new ArrayList<>(assignCode(target, items + "[" + index + "]", c));
        statements.addAll(body.get());
        return JsStatement.block(header, statements);
    }

    private String elseFlag(SyntaxNode orelse, List<JsStatement> out) {
        if (orelse.isEmpty()) {
            return null;
        }
        String flag = ctx.declareTemporary();
        out.add(JsStatement.of(flag + " = true"));
        return flag;
    }

    private List<JsStatement> inLoop(String elseFlag, Supplier<List<JsStatement>> body) {
        TranslationContext.Frame frame = ctx.frame();
        frame.loops().push(new TranslationContext.Loop(elseFlag));
        try {
            return body.get();
        } finally {
            frame.loops().pop();
        }
    }

    // --- exceptions and context managers ---

    private List<JsStatement> tryStatement(SyntaxNode node, FragmentCollector c) {
        int count = node.childCount();
        List<SyntaxNode> handlers = node.children().subList(1, count - 2);
        SyntaxNode orelse = node.child(count - 2);
        SyntaxNode finalBody = node.child(count - 1);
        if (handlers.isEmpty()) {
            List<JsStatement> guarded = new ArrayList<>(block(node.child(0), c));
            guarded.addAll(block(orelse, c));
            return List.of(JsStatement.block("try", guarded).then("finally", block(finalBody, c)));
        }
        List<JsStatement> out = new ArrayList<>();
        String flag = orelse.isEmpty() ? null : ctx.declareTemporary();
        if (flag != null) {
            out.add(JsStatement.of(flag + " = false"));
        }
        List<JsStatement> guarded = new ArrayList<>(block(node.child(0), c));
        if (flag != null) {
            guarded.add(JsStatement.of(flag + " = true"));
        }
        String error = ctx.nextErrorVariable();
        out.add(JsStatement.block("try", guarded).then("catch (" + error + ")", handlers(handlers, error, c)));
        if (flag != null) {
            out.add(JsStatement.block("if (" + flag + ")", block(orelse, c)));
        }
        if (finalBody.isEmpty()) {
            return out;
        }
        return List.of(JsStatement.block("try", out).then("finally", block(finalBody, c)));
    }

    private List<JsStatement> handlers(List<SyntaxNode> handlers, String error, FragmentCollector c) {
        TranslationContext.Frame frame = ctx.frame();
        frame.errorVariables().push(error);
        try {
            JsStatement chain = null;
            for (SyntaxNode handler : handlers) {
                List<JsStatement> body = new ArrayList<>();
                Set<Binding> assigned = frame.assignedSnapshot();
                if (handler.text() != null) {
                    Binding binding = ctx.tree().bindingOf(handler);
                    ctx.assigned(binding);
                    body.add(JsStatement.of(ctx.reference(binding) + " = " + error));
                }
                body.addAll(block(handler.child(1), c));
                frame.restoreAssigned(assigned);
                SyntaxNode type = handler.child(0);
                if (type.isEmpty()) {
                    return chain == null ? body : List.of(chain.then("else", body));
                }
                String test = c.helper(helperName("op_matches")) + "(" + error + ", "
                        + c.use(expressions.translate(type), ASSIGNMENT) + ")";
                chain = chain == null
                        ? JsStatement.block("if (" + test + ")", body)
                        : chain.then("else if (" + test + ")", body);
            }
            return List.of(chain.then("else", List.of(JsStatement.of("throw " + error))));
        } finally {
            frame.errorVariables().pop();
        }
    }

    /**
     * Lowers one {@code with} item; further items nest inside its body.
     */
    private List<JsStatement> with(List<SyntaxNode> items, int index, SyntaxNode body, FragmentCollector c) {
        if (index == items.size()) {
            return block(body, c);
        }
        SyntaxNode item = items.get(index);
        List<JsStatement> out = new ArrayList<>();
        String manager = ctx.declareTemporary();
        out.add(JsStatement.of(manager + " = " + c.use(expressions.translate(item.child(0)), ASSIGNMENT)));
        String enter = manager + ".__enter__()";
        if (item.child(1).isEmpty()) {
            out.add(JsStatement.of(enter));
        } else {
            out.addAll(assignCode(item.child(1), enter, c));
        }
        String failed = ctx.declareTemporary();
        out.add(JsStatement.of(failed + " = false"));
        List<JsStatement> inner = with(items, index + 1, body, c);
        String error = ctx.nextErrorVariable();
        String exit = manager + ".__exit__(" + c.helper(helperName("op_errtype")) + "(" + error + "), " + error
                + ", null)";
        List<JsStatement> onError = List.of(
                JsStatement.of(failed + " = true"),
                JsStatement.block("if (!" + c.helper(TRUTHY) + "(" + exit + "))",
                        List.of(JsStatement.of("throw " + error))));
        List<JsStatement> onExit = List.of(JsStatement.block("if (!" + failed + ")",
                List.of(JsStatement.of(manager + ".__exit__(null, null, null)"))));
        out.add(JsStatement.block("try", inner).then("catch (" + error + ")", onError).then("finally", onExit));
        return out;
    }

    /**
     * The result of translating a module.
     *
     * @param statements The top-level statements, declarations first.
     * @param helpers    The helpers referenced by the statements that translated.
     */
    public record ModuleTranslation(List<JsStatement> statements, Set<String> helpers) {

        public ModuleTranslation {
            statements = List.copyOf(statements);
            helpers = Set.copyOf(helpers);
        }
    }
}
