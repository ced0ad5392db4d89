package org.pyjs.compiler.backend.emit;

import org.pyjs.compiler.api.TargetFeature;
import org.pyjs.compiler.diagnostics.InternalInvariantError;
import org.pyjs.compiler.diagnostics.SourcePosition;
import org.pyjs.compiler.diagnostics.UnsupportedConstructError;
import org.pyjs.compiler.frontend.parser.ast.NodeKind;
import org.pyjs.compiler.frontend.parser.ast.SyntaxNode;
import org.pyjs.compiler.frontend.semantics.Binding;
import org.pyjs.compiler.frontend.semantics.BindingKind;
import org.pyjs.compiler.runtime.Builtins;
import org.pyjs.compiler.runtime.RuntimeLibrary;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.pyjs.compiler.backend.emit.Precedence.ADDITIVE;
import static org.pyjs.compiler.backend.emit.Precedence.ASSIGNMENT;
import static org.pyjs.compiler.backend.emit.Precedence.CALL;
import static org.pyjs.compiler.backend.emit.Precedence.CONDITIONAL;
import static org.pyjs.compiler.backend.emit.Precedence.EQUALITY;
import static org.pyjs.compiler.backend.emit.Precedence.LOGICAL_AND;
import static org.pyjs.compiler.backend.emit.Precedence.LOGICAL_OR;
import static org.pyjs.compiler.backend.emit.Precedence.PRIMARY;
import static org.pyjs.compiler.backend.emit.Precedence.RELATIONAL;
import static org.pyjs.compiler.backend.emit.Precedence.UNARY;

/**
 * Translates expression nodes into {@link CodeFragment}s.
 *
 * <p>Arithmetic, bitwise and ordering operators go through runtime helpers unless every operand
 * is a numeric literal; identity and the logical operators stay native. Every fragment records
 * its precedence so that callers parenthesize operands only where JavaScript needs it.</p>
 */
public class ExpressionTranslator {

    static final String TRUTHY = helperName("truthy");
    static final String ITER = helperName("iter");
    static final String OP_CALL = helperName("op_call");

    /** Builtins that always return a boolean. */
    private static final Set<String> BOOLEAN_BUILTINS = Set.of("bool", "isinstance", "hasattr", "callable", "any", "all");

    private final TranslationContext ctx;
    private final FunctionTranslator functions;
    private final ComprehensionTranslator comprehensions;

    ExpressionTranslator(TranslationContext ctx, FunctionTranslator functions, ComprehensionTranslator comprehensions) {
        this.ctx = ctx;
        this.functions = functions;
        this.comprehensions = comprehensions;
    }

    static String helperName(String name) {
        return RuntimeLibrary.FUNCTION_PREFIX + name;
    }

    /**
     * Translates an expression.
     * @param node An expression node.
     * @return The equivalent JavaScript expression.
     * @throws UnsupportedConstructError if the expression has no translation under the active options.
     */
    public CodeFragment translate(SyntaxNode node) {
        return switch (node.kind()) {
            case NAME -> name(node);
            case NUMBER -> CodeFragment.of(JsLiterals.number(node.text(), node.position()), PRIMARY);
            case STRING -> CodeFragment.of(JsLiterals.quote(node.text()), PRIMARY);
            case FSTRING -> formattedString(node);
            case FORMATTED_VALUE -> formattedValue(node);
            case CONSTANT -> constant(node);
            case ATTRIBUTE -> attribute(node);
            case SUBSCRIPT -> subscript(node);
            case CALL -> call(node);
            case BINARY_OP -> binary(node);
            case UNARY_OP -> unary(node);
            case BOOL_OP -> booleanOperation(node);
            case COMPARE -> compare(node);
            case IF_EXP -> conditional(node);
            case LAMBDA -> functions.lambda(node);
            case LIST, TUPLE -> array(node);
            case SET -> set(node);
            case DICT -> dict(node);
            case LIST_COMP, SET_COMP, DICT_COMP, GENERATOR_EXP -> comprehensions.translate(node);
            case YIELD -> yieldExpression(node);
            case YIELD_FROM -> yieldFrom(node);
            case AWAIT -> await(node);
            case STARRED, DOUBLE_STARRED -> throw new UnsupportedConstructError(
                    "Unpacking with '" + (node.is(NodeKind.STARRED) ? "*" : "**") + "' is only supported in call arguments",
                    node.position());
            case SLICE -> throw new UnsupportedConstructError("Slice outside a subscript", node.position());
            case MODULE, BLOCK, EMPTY, EXPR_STMT, ASSIGN, AUG_ASSIGN, ANN_ASSIGN, DELETE, PASS, BREAK, CONTINUE,
                 RETURN, RAISE, GLOBAL, NONLOCAL, ASSERT, IF, WHILE, FOR, ASYNC_FOR, TRY, EXCEPT_HANDLER, WITH,
                 ASYNC_WITH, WITH_ITEM, FUNCTION_DEF, ASYNC_FUNCTION_DEF, CLASS_DEF, DECORATORS, IMPORT, PARAMETERS,
                 PARAM, VARARGS_PARAM, KWONLY_PARAM, KWARGS_PARAM, ARGUMENTS, KEYWORD, COMP_FOR ->
                    throw new InternalInvariantError(node.kind() + " node is not an expression", node.position());
        };
    }

    /**
     * Translates an expression used as a condition.
     * @param node The test expression.
     * @return A JavaScript boolean expression.
     */
    CodeFragment condition(SyntaxNode node) {
        CodeFragment value = translate(node);
        if (isBoolean(node)) {
            return value;
        }
        FragmentCollector c = new FragmentCollector();
        return c.build(c.helper(TRUTHY) + "(" + c.use(value, ASSIGNMENT) + ")", CALL);
    }

    /**
     * Applies a binary operator to already translated operands.
     * @param operator The Python operator, e.g. {@code +} or {@code //}.
     * @param left The left operand.
     * @param right The right operand.
     * @param position Where the operation occurs.
     * @return The combined expression.
     */
    CodeFragment binaryOperation(String operator, CodeFragment left, CodeFragment right, SourcePosition position) {
        FragmentCollector c = new FragmentCollector();
        String helper = switch (operator) {
            case "+" -> "op_add";
            case "-" -> "op_sub";
            case "*" -> "op_mult";
            case "/" -> "op_truediv";
            case "%" -> "op_mod";
            case "//" -> "op_floordiv";
            case "**" -> "op_pow";
            case "<<" -> "op_lshift";
            case ">>" -> "op_rshift";
            case "&" -> "op_and";
            case "|" -> "op_or";
            case "^" -> "op_xor";
            case "@" -> throw new UnsupportedConstructError("Matrix multiplication operator '@' is not supported", position);
            default -> throw new InternalInvariantError("Unknown binary operator '" + operator + "'", position);
        };
        return c.build(c.helper(helperName(helper)) + "(" + c.use(left, ASSIGNMENT) + ", "
                + c.use(right, ASSIGNMENT) + ")", CALL);
    }

    /**
     * @return true if the node always evaluates to a JavaScript boolean.
     */
    boolean isBoolean(SyntaxNode node) {
        return switch (node.kind()) {
            case COMPARE -> true;
            case UNARY_OP -> "not".equals(node.text());
            case CONSTANT -> !"None".equals(node.text());
            case BOOL_OP -> node.children().stream().allMatch(this::isBoolean);
            case CALL -> isBuiltin(node.child(0)).filter(BOOLEAN_BUILTINS::contains).isPresent();
            default -> false;
        };
    }

    /**
     * @return true if evaluating the node twice has no observable effect.
     */
    static boolean isSimple(SyntaxNode node) {
        return node.is(NodeKind.NAME) || node.is(NodeKind.CONSTANT) || node.is(NodeKind.NUMBER)
                || node.is(NodeKind.STRING);
    }

    private Optional<String> isBuiltin(SyntaxNode node) {
        if (!node.is(NodeKind.NAME)) {
            return Optional.empty();
        }
        return ctx.tree().findBinding(node)
                .filter(binding -> binding.kind() == BindingKind.BUILTIN)
                .map(Binding::name);
    }

    // --- names and literals ---

    private CodeFragment name(SyntaxNode node) {
        Binding binding = ctx.tree().bindingOf(node);
        if (binding.kind() == BindingKind.BUILTIN) {
            if (Builtins.SUPER.equals(binding.name())) {
                throw new UnsupportedConstructError("super is only supported as super().method(...)", node.position());
            }
            String external = binding.externalName();
            FragmentCollector c = new FragmentCollector();
            if (RuntimeLibrary.contains(external)) {
                c.helper(external);
            }
            return c.build(external, PRIMARY);
        }
        if (ctx.mayBeUnbound(binding)) {
            FragmentCollector c = new FragmentCollector();
            return c.build(ctx.read(binding, c), CALL);
        }
        String reference = ctx.reference(binding);
        return CodeFragment.of(reference, binding.kind() == BindingKind.CLASS_ATTRIBUTE ? CALL : PRIMARY);
    }

    private static CodeFragment constant(SyntaxNode node) {
        return switch (node.text()) {
            case "True" -> CodeFragment.of("true", PRIMARY);
            case "False" -> CodeFragment.of("false", PRIMARY);
            case "None" -> CodeFragment.of("null", PRIMARY);
            default -> throw new InternalInvariantError("Unknown constant '" + node.text() + "'", node.position());
        };
    }

    private CodeFragment formattedString(SyntaxNode node) {
        if (node.childCount() == 0) {
            return CodeFragment.of("\"\"", PRIMARY);
        }
        if (node.childCount() == 1) {
            return translate(node.child(0));
        }
        FragmentCollector c = new FragmentCollector();
        List<String> parts = new ArrayList<>();
        for (SyntaxNode part : node.children()) {
            parts.add(c.use(translate(part), ADDITIVE.tighter()));
        }
        return c.build(String.join(" + ", parts), ADDITIVE);
    }

    private CodeFragment formattedValue(SyntaxNode node) {
        FragmentCollector c = new FragmentCollector();
        String value = c.use(translate(node.child(0)), ASSIGNMENT);
        String conversion = node.text();
        boolean repr = "r".equals(conversion) || "a".equals(conversion);
        SyntaxNode spec = node.child(1);
        if (spec.isEmpty()) {
            return c.build(c.helper(helperName(repr ? "repr" : "str")) + "(" + value + ")", CALL);
        }
        if (conversion != null) {
            value = c.helper(helperName(repr ? "repr" : "str")) + "(" + value + ")";
        }
        String format = c.use(translate(spec), ASSIGNMENT);
        return c.build(c.helper(helperName("format")) + "(" + value + ", " + format + ")", CALL);
    }

    private CodeFragment array(SyntaxNode node) {
        FragmentCollector c = new FragmentCollector();
        return c.build("[" + elements(node.children(), c) + "]", PRIMARY);
    }

    private CodeFragment set(SyntaxNode node) {
        FragmentCollector c = new FragmentCollector();
        return c.build(c.helper(helperName("set")) + "([" + elements(node.children(), c) + "])", CALL);
    }

    private String elements(List<SyntaxNode> nodes, FragmentCollector c) {
        List<String> parts = new ArrayList<>();
        for (SyntaxNode element : nodes) {
            parts.add(c.use(translate(element), ASSIGNMENT));
        }
        return String.join(", ", parts);
    }

    private CodeFragment dict(SyntaxNode node) {
        FragmentCollector c = new FragmentCollector();
        boolean literalKeys = true;
        for (int i = 0; i < node.childCount(); i += 2) {
            SyntaxNode key = node.child(i);
            literalKeys &= key.is(NodeKind.STRING) && !"__proto__".equals(key.text());
        }
        List<String> entries = new ArrayList<>();
        for (int i = 0; i < node.childCount(); i += 2) {
            String key = c.use(translate(node.child(i)), ASSIGNMENT);
            String value = c.use(translate(node.child(i + 1)), ASSIGNMENT);
            entries.add(literalKeys ? key + ": " + value : "[" + key + ", " + value + "]");
        }
        if (literalKeys) {
            return c.build("{" + String.join(", ", entries) + "}", PRIMARY);
        }
        return c.build(c.helper(helperName("dict")) + "([" + String.join(", ", entries) + "])", CALL);
    }

    // --- member access ---

    private CodeFragment attribute(SyntaxNode node) {
        FragmentCollector c = new FragmentCollector();
        return c.build(receiver(node.child(0), c) + "." + node.text(), CALL);
    }

    /**
     * Translates the object of a member access, parenthesizing numeric literals.
     */
    private String receiver(SyntaxNode object, FragmentCollector c) {
        CodeFragment fragment = translate(object);
        return object.is(NodeKind.NUMBER) ? "(" + c.use(fragment) + ")" : c.use(fragment, CALL);
    }

    private CodeFragment subscript(SyntaxNode node) {
        FragmentCollector c = new FragmentCollector();
        String object = c.use(translate(node.child(0)), ASSIGNMENT);
        SyntaxNode index = node.child(1);
        if (index.is(NodeKind.SLICE)) {
            return c.build(c.helper(helperName("op_slice")) + "(" + object + ", " + sliceBounds(index, c) + ")", CALL);
        }
        String key = c.use(translate(index), ASSIGNMENT);
        return c.build(c.helper(helperName("op_getitem")) + "(" + object + ", " + key + ")", CALL);
    }

    /**
     * @return The three slice arguments, with {@code null} for omitted bounds.
     */
    String sliceBounds(SyntaxNode slice, FragmentCollector c) {
        List<String> bounds = new ArrayList<>();
        for (SyntaxNode bound : slice.children()) {
            bounds.add(bound.isEmpty() ? "null" : c.use(translate(bound), ASSIGNMENT));
        }
        return String.join(", ", bounds);
    }

    // --- calls ---

    private CodeFragment call(SyntaxNode node) {
        SyntaxNode callee = node.child(0);
        List<SyntaxNode> arguments = node.children().subList(1, node.childCount());
        boolean packed = arguments.stream().anyMatch(argument -> argument.is(NodeKind.STARRED)
                || argument.is(NodeKind.KEYWORD) || argument.is(NodeKind.DOUBLE_STARRED));
        if (callee.is(NodeKind.ATTRIBUTE) && isSuperCall(callee.child(0))) {
            return superCall(callee, arguments, packed);
        }
        FragmentCollector c = new FragmentCollector();
        if (callee.is(NodeKind.ATTRIBUTE)) {
            String method = callee.text();
            String methodHelper = RuntimeLibrary.METHOD_PREFIX + method;
            if (RuntimeLibrary.contains(methodHelper)) {
                c.helper(methodHelper);
                String object = c.use(translate(callee.child(0)), ASSIGNMENT);
                if (!packed) {
                    List<String> parts = new ArrayList<>();
                    parts.add(object);
                    parts.addAll(positional(arguments, c));
                    return c.build(methodHelper + ".call(" + String.join(", ", parts) + ")", CALL);
                }
                return c.build(c.helper(OP_CALL) + "(" + methodHelper + ", " + object + ", "
                        + argumentArray(arguments, c) + ", " + keywordArguments(arguments, c) + ")", CALL);
            }
            if (packed) {
                String object = c.use(translate(callee.child(0)), ASSIGNMENT);
                return c.build(c.helper(helperName("op_callmethod")) + "(" + object + ", " + JsLiterals.quote(method)
                        + ", " + argumentArray(arguments, c) + ", " + keywordArguments(arguments, c) + ")", CALL);
            }
        }
        if (!packed) {
            String function = callee.is(NodeKind.ATTRIBUTE)
                    ? receiver(callee.child(0), c) + "." + callee.text()
                    : c.use(translate(callee), CALL);
            return c.build(function + "(" + String.join(", ", positional(arguments, c)) + ")", CALL);
        }
        String function = c.use(translate(callee), ASSIGNMENT);
        return c.build(c.helper(OP_CALL) + "(" + function + ", null, " + argumentArray(arguments, c) + ", "
                + keywordArguments(arguments, c) + ")", CALL);
    }

    private boolean isSuperCall(SyntaxNode node) {
        return node.is(NodeKind.CALL) && node.childCount() == 1
                && isBuiltin(node.child(0)).filter(Builtins.SUPER::equals).isPresent();
    }

    /**
     * Calls the base class implementation captured when the enclosing class was defined.
     */
    private CodeFragment superCall(SyntaxNode callee, List<SyntaxNode> arguments, boolean packed) {
        String self = ctx.frame().self();
        if (self == null) {
            throw new UnsupportedConstructError("super() requires a method with a receiver parameter",
                    callee.position());
        }
        FragmentCollector c = new FragmentCollector();
        String target = c.helper(helperName("op_supermethod")) + "(" + TranslationContext.BASE_PARAMETER + ", "
                + JsLiterals.quote(callee.text()) + ")";
        if (!packed) {
            List<String> parts = new ArrayList<>();
            parts.add(self);
            parts.addAll(positional(arguments, c));
            return c.build(target + ".call(" + String.join(", ", parts) + ")", CALL);
        }
        return c.build(c.helper(OP_CALL) + "(" + target + ", " + self + ", " + argumentArray(arguments, c) + ", "
                + keywordArguments(arguments, c) + ")", CALL);
    }

    private List<String> positional(List<SyntaxNode> arguments, FragmentCollector c) {
        List<String> parts = new ArrayList<>();
        for (SyntaxNode argument : arguments) {
            parts.add(c.use(translate(argument), ASSIGNMENT));
        }
        return parts;
    }

    /**
     * Builds the positional argument array of a packed call; {@code *x} arguments are spliced in.
     */
    private String argumentArray(List<SyntaxNode> arguments, FragmentCollector c) {
        List<String> segments = new ArrayList<>();
        List<String> pending = new ArrayList<>();
        for (SyntaxNode argument : arguments) {
            if (argument.is(NodeKind.KEYWORD) || argument.is(NodeKind.DOUBLE_STARRED)) {
                continue;
            }
            if (argument.is(NodeKind.STARRED)) {
                if (!pending.isEmpty()) {
                    segments.add("[" + String.join(", ", pending) + "]");
                    pending.clear();
                }
                segments.add(c.helper(ITER) + "(" + c.use(translate(argument.child(0)), ASSIGNMENT) + ")");
            } else {
                pending.add(c.use(translate(argument), ASSIGNMENT));
            }
        }
        if (!pending.isEmpty() || segments.isEmpty()) {
            segments.add("[" + String.join(", ", pending) + "]");
        }
        if (segments.size() == 1) {
            return segments.get(0);
        }
        return segments.get(0) + ".concat(" + String.join(", ", segments.subList(1, segments.size())) + ")";
    }

    /**
     * Builds the keyword argument object of a packed call, or {@code null} if there is none.
     */
    private String keywordArguments(List<SyntaxNode> arguments, FragmentCollector c) {
        List<String> parts = new ArrayList<>();
        List<String> pending = new ArrayList<>();
        boolean merged = false;
        for (SyntaxNode argument : arguments) {
            if (argument.is(NodeKind.KEYWORD)) {
                pending.add(JsLiterals.quote(argument.text()) + ": " + c.use(translate(argument.child(0)), ASSIGNMENT));
            } else if (argument.is(NodeKind.DOUBLE_STARRED)) {
                merged = true;
                if (!pending.isEmpty()) {
                    parts.add("{" + String.join(", ", pending) + "}");
                    pending.clear();
                }
                parts.add(c.use(translate(argument.child(0)), ASSIGNMENT));
            }
        }
        if (!pending.isEmpty()) {
            parts.add("{" + String.join(", ", pending) + "}");
        }
        if (parts.isEmpty()) {
            return "null";
        }
        if (!merged) {
            return parts.get(0);
        }
        return c.helper(helperName("op_kwmerge")) + "(" + String.join(", ", parts) + ")";
    }

    // --- operators ---

    private CodeFragment binary(SyntaxNode node) {
        CodeFragment left = translate(node.child(0));
        CodeFragment right = translate(node.child(1));
        if ("-".equals(node.text()) && isNumericLiteral(node.child(0)) && isNumericLiteral(node.child(1))) {
            FragmentCollector c = new FragmentCollector();
            return c.build(c.use(left, ADDITIVE) + " - " + c.use(right, ADDITIVE.tighter()), ADDITIVE);
        }
        return binaryOperation(node.text(), left, right, node.position());
    }

    private CodeFragment unary(SyntaxNode node) {
        SyntaxNode operand = node.child(0);
        FragmentCollector c = new FragmentCollector();
        if ("not".equals(node.text())) {
            return c.build("!" + c.use(condition(operand), UNARY), UNARY);
        }
        if (isNumericLiteral(node) && !"~".equals(node.text())) {
            String code = c.use(translate(operand), UNARY);
            if (code.startsWith("-") || code.startsWith("+")) {
                code = "(" + code + ")";
            }
            return c.build(node.text() + code, UNARY);
        }
        String helper = switch (node.text()) {
            case "-" -> "op_neg";
            case "+" -> "op_pos";
            case "~" -> "op_invert";
            default -> throw new InternalInvariantError("Unknown unary operator '" + node.text() + "'", node.position());
        };
        return c.build(c.helper(helperName(helper)) + "(" + c.use(translate(operand), ASSIGNMENT) + ")", CALL);
    }

    private CodeFragment booleanOperation(SyntaxNode node) {
        boolean and = "and".equals(node.text());
        List<SyntaxNode> operands = node.children();
        if (operands.stream().allMatch(this::isBoolean)) {
            Precedence level = and ? LOGICAL_AND : LOGICAL_OR;
            FragmentCollector c = new FragmentCollector();
            List<String> parts = new ArrayList<>();
            for (int i = 0; i < operands.size(); i++) {
                parts.add(c.use(translate(operands.get(i)), i == 0 ? level : level.tighter()));
            }
            return c.build(String.join(and ? " && " : " || ", parts), level);
        }
        return selectOperand(operands, 0, and);
    }

    /**
     * Lowers {@code a and b} / {@code a or b} so that the result is one of the operands, each
     * evaluated at most once.
     */
    private CodeFragment selectOperand(List<SyntaxNode> operands, int index, boolean and) {
        SyntaxNode node = operands.get(index);
        if (index == operands.size() - 1) {
            return translate(node);
        }
        FragmentCollector c = new FragmentCollector();
        CodeFragment value = translate(node);
        if (isBoolean(node)) {
            Precedence level = and ? LOGICAL_AND : LOGICAL_OR;
            String rest = c.use(selectOperand(operands, index + 1, and), level.tighter());
            return c.build(c.use(value, level) + (and ? " && " : " || ") + rest, level);
        }
        String test;
        String result;
        if (isSimple(node)) {
            test = c.use(value, ASSIGNMENT);
            result = test;
        } else {
            result = ctx.declareTemporary();
            test = result + " = " + c.use(value, ASSIGNMENT);
        }
        String rest = c.use(selectOperand(operands, index + 1, and), ASSIGNMENT);
        String condition = c.helper(TRUTHY) + "(" + test + ")";
        return c.build(and ? condition + " ? " + rest + " : " + result : condition + " ? " + result + " : " + rest,
                CONDITIONAL);
    }

    private CodeFragment conditional(SyntaxNode node) {
        FragmentCollector c = new FragmentCollector();
        String test = c.use(condition(node.child(0)), LOGICAL_OR);
        String body = c.use(translate(node.child(1)), ASSIGNMENT);
        String orelse = c.use(translate(node.child(2)), ASSIGNMENT);
        return c.build(test + " ? " + body + " : " + orelse, CONDITIONAL);
    }

    private CodeFragment compare(SyntaxNode node) {
        List<String> operators = node.names();
        List<SyntaxNode> operands = node.children();
        FragmentCollector c = new FragmentCollector();
        List<String> pairs = new ArrayList<>();
        CodeFragment left = translate(operands.get(0));
        CodeFragment single = null;
        for (int i = 0; i < operators.size(); i++) {
            SyntaxNode rightNode = operands.get(i + 1);
            CodeFragment right = translate(rightNode);
            CodeFragment next = right;
            if (i + 1 < operators.size() && !isSimple(rightNode)) {
                String temporary = ctx.declareTemporary();
                right = new CodeFragment(temporary + " = " + right.wrap(ASSIGNMENT), ASSIGNMENT, right.helpers());
                next = CodeFragment.of(temporary, PRIMARY);
            }
            single = comparison(operators.get(i), left, right, operands.get(i), rightNode);
            pairs.add(c.use(single, LOGICAL_AND.tighter()));
            left = next;
        }
        if (pairs.size() == 1) {
            return single;
        }
        return c.build(String.join(" && ", pairs), LOGICAL_AND);
    }

    private CodeFragment comparison(String operator, CodeFragment left, CodeFragment right,
                                    SyntaxNode leftNode, SyntaxNode rightNode) {
        FragmentCollector c = new FragmentCollector();
        return switch (operator) {
            case "==", "!=" -> {
                String call = c.helper(helperName("op_equals")) + "(" + c.use(left, ASSIGNMENT) + ", "
                        + c.use(right, ASSIGNMENT) + ")";
                yield "==".equals(operator) ? c.build(call, CALL) : c.build("!" + call, UNARY);
            }
            case "<", "<=", ">", ">=" -> {
                if (isNumericLiteral(leftNode) && isNumericLiteral(rightNode)) {
                    yield c.build(c.use(left, RELATIONAL) + " " + operator + " " + c.use(right, RELATIONAL.tighter()),
                            RELATIONAL);
                }
                String helper = switch (operator) {
                    case "<" -> "op_lt";
                    case "<=" -> "op_le";
                    case ">" -> "op_gt";
                    default -> "op_ge";
                };
                yield c.build(c.helper(helperName(helper)) + "(" + c.use(left, ASSIGNMENT) + ", "
                        + c.use(right, ASSIGNMENT) + ")", CALL);
            }
            case "in", "not in" -> {
                String call = c.helper(helperName("op_contains")) + "(" + c.use(right, ASSIGNMENT) + ", "
                        + c.use(left, ASSIGNMENT) + ")";
                yield "in".equals(operator) ? c.build(call, CALL) : c.build("!" + call, UNARY);
            }
            case "is", "is not" -> identity(operator, left, right, leftNode, rightNode, c);
            default -> throw new InternalInvariantError("Unknown comparison operator '" + operator + "'",
                    leftNode.position());
        };
    }

    private CodeFragment identity(String operator, CodeFragment left, CodeFragment right,
                                  SyntaxNode leftNode, SyntaxNode rightNode, FragmentCollector c) {
        boolean negated = "is not".equals(operator);
        if (isConstant(leftNode, "None") || isConstant(rightNode, "None")) {
            return c.build(c.use(left, EQUALITY) + (negated ? " != " : " == ") + c.use(right, EQUALITY.tighter()),
                    EQUALITY);
        }
        if (isConstant(leftNode, "True") || isConstant(leftNode, "False")
                || isConstant(rightNode, "True") || isConstant(rightNode, "False")) {
            return c.build(c.use(left, EQUALITY) + (negated ? " !== " : " === ") + c.use(right, EQUALITY.tighter()),
                    EQUALITY);
        }
        String call = c.helper(helperName("op_is")) + "(" + c.use(left, ASSIGNMENT) + ", "
                + c.use(right, ASSIGNMENT) + ")";
        return negated ? c.build("!" + call, UNARY) : c.build(call, CALL);
    }

    private static boolean isConstant(SyntaxNode node, String value) {
        return node.is(NodeKind.CONSTANT) && value.equals(node.text());
    }

    private static boolean isNumericLiteral(SyntaxNode node) {
        if (node.is(NodeKind.UNARY_OP) && ("-".equals(node.text()) || "+".equals(node.text()))) {
            return isNumericLiteral(node.child(0));
        }
        return node.is(NodeKind.NUMBER);
    }

    // --- suspension ---

    private CodeFragment yieldExpression(SyntaxNode node) {
        FragmentCollector c = new FragmentCollector();
        String value = node.child(0).isEmpty() ? "null" : c.use(translate(node.child(0)), ASSIGNMENT);
        return c.build("yield " + value, ASSIGNMENT);
    }

    private CodeFragment yieldFrom(SyntaxNode node) {
        FragmentCollector c = new FragmentCollector();
        return c.build("yield* " + c.helper(ITER) + "(" + c.use(translate(node.child(0)), ASSIGNMENT) + ")",
                ASSIGNMENT);
    }

    private CodeFragment await(SyntaxNode node) {
        if (!ctx.supports(TargetFeature.ASYNC)) {
            throw new UnsupportedConstructError("'await' requires a target profile with async functions",
                    node.position());
        }
        FragmentCollector c = new FragmentCollector();
        return c.build("await " + c.use(translate(node.child(0)), UNARY), UNARY);
    }
}
