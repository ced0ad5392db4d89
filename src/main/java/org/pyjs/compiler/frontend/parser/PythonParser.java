package org.pyjs.compiler.frontend.parser;

import org.pyjs.compiler.diagnostics.ParsingError;
import org.pyjs.compiler.diagnostics.SourcePosition;
import org.pyjs.compiler.frontend.lexer.Lexer;
import org.pyjs.compiler.frontend.lexer.StringLiteral;
import org.pyjs.compiler.frontend.lexer.Token;
import org.pyjs.compiler.frontend.lexer.TokenType;
import org.pyjs.compiler.frontend.parser.ast.NodeKind;
import org.pyjs.compiler.frontend.parser.ast.SyntaxNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the supported Python subset.
 * Produces the generic {@link SyntaxNode} tree described by {@link NodeKind}.
 *
 * <p>A parser instance is single-use per {@link #parse} call but may be reused sequentially;
 * it holds no state between calls.</p>
 */
public class PythonParser implements SourceParser {

    private static final Set<String> AUG_OPERATORS = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=", "@=");

    private List<Token> tokens;
    private int current;
    private String fileName;

    @Override
    public SyntaxNode parse(String source, String fileName) {
        reset(source, fileName, 0);
        SourcePosition start = new SourcePosition(fileName, 1, 1);
        List<SyntaxNode> statements = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            statements.addAll(statement());
        }
        return SyntaxNode.of(NodeKind.MODULE, null, start, statements);
    }

    /**
     * Parses a single expression, as used inside f-string replacement fields.
     *
     * @param source     The expression text.
     * @param fileName   The file name for positions.
     * @param lineOffset Line of the enclosing string, added to positions.
     * @return The expression node.
     */
    public SyntaxNode parseExpression(String source, String fileName, int lineOffset) {
        PythonParser nested = new PythonParser();
        nested.reset(source.trim(), fileName, lineOffset);
        SyntaxNode expr = nested.testListStarExpr();
        while (nested.check(TokenType.NEWLINE)) {
            nested.advance();
        }
        if (!nested.isAtEnd()) {
            throw nested.error(nested.peek(), "Unexpected token in f-string expression");
        }
        return expr;
    }

    private void reset(String source, String fileName, int lineOffset) {
        this.fileName = fileName;
        List<Token> scanned = new Lexer(source, fileName).scanTokens();
        if (lineOffset > 0) {
            List<Token> shifted = new ArrayList<>(scanned.size());
            for (Token t : scanned) {
                shifted.add(new Token(t.type(), t.text(), t.value(), t.line() + lineOffset - 1, t.column(), t.fileName()));
            }
            scanned = shifted;
        }
        this.tokens = scanned;
        this.current = 0;
    }

    // --- statements ---

    private List<SyntaxNode> statement() {
        Token t = peek();
        if (t.type() == TokenType.KEYWORD) {
            switch (t.text()) {
                case "if":
                    return List.of(ifStatement());
                case "while":
                    return List.of(whileStatement());
                case "for":
                    return List.of(forStatement(false));
                case "try":
                    return List.of(tryStatement());
                case "with":
                    return List.of(withStatement(false));
                case "def":
                    return List.of(functionDef(false, emptyDecorators(t)));
                case "class":
                    return List.of(classDef(emptyDecorators(t)));
                case "async":
                    return List.of(asyncStatement(emptyDecorators(t)));
                default:
                    break;
            }
        }
        if (t.isOperator("@")) {
            return List.of(decorated());
        }
        return simpleStatements();
    }

    private List<SyntaxNode> simpleStatements() {
        List<SyntaxNode> result = new ArrayList<>();
        result.add(smallStatement());
        while (matchOperator(";")) {
            if (check(TokenType.NEWLINE) || isAtEnd()) {
                break;
            }
            result.add(smallStatement());
        }
        if (!isAtEnd()) {
            consume(TokenType.NEWLINE, "Expected end of line");
        }
        return result;
    }

    private SyntaxNode smallStatement() {
        Token t = peek();
        SourcePosition pos = t.position();
        if (t.type() == TokenType.KEYWORD) {
            switch (t.text()) {
                case "pass":
                    advance();
                    return SyntaxNode.of(NodeKind.PASS, pos);
                case "break":
                    advance();
                    return SyntaxNode.of(NodeKind.BREAK, pos);
                case "continue":
                    advance();
                    return SyntaxNode.of(NodeKind.CONTINUE, pos);
                case "return": {
                    advance();
                    SyntaxNode value = atStatementEnd() ? SyntaxNode.empty(pos) : testListStarExpr();
                    return SyntaxNode.of(NodeKind.RETURN, pos, value);
                }
                case "raise": {
                    advance();
                    if (atStatementEnd()) {
                        return SyntaxNode.of(NodeKind.RAISE, pos, SyntaxNode.empty(pos), SyntaxNode.empty(pos));
                    }
                    SyntaxNode exc = test();
                    SyntaxNode cause = matchKeyword("from") ? test() : SyntaxNode.empty(pos);
                    return SyntaxNode.of(NodeKind.RAISE, pos, exc, cause);
                }
                case "global":
                case "nonlocal": {
                    advance();
                    List<String> names = new ArrayList<>();
                    do {
                        names.add(consume(TokenType.NAME, "Expected name").text());
                    } while (matchOperator(","));
                    return SyntaxNode.of(t.text().equals("global") ? NodeKind.GLOBAL : NodeKind.NONLOCAL, names, pos);
                }
                case "del": {
                    advance();
                    List<SyntaxNode> targets = new ArrayList<>();
                    do {
                        if (atStatementEnd()) break;
                        targets.add(checkTarget(expr()));
                    } while (matchOperator(","));
                    return SyntaxNode.of(NodeKind.DELETE, null, pos, targets);
                }
                case "assert": {
                    advance();
                    SyntaxNode test = test();
                    SyntaxNode message = matchOperator(",") ? test() : SyntaxNode.empty(pos);
                    return SyntaxNode.of(NodeKind.ASSERT, pos, test, message);
                }
                case "import":
                case "from":
                    return importStatement();
                default:
                    break;
            }
        }
        return expressionStatement();
    }

    private SyntaxNode importStatement() {
        Token start = advance();
        List<String> parts = new ArrayList<>();
        StringBuilder sb = new StringBuilder(start.text());
        while (!atStatementEnd()) {
            Token t = advance();
            sb.append(' ').append(t.text());
        }
        parts.add(sb.toString());
        return SyntaxNode.of(NodeKind.IMPORT, parts, start.position());
    }

    private SyntaxNode expressionStatement() {
        SourcePosition pos = peek().position();
        SyntaxNode first = checkKeyword("yield") ? yieldExpression() : testListStarExpr();

        if (peek().type() == TokenType.OPERATOR && AUG_OPERATORS.contains(peek().text())) {
            Token op = advance();
            checkTarget(first);
            if (first.is(NodeKind.TUPLE) || first.is(NodeKind.LIST)) {
                throw error(op, "Illegal expression for augmented assignment");
            }
            SyntaxNode value = checkKeyword("yield") ? yieldExpression() : testList();
            String operator = op.text().substring(0, op.text().length() - 1);
            return SyntaxNode.of(NodeKind.AUG_ASSIGN, operator, pos, first, value);
        }
        if (matchOperator(":")) {
            if (!(first.is(NodeKind.NAME) || first.is(NodeKind.ATTRIBUTE) || first.is(NodeKind.SUBSCRIPT))) {
                throw error(previous(), "Illegal target for annotation");
            }
            SyntaxNode annotation = test();
            SyntaxNode value = matchOperator("=")
                    ? (checkKeyword("yield") ? yieldExpression() : testListStarExpr())
                    : SyntaxNode.empty(pos);
            return SyntaxNode.of(NodeKind.ANN_ASSIGN, pos, first, annotation, value);
        }
        if (checkOperator("=")) {
            List<SyntaxNode> parts = new ArrayList<>();
            parts.add(first);
            while (matchOperator("=")) {
                parts.add(checkKeyword("yield") ? yieldExpression() : testListStarExpr());
            }
            for (int i = 0; i < parts.size() - 1; i++) {
                checkTarget(parts.get(i));
            }
            return SyntaxNode.of(NodeKind.ASSIGN, null, pos, parts);
        }
        return SyntaxNode.of(NodeKind.EXPR_STMT, pos, first);
    }

    private SyntaxNode checkTarget(SyntaxNode target) {
        switch (target.kind()) {
            case NAME, ATTRIBUTE, SUBSCRIPT:
                return target;
            case TUPLE, LIST:
                for (SyntaxNode element : target.children()) {
                    checkTarget(element);
                }
                return target;
            case STARRED:
                checkTarget(target.child(0));
                return target;
            default:
                throw new ParsingError("Cannot assign to " + describe(target), target.position());
        }
    }

    private static String describe(SyntaxNode node) {
        return switch (node.kind()) {
            case CALL -> "function call";
            case NUMBER, STRING, FSTRING, CONSTANT -> "literal";
            default -> "expression";
        };
    }

    private SyntaxNode block() {
        consumeOperator(":", "Expected ':'");
        SourcePosition pos = peek().position();
        if (match(TokenType.NEWLINE)) {
            consume(TokenType.INDENT, "Expected an indented block");
            List<SyntaxNode> body = new ArrayList<>();
            while (!check(TokenType.DEDENT) && !isAtEnd()) {
                if (match(TokenType.NEWLINE)) continue;
                body.addAll(statement());
            }
            consume(TokenType.DEDENT, "Expected dedent");
            return SyntaxNode.of(NodeKind.BLOCK, null, pos, body);
        }
        return SyntaxNode.of(NodeKind.BLOCK, null, pos, simpleStatements());
    }

    private SyntaxNode ifStatement() {
        Token start = advance();
        SyntaxNode test = namedTest();
        SyntaxNode body = block();
        SyntaxNode orelse;
        if (checkKeyword("elif")) {
            Token elif = peek();
            SyntaxNode nested = ifStatement();
            orelse = SyntaxNode.of(NodeKind.BLOCK, null, elif.position(), List.of(nested));
        } else if (matchKeyword("else")) {
            orelse = block();
        } else {
            orelse = SyntaxNode.empty(start.position());
        }
        return SyntaxNode.of(NodeKind.IF, start.position(), test, body, orelse);
    }

    private SyntaxNode whileStatement() {
        Token start = advance();
        SyntaxNode test = namedTest();
        SyntaxNode body = block();
        SyntaxNode orelse = matchKeyword("else") ? block() : SyntaxNode.empty(start.position());
        return SyntaxNode.of(NodeKind.WHILE, start.position(), test, body, orelse);
    }

    private SyntaxNode forStatement(boolean async) {
        Token start = advance();
        SyntaxNode target = checkTarget(exprList());
        consumeKeyword("in", "Expected 'in'");
        SyntaxNode iterable = testList();
        SyntaxNode body = block();
        SyntaxNode orelse = matchKeyword("else") ? block() : SyntaxNode.empty(start.position());
        return SyntaxNode.of(async ? NodeKind.ASYNC_FOR : NodeKind.FOR, start.position(), target, iterable, body, orelse);
    }

    private SyntaxNode tryStatement() {
        Token start = advance();
        SyntaxNode body = block();
        List<SyntaxNode> children = new ArrayList<>();
        children.add(body);
        boolean hasHandler = false;
        while (checkKeyword("except")) {
            Token except = advance();
            SyntaxNode type = SyntaxNode.empty(except.position());
            String name = null;
            if (!checkOperator(":")) {
                type = test();
                if (matchOperator(",")) {
                    throw error(previous(), "Multiple exception types must be parenthesized");
                }
                if (matchKeyword("as")) {
                    name = consume(TokenType.NAME, "Expected name after 'as'").text();
                }
            }
            SyntaxNode handlerBody = block();
            children.add(SyntaxNode.of(NodeKind.EXCEPT_HANDLER, name, except.position(), type, handlerBody));
            hasHandler = true;
        }
        SyntaxNode orelse = SyntaxNode.empty(start.position());
        if (checkKeyword("else")) {
            if (!hasHandler) {
                throw error(peek(), "'else' without 'except'");
            }
            advance();
            orelse = block();
        }
        SyntaxNode finalBody = matchKeyword("finally") ? block() : SyntaxNode.empty(start.position());
        if (!hasHandler && finalBody.isEmpty()) {
            throw error(start, "Expected 'except' or 'finally' block");
        }
        children.add(orelse);
        children.add(finalBody);
        return SyntaxNode.of(NodeKind.TRY, null, start.position(), children);
    }

    private SyntaxNode withStatement(boolean async) {
        Token start = advance();
        List<SyntaxNode> children = new ArrayList<>();
        do {
            SourcePosition pos = peek().position();
            SyntaxNode context = test();
            SyntaxNode target = matchKeyword("as") ? checkTarget(expr()) : SyntaxNode.empty(pos);
            children.add(SyntaxNode.of(NodeKind.WITH_ITEM, pos, context, target));
        } while (matchOperator(","));
        children.add(block());
        return SyntaxNode.of(async ? NodeKind.ASYNC_WITH : NodeKind.WITH, null, start.position(), children);
    }

    private SyntaxNode asyncStatement(SyntaxNode decorators) {
        Token async = advance();
        if (checkKeyword("def")) {
            return functionDef(true, decorators);
        }
        if (!decorators.children().isEmpty()) {
            throw error(async, "Expected 'def' after decorators");
        }
        if (checkKeyword("for")) {
            return forStatement(true);
        }
        if (checkKeyword("with")) {
            return withStatement(true);
        }
        throw error(peek(), "Expected 'def', 'for' or 'with' after 'async'");
    }

    private SyntaxNode decorated() {
        SourcePosition pos = peek().position();
        List<SyntaxNode> decorators = new ArrayList<>();
        while (matchOperator("@")) {
            decorators.add(namedTest());
            consume(TokenType.NEWLINE, "Expected end of line after decorator");
        }
        SyntaxNode decoratorNode = SyntaxNode.of(NodeKind.DECORATORS, null, pos, decorators);
        if (checkKeyword("def")) {
            return functionDef(false, decoratorNode);
        }
        if (checkKeyword("class")) {
            return classDef(decoratorNode);
        }
        if (checkKeyword("async")) {
            return asyncStatement(decoratorNode);
        }
        throw error(peek(), "Expected 'def' or 'class' after decorators");
    }

    private SyntaxNode emptyDecorators(Token at) {
        return SyntaxNode.of(NodeKind.DECORATORS, null, at.position(), List.of());
    }

    private SyntaxNode functionDef(boolean async, SyntaxNode decorators) {
        Token start = advance();
        Token name = consume(TokenType.NAME, "Expected function name");
        consumeOperator("(", "Expected '('");
        SyntaxNode parameters = parameterList(")", true, name.position());
        consumeOperator(")", "Expected ')'");
        if (matchOperator("->")) {
            test();
        }
        SyntaxNode body = block();
        return SyntaxNode.of(async ? NodeKind.ASYNC_FUNCTION_DEF : NodeKind.FUNCTION_DEF,
                name.text(), start.position(), parameters, body, decorators);
    }

    private SyntaxNode classDef(SyntaxNode decorators) {
        Token start = advance();
        Token name = consume(TokenType.NAME, "Expected class name");
        List<SyntaxNode> bases = new ArrayList<>();
        if (matchOperator("(")) {
            bases = argumentList();
            consumeOperator(")", "Expected ')'");
        }
        SyntaxNode arguments = SyntaxNode.of(NodeKind.ARGUMENTS, null, name.position(), bases);
        SyntaxNode body = block();
        return SyntaxNode.of(NodeKind.CLASS_DEF, name.text(), start.position(), arguments, body, decorators);
    }

    /**
     * Parses a parameter list up to (not including) the closing delimiter.
     */
    private SyntaxNode parameterList(String closing, boolean annotations, SourcePosition pos) {
        List<SyntaxNode> params = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        boolean keywordOnly = false;
        boolean sawDefault = false;
        boolean sawKwargs = false;
        while (!checkOperator(closing)) {
            if (sawKwargs) {
                throw error(peek(), "Parameter after **kwargs");
            }
            Token t = peek();
            if (matchOperator("/")) {
                // positional-only marker; the preceding parameters remain positional
            } else if (matchOperator("**")) {
                Token name = consume(TokenType.NAME, "Expected parameter name");
                skipAnnotation(annotations);
                params.add(SyntaxNode.of(NodeKind.KWARGS_PARAM, declare(name, seen), name.position()));
                sawKwargs = true;
            } else if (matchOperator("*")) {
                if (keywordOnly) {
                    throw error(t, "Duplicate '*' in parameter list");
                }
                keywordOnly = true;
                if (check(TokenType.NAME)) {
                    Token name = advance();
                    skipAnnotation(annotations);
                    params.add(SyntaxNode.of(NodeKind.VARARGS_PARAM, declare(name, seen), name.position()));
                }
            } else {
                Token name = consume(TokenType.NAME, "Expected parameter name");
                skipAnnotation(annotations);
                SyntaxNode defaultValue = SyntaxNode.empty(name.position());
                if (matchOperator("=")) {
                    defaultValue = test();
                }
                if (keywordOnly) {
                    params.add(SyntaxNode.of(NodeKind.KWONLY_PARAM, declare(name, seen), name.position(), defaultValue));
                } else {
                    if (defaultValue.isEmpty() && sawDefault) {
                        throw error(name, "Non-default parameter follows default parameter");
                    }
                    sawDefault |= !defaultValue.isEmpty();
                    params.add(SyntaxNode.of(NodeKind.PARAM, declare(name, seen), name.position(), defaultValue));
                }
            }
            if (!matchOperator(",")) {
                break;
            }
        }
        return SyntaxNode.of(NodeKind.PARAMETERS, null, pos, params);
    }

    private String declare(Token name, Set<String> seen) {
        if (!seen.add(name.text())) {
            throw error(name, "Duplicate parameter '" + name.text() + "'");
        }
        return name.text();
    }

    private void skipAnnotation(boolean annotations) {
        if (annotations && matchOperator(":")) {
            test();
        }
    }

    // --- expressions ---

    private SyntaxNode namedTest() {
        SyntaxNode node = test();
        if (checkOperator(":=")) {
            throw error(peek(), "Assignment expressions are not supported");
        }
        return node;
    }

    private SyntaxNode testListStarExpr() {
        SourcePosition pos = peek().position();
        SyntaxNode first = checkOperator("*") ? starExpr() : test();
        if (!checkOperator(",")) {
            return first;
        }
        List<SyntaxNode> elements = new ArrayList<>();
        elements.add(first);
        while (matchOperator(",")) {
            if (atExpressionEnd()) break;
            elements.add(checkOperator("*") ? starExpr() : test());
        }
        return SyntaxNode.of(NodeKind.TUPLE, null, pos, elements);
    }

    private SyntaxNode testList() {
        SourcePosition pos = peek().position();
        SyntaxNode first = test();
        if (!checkOperator(",")) {
            return first;
        }
        List<SyntaxNode> elements = new ArrayList<>();
        elements.add(first);
        while (matchOperator(",")) {
            if (atExpressionEnd()) break;
            elements.add(test());
        }
        return SyntaxNode.of(NodeKind.TUPLE, null, pos, elements);
    }

    private SyntaxNode exprList() {
        SourcePosition pos = peek().position();
        SyntaxNode first = checkOperator("*") ? starExpr() : expr();
        if (!checkOperator(",")) {
            return first;
        }
        List<SyntaxNode> elements = new ArrayList<>();
        elements.add(first);
        while (matchOperator(",")) {
            if (checkKeyword("in") || atExpressionEnd()) break;
            elements.add(checkOperator("*") ? starExpr() : expr());
        }
        return SyntaxNode.of(NodeKind.TUPLE, null, pos, elements);
    }

    private SyntaxNode starExpr() {
        Token star = advance();
        return SyntaxNode.of(NodeKind.STARRED, star.position(), expr());
    }

    private SyntaxNode test() {
        if (checkKeyword("lambda")) {
            return lambda();
        }
        SyntaxNode body = orTest();
        if (checkKeyword("if")) {
            Token ifToken = advance();
            SyntaxNode condition = orTest();
            consumeKeyword("else", "Expected 'else' in conditional expression");
            SyntaxNode orelse = test();
            return SyntaxNode.of(NodeKind.IF_EXP, ifToken.position(), condition, body, orelse);
        }
        return body;
    }

    private SyntaxNode lambda() {
        Token start = advance();
        SyntaxNode parameters = parameterList(":", false, start.position());
        consumeOperator(":", "Expected ':' in lambda");
        SyntaxNode body = test();
        return SyntaxNode.of(NodeKind.LAMBDA, start.position(), parameters, body);
    }

    private SyntaxNode orTest() {
        return boolOp("or", this::andTest);
    }

    private SyntaxNode andTest() {
        return boolOp("and", this::notTest);
    }

    private SyntaxNode boolOp(String op, java.util.function.Supplier<SyntaxNode> operand) {
        SourcePosition pos = peek().position();
        SyntaxNode first = operand.get();
        if (!checkKeyword(op)) {
            return first;
        }
        List<SyntaxNode> operands = new ArrayList<>();
        operands.add(first);
        while (matchKeyword(op)) {
            operands.add(operand.get());
        }
        return SyntaxNode.of(NodeKind.BOOL_OP, op, pos, operands);
    }

    private SyntaxNode notTest() {
        if (checkKeyword("not")) {
            Token not = advance();
            return SyntaxNode.of(NodeKind.UNARY_OP, "not", not.position(), notTest());
        }
        return comparison();
    }

    private SyntaxNode comparison() {
        SourcePosition pos = peek().position();
        SyntaxNode first = expr();
        List<String> ops = new ArrayList<>();
        List<SyntaxNode> operands = new ArrayList<>();
        operands.add(first);
        while (true) {
            String op = comparisonOperator();
            if (op == null) break;
            ops.add(op);
            operands.add(expr());
        }
        if (ops.isEmpty()) {
            return first;
        }
        return SyntaxNode.of(NodeKind.COMPARE, ops, pos, operands);
    }

    private String comparisonOperator() {
        Token t = peek();
        if (t.type() == TokenType.OPERATOR) {
            switch (t.text()) {
                case "<", ">", "==", ">=", "<=", "!=" -> {
                    advance();
                    return t.text();
                }
                default -> {
                    return null;
                }
            }
        }
        if (t.isKeyword("in")) {
            advance();
            return "in";
        }
        if (t.isKeyword("not") && peekNext().isKeyword("in")) {
            advance();
            advance();
            return "not in";
        }
        if (t.isKeyword("is")) {
            advance();
            return matchKeyword("not") ? "is not" : "is";
        }
        return null;
    }

    private SyntaxNode expr() {
        return binary(this::xorExpr, "|");
    }

    private SyntaxNode xorExpr() {
        return binary(this::andExpr, "^");
    }

    private SyntaxNode andExpr() {
        return binary(this::shiftExpr, "&");
    }

    private SyntaxNode shiftExpr() {
        return binary(this::arithExpr, "<<", ">>");
    }

    private SyntaxNode arithExpr() {
        return binary(this::term, "+", "-");
    }

    private SyntaxNode term() {
        return binary(this::factor, "*", "/", "//", "%", "@");
    }

    private SyntaxNode binary(java.util.function.Supplier<SyntaxNode> operand, String... operators) {
        SyntaxNode left = operand.get();
        while (true) {
            Token t = peek();
            String matched = null;
            if (t.type() == TokenType.OPERATOR) {
                for (String op : operators) {
                    if (t.text().equals(op)) {
                        matched = op;
                        break;
                    }
                }
            }
            if (matched == null) {
                return left;
            }
            advance();
            SyntaxNode right = operand.get();
            left = SyntaxNode.of(NodeKind.BINARY_OP, matched, t.position(), left, right);
        }
    }

    private SyntaxNode factor() {
        Token t = peek();
        if (t.isOperator("-") || t.isOperator("+") || t.isOperator("~")) {
            advance();
            return SyntaxNode.of(NodeKind.UNARY_OP, t.text(), t.position(), factor());
        }
        return power();
    }

    private SyntaxNode power() {
        SyntaxNode base = awaitPrimary();
        if (checkOperator("**")) {
            Token op = advance();
            SyntaxNode exponent = factor();
            return SyntaxNode.of(NodeKind.BINARY_OP, "**", op.position(), base, exponent);
        }
        return base;
    }

    private SyntaxNode awaitPrimary() {
        if (checkKeyword("await")) {
            Token await = advance();
            return SyntaxNode.of(NodeKind.AWAIT, await.position(), primary());
        }
        return primary();
    }

    private SyntaxNode primary() {
        SyntaxNode node = atom();
        while (true) {
            Token t = peek();
            if (t.isOperator("(")) {
                advance();
                List<SyntaxNode> children = new ArrayList<>();
                children.add(node);
                children.addAll(argumentList());
                consumeOperator(")", "Expected ')' after arguments");
                node = SyntaxNode.of(NodeKind.CALL, null, t.position(), children);
            } else if (t.isOperator("[")) {
                advance();
                SyntaxNode index = subscriptList();
                consumeOperator("]", "Expected ']'");
                node = SyntaxNode.of(NodeKind.SUBSCRIPT, t.position(), node, index);
            } else if (t.isOperator(".")) {
                advance();
                Token name = peek();
                if (name.type() != TokenType.NAME && name.type() != TokenType.KEYWORD) {
                    throw error(name, "Expected attribute name");
                }
                advance();
                node = SyntaxNode.of(NodeKind.ATTRIBUTE, name.text(), name.position(), node);
            } else {
                return node;
            }
        }
    }

    private List<SyntaxNode> argumentList() {
        List<SyntaxNode> args = new ArrayList<>();
        while (!checkOperator(")")) {
            Token t = peek();
            if (matchOperator("**")) {
                args.add(SyntaxNode.of(NodeKind.DOUBLE_STARRED, t.position(), test()));
            } else if (matchOperator("*")) {
                args.add(SyntaxNode.of(NodeKind.STARRED, t.position(), test()));
            } else if (t.type() == TokenType.NAME && peekNext().isOperator("=")) {
                advance();
                advance();
                args.add(SyntaxNode.of(NodeKind.KEYWORD, t.text(), t.position(), test()));
            } else {
                SyntaxNode arg = namedTest();
                if (checkKeyword("for")) {
                    List<SyntaxNode> parts = new ArrayList<>();
                    parts.add(arg);
                    parts.addAll(comprehensionClauses());
                    arg = SyntaxNode.of(NodeKind.GENERATOR_EXP, null, t.position(), parts);
                }
                args.add(arg);
            }
            if (!matchOperator(",")) {
                break;
            }
        }
        return args;
    }

    private SyntaxNode subscriptList() {
        SourcePosition pos = peek().position();
        SyntaxNode first = subscript();
        if (!checkOperator(",")) {
            return first;
        }
        List<SyntaxNode> elements = new ArrayList<>();
        elements.add(first);
        while (matchOperator(",")) {
            if (checkOperator("]")) break;
            elements.add(subscript());
        }
        return SyntaxNode.of(NodeKind.TUPLE, null, pos, elements);
    }

    private SyntaxNode subscript() {
        SourcePosition pos = peek().position();
        SyntaxNode lower = SyntaxNode.empty(pos);
        if (!checkOperator(":")) {
            lower = test();
            if (!checkOperator(":")) {
                return lower;
            }
        }
        consumeOperator(":", "Expected ':'");
        SyntaxNode upper = SyntaxNode.empty(pos);
        if (!checkOperator(":") && !checkOperator("]") && !checkOperator(",")) {
            upper = test();
        }
        SyntaxNode step = SyntaxNode.empty(pos);
        if (matchOperator(":")) {
            if (!checkOperator("]") && !checkOperator(",")) {
                step = test();
            }
        }
        return SyntaxNode.of(NodeKind.SLICE, pos, lower, upper, step);
    }

    private List<SyntaxNode> comprehensionClauses() {
        List<SyntaxNode> clauses = new ArrayList<>();
        while (checkKeyword("for") || checkKeyword("async")) {
            if (checkKeyword("async")) {
                throw error(peek(), "Asynchronous comprehensions are not supported");
            }
            Token forToken = advance();
            SyntaxNode target = checkTarget(exprList());
            consumeKeyword("in", "Expected 'in' in comprehension");
            SyntaxNode iterable = orTest();
            List<SyntaxNode> parts = new ArrayList<>();
            parts.add(target);
            parts.add(iterable);
            while (matchKeyword("if")) {
                parts.add(orTest());
            }
            clauses.add(SyntaxNode.of(NodeKind.COMP_FOR, null, forToken.position(), parts));
        }
        return clauses;
    }

    private SyntaxNode yieldExpression() {
        Token yield = advance();
        if (matchKeyword("from")) {
            return SyntaxNode.of(NodeKind.YIELD_FROM, yield.position(), test());
        }
        if (atExpressionEnd() || checkOperator("=")) {
            return SyntaxNode.of(NodeKind.YIELD, yield.position(), SyntaxNode.empty(yield.position()));
        }
        return SyntaxNode.of(NodeKind.YIELD, yield.position(), testListStarExpr());
    }

    private SyntaxNode atom() {
        Token t = peek();
        SourcePosition pos = t.position();
        switch (t.type()) {
            case NAME:
                advance();
                return SyntaxNode.of(NodeKind.NAME, t.text(), pos);
            case NUMBER:
                advance();
                return SyntaxNode.of(NodeKind.NUMBER, t.text(), pos);
            case STRING:
                return strings();
            case KEYWORD:
                if (t.text().equals("True") || t.text().equals("False") || t.text().equals("None")) {
                    advance();
                    return SyntaxNode.of(NodeKind.CONSTANT, t.text(), pos);
                }
                throw error(t, "Unexpected keyword '" + t.text() + "'");
            case OPERATOR:
                switch (t.text()) {
                    case "(":
                        return parenthesized();
                    case "[":
                        return listDisplay();
                    case "{":
                        return dictOrSetDisplay();
                    case "...":
                        throw error(t, "Ellipsis is not supported");
                    default:
                        throw error(t, "Unexpected '" + t.text() + "'");
                }
            default:
                throw error(t, "Unexpected " + describeToken(t));
        }
    }

    private SyntaxNode parenthesized() {
        Token open = advance();
        if (matchOperator(")")) {
            return SyntaxNode.of(NodeKind.TUPLE, null, open.position(), List.of());
        }
        if (checkKeyword("yield")) {
            SyntaxNode yield = yieldExpression();
            consumeOperator(")", "Expected ')'");
            return yield;
        }
        SyntaxNode first = checkOperator("*") ? starExpr() : namedTest();
        if (checkKeyword("for")) {
            List<SyntaxNode> parts = new ArrayList<>();
            parts.add(first);
            parts.addAll(comprehensionClauses());
            consumeOperator(")", "Expected ')'");
            return SyntaxNode.of(NodeKind.GENERATOR_EXP, null, open.position(), parts);
        }
        if (matchOperator(")")) {
            return first;
        }
        List<SyntaxNode> elements = new ArrayList<>();
        elements.add(first);
        while (matchOperator(",")) {
            if (checkOperator(")")) break;
            elements.add(checkOperator("*") ? starExpr() : namedTest());
        }
        consumeOperator(")", "Expected ')'");
        return SyntaxNode.of(NodeKind.TUPLE, null, open.position(), elements);
    }

    private SyntaxNode listDisplay() {
        Token open = advance();
        if (matchOperator("]")) {
            return SyntaxNode.of(NodeKind.LIST, null, open.position(), List.of());
        }
        SyntaxNode first = checkOperator("*") ? starExpr() : namedTest();
        if (checkKeyword("for")) {
            List<SyntaxNode> parts = new ArrayList<>();
            parts.add(first);
            parts.addAll(comprehensionClauses());
            consumeOperator("]", "Expected ']'");
            return SyntaxNode.of(NodeKind.LIST_COMP, null, open.position(), parts);
        }
        List<SyntaxNode> elements = new ArrayList<>();
        elements.add(first);
        while (matchOperator(",")) {
            if (checkOperator("]")) break;
            elements.add(checkOperator("*") ? starExpr() : namedTest());
        }
        consumeOperator("]", "Expected ']'");
        return SyntaxNode.of(NodeKind.LIST, null, open.position(), elements);
    }

    private SyntaxNode dictOrSetDisplay() {
        Token open = advance();
        if (matchOperator("}")) {
            return SyntaxNode.of(NodeKind.DICT, null, open.position(), List.of());
        }
        if (checkOperator("**")) {
            throw error(peek(), "Dict unpacking in displays is not supported");
        }
        SyntaxNode first = checkOperator("*") ? starExpr() : test();
        if (matchOperator(":")) {
            SyntaxNode value = test();
            if (checkKeyword("for")) {
                List<SyntaxNode> parts = new ArrayList<>();
                parts.add(first);
                parts.add(value);
                parts.addAll(comprehensionClauses());
                consumeOperator("}", "Expected '}'");
                return SyntaxNode.of(NodeKind.DICT_COMP, null, open.position(), parts);
            }
            List<SyntaxNode> items = new ArrayList<>();
            items.add(first);
            items.add(value);
            while (matchOperator(",")) {
                if (checkOperator("}")) break;
                if (checkOperator("**")) {
                    throw error(peek(), "Dict unpacking in displays is not supported");
                }
                items.add(test());
                consumeOperator(":", "Expected ':' in dict display");
                items.add(test());
            }
            consumeOperator("}", "Expected '}'");
            return SyntaxNode.of(NodeKind.DICT, null, open.position(), items);
        }
        if (checkKeyword("for")) {
            List<SyntaxNode> parts = new ArrayList<>();
            parts.add(first);
            parts.addAll(comprehensionClauses());
            consumeOperator("}", "Expected '}'");
            return SyntaxNode.of(NodeKind.SET_COMP, null, open.position(), parts);
        }
        List<SyntaxNode> elements = new ArrayList<>();
        elements.add(first);
        while (matchOperator(",")) {
            if (checkOperator("}")) break;
            elements.add(checkOperator("*") ? starExpr() : test());
        }
        consumeOperator("}", "Expected '}'");
        return SyntaxNode.of(NodeKind.SET, null, open.position(), elements);
    }

    /**
     * Concatenates adjacent string literals. If any part is an f-string the result is an
     * FSTRING node, otherwise a single STRING node.
     */
    private SyntaxNode strings() {
        Token first = peek();
        List<SyntaxNode> parts = new ArrayList<>();
        boolean formatted = false;
        while (check(TokenType.STRING)) {
            Token t = advance();
            StringLiteral literal = (StringLiteral) t.value();
            if (literal.bytes()) {
                throw error(t, "Bytes literals are not supported");
            }
            if (literal.formatted()) {
                formatted = true;
                parts.addAll(new FStringParser(this, fileName).parse(literal.content(), t.position()));
            } else {
                parts.add(SyntaxNode.of(NodeKind.STRING, literal.content(), t.position()));
            }
        }
        if (!formatted) {
            StringBuilder sb = new StringBuilder();
            for (SyntaxNode part : parts) {
                sb.append(part.text());
            }
            return SyntaxNode.of(NodeKind.STRING, sb.toString(), first.position());
        }
        return SyntaxNode.of(NodeKind.FSTRING, null, first.position(), FStringParser.mergeLiterals(parts));
    }

    // --- token helpers ---

    private boolean atStatementEnd() {
        return check(TokenType.NEWLINE) || checkOperator(";") || isAtEnd();
    }

    private boolean atExpressionEnd() {
        Token t = peek();
        if (t.type() == TokenType.NEWLINE || t.type() == TokenType.END_OF_FILE) return true;
        return t.type() == TokenType.OPERATOR
                && (t.text().equals(")") || t.text().equals("]") || t.text().equals("}")
                || t.text().equals(";") || t.text().equals("=") || t.text().equals(":")
                || AUG_OPERATORS.contains(t.text()));
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchOperator(String op) {
        if (checkOperator(op)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchKeyword(String keyword) {
        if (checkKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkOperator(String op) {
        return peek().isOperator(op);
    }

    private boolean checkKeyword(String keyword) {
        return peek().isKeyword(keyword);
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekNext() {
        return current + 1 < tokens.size() ? tokens.get(current + 1) : tokens.get(tokens.size() - 1);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private void consumeOperator(String op, String message) {
        if (!matchOperator(op)) {
            throw error(peek(), message);
        }
    }

    private void consumeKeyword(String keyword, String message) {
        if (!matchKeyword(keyword)) {
            throw error(peek(), message);
        }
    }

    private ParsingError error(Token token, String message) {
        return new ParsingError(message + " (found " + describeToken(token) + ")", token.position());
    }

    private static String describeToken(Token token) {
        return switch (token.type()) {
            case NEWLINE -> "end of line";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            case END_OF_FILE -> "end of file";
            default -> "'" + token.text() + "'";
        };
    }
}
