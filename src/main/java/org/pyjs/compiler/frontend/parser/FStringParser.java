package org.pyjs.compiler.frontend.parser;

import org.pyjs.compiler.diagnostics.ParsingError;
import org.pyjs.compiler.diagnostics.SourcePosition;
import org.pyjs.compiler.frontend.parser.ast.NodeKind;
import org.pyjs.compiler.frontend.parser.ast.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the decoded content of an f-string into literal parts and replacement fields.
 * Replacement expressions are handed back to {@link PythonParser#parseExpression}.
 */
class FStringParser {

    private final PythonParser parser;
    private final String fileName;

    FStringParser(PythonParser parser, String fileName) {
        this.parser = parser;
        this.fileName = fileName;
    }

    /**
     * @param content  The decoded string content.
     * @param position Position of the string literal.
     * @return STRING and FORMATTED_VALUE nodes in source order.
     */
    List<SyntaxNode> parse(String content, SourcePosition position) {
        List<SyntaxNode> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '{') {
                if (i + 1 < content.length() && content.charAt(i + 1) == '{') {
                    literal.append('{');
                    i += 2;
                    continue;
                }
                flush(literal, parts, position);
                i = replacementField(content, i + 1, parts, position);
                continue;
            }
            if (c == '}') {
                if (i + 1 < content.length() && content.charAt(i + 1) == '}') {
                    literal.append('}');
                    i += 2;
                    continue;
                }
                throw new ParsingError("Single '}' is not allowed in f-string", position);
            }
            literal.append(c);
            i++;
        }
        flush(literal, parts, position);
        return parts;
    }

    /**
     * Parses one {@code {expr!conv:spec}} field starting after the opening brace.
     * @return The index just past the closing brace.
     */
    private int replacementField(String content, int start, List<SyntaxNode> parts, SourcePosition position) {
        int depth = 0;
        char quote = 0;
        int i = start;
        int exprEnd = -1;
        String conversion = null;
        int specStart = -1;
        for (; i < content.length(); i++) {
            char c = content.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if ((c == ')' || c == ']' || c == '}') && depth > 0) {
                depth--;
            } else if (depth == 0 && c == '!' && i + 1 < content.length() && content.charAt(i + 1) != '=') {
                exprEnd = i;
                if (i + 1 >= content.length()) break;
                conversion = String.valueOf(content.charAt(i + 1));
                i += 2;
                if (i < content.length() && content.charAt(i) == ':') {
                    specStart = i + 1;
                }
                break;
            } else if (depth == 0 && (c == ':' || c == '}')) {
                exprEnd = i;
                if (c == ':') specStart = i + 1;
                break;
            }
        }
        if (exprEnd < 0) {
            throw new ParsingError("Unterminated replacement field in f-string", position);
        }
        String exprText = content.substring(start, exprEnd);
        if (exprText.isBlank()) {
            throw new ParsingError("Empty expression in f-string", position);
        }
        if (conversion != null && !"rsa".contains(conversion)) {
            throw new ParsingError("Invalid f-string conversion '!" + conversion + "'", position);
        }
        SyntaxNode value = parser.parseExpression(exprText, fileName, position.line());

        SyntaxNode spec = SyntaxNode.empty(position);
        int end;
        if (specStart >= 0) {
            int specEnd = findSpecEnd(content, specStart, position);
            String specText = content.substring(specStart, specEnd);
            List<SyntaxNode> specParts = parse(specText, position);
            spec = SyntaxNode.of(NodeKind.FSTRING, null, position, mergeLiterals(specParts));
            end = specEnd;
        } else {
            end = conversion != null ? i : exprEnd;
        }
        if (end >= content.length() || content.charAt(end) != '}') {
            throw new ParsingError("Expected '}' in f-string", position);
        }
        parts.add(SyntaxNode.of(NodeKind.FORMATTED_VALUE, conversion, position, value, spec));
        return end + 1;
    }

    private static int findSpecEnd(String content, int start, SourcePosition position) {
        int depth = 0;
        for (int i = start; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) return i;
                depth--;
            }
        }
        throw new ParsingError("Unterminated format spec in f-string", position);
    }

    private static void flush(StringBuilder literal, List<SyntaxNode> parts, SourcePosition position) {
        if (literal.length() > 0) {
            parts.add(SyntaxNode.of(NodeKind.STRING, literal.toString(), position));
            literal.setLength(0);
        }
    }

    /**
     * Joins consecutive STRING parts into one.
     */
    static List<SyntaxNode> mergeLiterals(List<SyntaxNode> parts) {
        List<SyntaxNode> merged = new ArrayList<>();
        StringBuilder pending = null;
        SourcePosition pendingPos = null;
        for (SyntaxNode part : parts) {
            if (part.is(NodeKind.STRING)) {
                if (pending == null) {
                    pending = new StringBuilder();
                    pendingPos = part.position();
                }
                pending.append(part.text());
            } else {
                if (pending != null) {
                    merged.add(SyntaxNode.of(NodeKind.STRING, pending.toString(), pendingPos));
                    pending = null;
                }
                merged.add(part);
            }
        }
        if (pending != null) {
            merged.add(SyntaxNode.of(NodeKind.STRING, pending.toString(), pendingPos));
        }
        return merged;
    }
}
