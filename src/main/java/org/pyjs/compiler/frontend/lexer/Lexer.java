package org.pyjs.compiler.frontend.lexer;

import org.pyjs.compiler.diagnostics.ParsingError;
import org.pyjs.compiler.diagnostics.SourcePosition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Converts Python source text into tokens, including the INDENT/DEDENT/NEWLINE structure
 * derived from line indentation. Newlines inside brackets and after a backslash are joined.
 */
public class Lexer {

    /** Reserved words of the source language. */
    public static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    private static final String[] OPERATORS = {
            "**=", "//=", ">>=", "<<=", "...",
            "->", ":=", "**", "//", "<<", ">>", "<=", ">=", "==", "!=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "="
    };

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "f", "br", "rb", "fr", "rf");

    private static final int TAB_SIZE = 8;

    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();

    private int pos = 0;
    private int line = 1;
    private int lineStart = 0;
    private int bracketDepth = 0;
    private boolean atLineStart = true;

    /**
     * Creates a lexer for the given source.
     * @param source   The source text.
     * @param fileName The file name used in token positions.
     */
    public Lexer(String source, String fileName) {
        this.source = source.replace("\r\n", "\n").replace('\r', '\n');
        this.fileName = fileName;
        this.indents.push(0);
    }

    /**
     * Scans the whole source.
     * @return The token list, terminated by END_OF_FILE.
     * @throws ParsingError on malformed input.
     */
    public List<Token> scanTokens() {
        while (pos < source.length()) {
            if (atLineStart && bracketDepth == 0) {
                if (handleIndentation()) {
                    continue;
                }
            }
            scanToken();
        }
        if (!tokens.isEmpty() && last().type() != TokenType.NEWLINE
                && last().type() != TokenType.DEDENT && last().type() != TokenType.INDENT) {
            add(TokenType.NEWLINE, "", null, column());
        }
        while (indents.peek() > 0) {
            indents.pop();
            add(TokenType.DEDENT, "", null, column());
        }
        add(TokenType.END_OF_FILE, "", null, column());
        return tokens;
    }

    /**
     * Measures the indentation of a new logical line and emits INDENT/DEDENT tokens.
     * @return true if the whole line was blank or a comment and has been consumed.
     */
    private boolean handleIndentation() {
        int width = 0;
        int p = pos;
        while (p < source.length()) {
            char c = source.charAt(p);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            p++;
        }
        if (p >= source.length() || source.charAt(p) == '\n' || source.charAt(p) == '#') {
            // blank or comment-only line
            while (p < source.length() && source.charAt(p) != '\n') p++;
            if (p < source.length()) {
                p++;
                newLine(p);
            }
            pos = p;
            return true;
        }
        pos = p;
        atLineStart = false;
        int current = indents.peek();
        if (width > current) {
            indents.push(width);
            add(TokenType.INDENT, "", null, 1);
        } else if (width < current) {
            while (indents.peek() > width) {
                indents.pop();
                add(TokenType.DEDENT, "", null, column());
            }
            if (indents.peek() != width) {
                throw error("Unindent does not match any outer indentation level", column());
            }
        }
        return false;
    }

    private void scanToken() {
        char c = source.charAt(pos);
        int col = column();
        switch (c) {
            case ' ', '\t', '\f' -> pos++;
            case '#' -> {
                while (pos < source.length() && source.charAt(pos) != '\n') pos++;
            }
            case '\\' -> {
                if (pos + 1 < source.length() && source.charAt(pos + 1) == '\n') {
                    pos += 2;
                    newLine(pos);
                } else {
                    throw error("Unexpected character after line continuation", col);
                }
            }
            case '\n' -> {
                pos++;
                if (bracketDepth == 0) {
                    add(TokenType.NEWLINE, "\\n", null, col);
                    atLineStart = true;
                }
                newLine(pos);
            }
            case '\'', '"' -> scanString("", col);
            default -> {
                if (isIdentifierStart(c)) {
                    scanIdentifier(col);
                } else if (Character.isDigit(c)
                        || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
                    scanNumber(col);
                } else {
                    scanOperator(col);
                }
            }
        }
    }

    private void scanIdentifier(int col) {
        int start = pos;
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) pos++;
        String text = source.substring(start, pos);
        if (pos < source.length() && (source.charAt(pos) == '\'' || source.charAt(pos) == '"')
                && STRING_PREFIXES.contains(text.toLowerCase(Locale.ROOT))) {
            scanString(text.toLowerCase(Locale.ROOT), col);
            return;
        }
        add(KEYWORDS.contains(text) ? TokenType.KEYWORD : TokenType.NAME, text, null, col);
    }

    private void scanNumber(int col) {
        int start = pos;
        if (source.charAt(pos) == '0' && pos + 1 < source.length()
                && "xXoObB".indexOf(source.charAt(pos + 1)) >= 0) {
            pos += 2;
            while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
        } else {
            consumeDigits();
            if (pos < source.length() && source.charAt(pos) == '.') {
                pos++;
                consumeDigits();
            }
            if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                int save = pos;
                pos++;
                if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) pos++;
                if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    consumeDigits();
                } else {
                    pos = save;
                }
            }
            if (pos < source.length() && (source.charAt(pos) == 'j' || source.charAt(pos) == 'J')) {
                pos++;
            }
        }
        add(TokenType.NUMBER, source.substring(start, pos), null, col);
    }

    private void consumeDigits() {
        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
    }

    private void scanString(String prefix, int col) {
        int start = pos - prefix.length();
        char quote = source.charAt(pos);
        boolean triple = source.startsWith(String.valueOf(quote).repeat(3), pos);
        String delimiter = triple ? String.valueOf(quote).repeat(3) : String.valueOf(quote);
        pos += delimiter.length();
        int startLine = line;
        StringBuilder raw = new StringBuilder();
        while (true) {
            if (pos >= source.length()) {
                throw new ParsingError("Unterminated string literal", new SourcePosition(fileName, startLine, col));
            }
            if (source.startsWith(delimiter, pos)) {
                pos += delimiter.length();
                break;
            }
            char c = source.charAt(pos);
            if (c == '\n') {
                if (!triple) {
                    throw new ParsingError("Unterminated string literal", new SourcePosition(fileName, startLine, col));
                }
                raw.append(c);
                pos++;
                newLine(pos);
                continue;
            }
            if (c == '\\' && pos + 1 < source.length()) {
                raw.append(c).append(source.charAt(pos + 1));
                if (source.charAt(pos + 1) == '\n') {
                    pos += 2;
                    newLine(pos);
                } else {
                    pos += 2;
                }
                continue;
            }
            raw.append(c);
            pos++;
        }
        boolean isRaw = prefix.contains("r");
        String content = isRaw ? raw.toString() : decodeEscapes(raw.toString(), startLine, col);
        StringLiteral literal = new StringLiteral(content, prefix.contains("f"), prefix.contains("b"));
        Token token = new Token(TokenType.STRING, source.substring(start, pos), literal, startLine, col, fileName);
        tokens.add(token);
    }

    private String decodeEscapes(String raw, int startLine, int col) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c != '\\' || i + 1 >= raw.length()) {
                sb.append(c);
                continue;
            }
            char n = raw.charAt(++i);
            switch (n) {
                case '\n' -> { }
                case '\\' -> sb.append('\\');
                case '\'' -> sb.append('\'');
                case '"' -> sb.append('"');
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'v' -> sb.append('\u000B');
                case 'a' -> sb.append('\u0007');
                case '0', '1', '2', '3', '4', '5', '6', '7' -> {
                    int end = i;
                    while (end < raw.length() && end < i + 3 && raw.charAt(end) >= '0' && raw.charAt(end) <= '7') end++;
                    sb.append((char) Integer.parseInt(raw.substring(i, end), 8));
                    i = end - 1;
                }
                case 'x' -> i = appendHex(raw, i, 2, sb, startLine, col);
                case 'u' -> i = appendHex(raw, i, 4, sb, startLine, col);
                case 'U' -> i = appendHex(raw, i, 8, sb, startLine, col);
                default -> sb.append('\\').append(n);
            }
        }
        return sb.toString();
    }

    private int appendHex(String raw, int i, int digits, StringBuilder sb, int startLine, int col) {
        if (i + 1 + digits > raw.length()) {
            throw new ParsingError("Truncated \\" + raw.charAt(i) + " escape", new SourcePosition(fileName, startLine, col));
        }
        String hex = raw.substring(i + 1, i + 1 + digits);
        try {
            sb.appendCodePoint(Integer.parseInt(hex, 16));
        } catch (IllegalArgumentException e) {
            throw new ParsingError("Invalid \\" + raw.charAt(i) + " escape: " + hex, new SourcePosition(fileName, startLine, col));
        }
        return i + digits;
    }

    private void scanOperator(int col) {
        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                pos += op.length();
                switch (op) {
                    case "(", "[", "{" -> bracketDepth++;
                    case ")", "]", "}" -> {
                        if (bracketDepth == 0) {
                            throw error("Unmatched '" + op + "'", col);
                        }
                        bracketDepth--;
                    }
                    default -> { }
                }
                add(TokenType.OPERATOR, op, null, col);
                return;
            }
        }
        throw error("Unexpected character '" + source.charAt(pos) + "'", col);
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    private void newLine(int nextLineStart) {
        line++;
        lineStart = nextLineStart;
    }

    private int column() {
        return pos - lineStart + 1;
    }

    private Token last() {
        return tokens.get(tokens.size() - 1);
    }

    private void add(TokenType type, String text, Object value, int col) {
        tokens.add(new Token(type, text, value, line, col, fileName));
    }

    private ParsingError error(String message, int col) {
        return new ParsingError(message, new SourcePosition(fileName, line, col));
    }
}
