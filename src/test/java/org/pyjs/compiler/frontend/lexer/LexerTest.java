package org.pyjs.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pyjs.compiler.diagnostics.ParsingError;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LexerTest {

    private static List<TokenType> types(String source) {
        return new Lexer(source, "test.py").scanTokens().stream().map(Token::type).toList();
    }

    @Test
    @Tag("unit")
    void scansAssignmentWithPositions() {
        List<Token> tokens = new Lexer("count = 42\n", "test.py").scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.NAME, TokenType.OPERATOR, TokenType.NUMBER, TokenType.NEWLINE, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).text()).isEqualTo("count");
        assertThat(tokens.get(2).text()).isEqualTo("42");
        assertThat(tokens.get(2).line()).isEqualTo(1);
        assertThat(tokens.get(2).column()).isEqualTo(9);
        assertThat(tokens.get(2).fileName()).isEqualTo("test.py");
    }

    @Test
    @Tag("unit")
    void emitsIndentAndDedentForBlocks() {
        assertThat(types("if x:\n    y = 1\nz = 2\n")).containsExactly(
                TokenType.KEYWORD, TokenType.NAME, TokenType.OPERATOR, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.NAME, TokenType.OPERATOR, TokenType.NUMBER, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.NAME, TokenType.OPERATOR, TokenType.NUMBER, TokenType.NEWLINE,
                TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void closesOpenBlocksAtEndOfInput() {
        assertThat(types("def f():\n    return 1")).endsWith(
                TokenType.NEWLINE, TokenType.DEDENT, TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void ignoresNewlinesInsideBrackets() {
        assertThat(types("xs = [1,\n      2]\n")).containsOnlyOnce(TokenType.NEWLINE).doesNotContain(TokenType.INDENT);
    }

    @Test
    @Tag("unit")
    void skipsBlankAndCommentLines() {
        assertThat(types("a = 1\n\n   # note\nb = 2\n")).doesNotContain(TokenType.INDENT, TokenType.DEDENT);
    }

    @Test
    @Tag("unit")
    void decodesStringEscapesAndPrefixes() {
        List<Token> tokens = new Lexer("'a\\tb' r'\\n' f\"{x}\" b'z'\n", "test.py").scanTokens();

        assertThat(tokens.get(0).value()).isEqualTo(new StringLiteral("a\tb", false, false));
        assertThat(tokens.get(1).value()).isEqualTo(new StringLiteral("\\n", false, false));
        assertThat(tokens.get(2).value()).isEqualTo(new StringLiteral("{x}", true, false));
        assertThat(tokens.get(3).value()).isEqualTo(new StringLiteral("z", false, true));
    }

    @Test
    @Tag("unit")
    void tripleQuotedStringsSpanLines() {
        List<Token> tokens = new Lexer("s = \"\"\"one\ntwo\"\"\"\nt = 1\n", "test.py").scanTokens();

        assertThat(((StringLiteral) tokens.get(2).value()).content()).isEqualTo("one\ntwo");
        assertThat(tokens.get(4).text()).isEqualTo("t");
        assertThat(tokens.get(4).line()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void distinguishesKeywordsFromNames() {
        List<Token> tokens = new Lexer("lambda_ = lambda: None\n", "test.py").scanTokens();

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.NAME);
        assertThat(tokens.get(2).isKeyword("lambda")).isTrue();
        assertThat(tokens.get(4).isKeyword("None")).isTrue();
    }

    @Test
    @Tag("unit")
    void prefersLongestOperator() {
        List<Token> tokens = new Lexer("a //= b ** 2\n", "test.py").scanTokens();

        assertThat(tokens.get(1).isOperator("//=")).isTrue();
        assertThat(tokens.get(3).isOperator("**")).isTrue();
    }

    @Test
    @Tag("unit")
    void rejectsUnterminatedString() {
        assertThatThrownBy(() -> new Lexer("x = 'open\n", "bad.py").scanTokens())
                .isInstanceOf(ParsingError.class)
                .hasMessageContaining("Unterminated");
    }

    @Test
    @Tag("unit")
    void rejectsInconsistentDedent() {
        assertThatThrownBy(() -> new Lexer("if x:\n        a = 1\n    b = 2\n", "bad.py").scanTokens())
                .isInstanceOf(ParsingError.class)
                .satisfies(e -> assertThat(((ParsingError) e).getPosition().line()).isEqualTo(3));
    }

    @Test
    @Tag("unit")
    void rejectsUnmatchedClosingBracket() {
        assertThatThrownBy(() -> new Lexer("x = 1)\n", "bad.py").scanTokens())
                .isInstanceOf(ParsingError.class)
                .hasMessageContaining("Unmatched");
    }
}
