package org.pyjs.compiler.frontend.parser;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pyjs.compiler.diagnostics.ParsingError;
import org.pyjs.compiler.frontend.parser.ast.NodeKind;
import org.pyjs.compiler.frontend.parser.ast.SyntaxNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PythonParserTest {

    private final PythonParser parser = new PythonParser();

    private SyntaxNode parseSingle(String source) {
        SyntaxNode module = parser.parse(source, "test.py");
        assertThat(module.kind()).isEqualTo(NodeKind.MODULE);
        assertThat(module.childCount()).isEqualTo(1);
        return module.child(0);
    }

    @Test
    @Tag("unit")
    void parsesChainedAssignmentWithTargetsBeforeValue() {
        SyntaxNode assign = parseSingle("a = b = 1\n");

        assertThat(assign.kind()).isEqualTo(NodeKind.ASSIGN);
        assertThat(assign.children()).extracting(SyntaxNode::kind)
                .containsExactly(NodeKind.NAME, NodeKind.NAME, NodeKind.NUMBER);
        assertThat(assign.child(2).text()).isEqualTo("1");
    }

    @Test
    @Tag("unit")
    void respectsOperatorPrecedence() {
        SyntaxNode expr = parseSingle("1 + 2 * 3 ** 2\n").child(0);

        assertThat(expr.kind()).isEqualTo(NodeKind.BINARY_OP);
        assertThat(expr.text()).isEqualTo("+");
        assertThat(expr.child(1).text()).isEqualTo("*");
        assertThat(expr.child(1).child(1).text()).isEqualTo("**");
    }

    @Test
    @Tag("unit")
    void keepsComparisonChainsFlat() {
        SyntaxNode compare = parseSingle("a < b <= c not in d\n").child(0);

        assertThat(compare.kind()).isEqualTo(NodeKind.COMPARE);
        assertThat(compare.names()).containsExactly("<", "<=", "not in");
        assertThat(compare.childCount()).isEqualTo(4);
    }

    @Test
    @Tag("unit")
    void nestsElifAsIfInsideElseBlock() {
        SyntaxNode node = parseSingle("""
                if a:
                    x = 1
                elif b:
                    x = 2
                else:
                    x = 3
                """);

        assertThat(node.kind()).isEqualTo(NodeKind.IF);
        SyntaxNode orelse = node.child(2);
        assertThat(orelse.kind()).isEqualTo(NodeKind.BLOCK);
        assertThat(orelse.child(0).kind()).isEqualTo(NodeKind.IF);
        assertThat(orelse.child(0).child(2).kind()).isEqualTo(NodeKind.BLOCK);
    }

    @Test
    @Tag("unit")
    void parsesParameterKinds() {
        SyntaxNode def = parseSingle("""
                @decorate
                def f(a, b=2, *rest, key=None, **extra) -> int:
                    return a
                """);

        assertThat(def.kind()).isEqualTo(NodeKind.FUNCTION_DEF);
        assertThat(def.text()).isEqualTo("f");
        SyntaxNode params = def.child(0);
        assertThat(params.children()).extracting(SyntaxNode::kind).containsExactly(
                NodeKind.PARAM, NodeKind.PARAM, NodeKind.VARARGS_PARAM, NodeKind.KWONLY_PARAM, NodeKind.KWARGS_PARAM);
        assertThat(params.child(0).child(0).isEmpty()).isTrue();
        assertThat(params.child(1).child(0).text()).isEqualTo("2");
        assertThat(params.child(3).child(0).kind()).isEqualTo(NodeKind.CONSTANT);
        assertThat(def.child(2).kind()).isEqualTo(NodeKind.DECORATORS);
        assertThat(def.child(2).child(0).text()).isEqualTo("decorate");
    }

    @Test
    @Tag("unit")
    void parsesClassWithBases() {
        SyntaxNode cls = parseSingle("""
                class Dog(Animal, Mixin):
                    sound = "woof"
                """);

        assertThat(cls.kind()).isEqualTo(NodeKind.CLASS_DEF);
        assertThat(cls.child(0).kind()).isEqualTo(NodeKind.ARGUMENTS);
        assertThat(cls.child(0).children()).extracting(SyntaxNode::text).containsExactly("Animal", "Mixin");
    }

    @Test
    @Tag("unit")
    void parsesCallArgumentKinds() {
        SyntaxNode call = parseSingle("f(1, *xs, key=2, **kw)\n").child(0);

        assertThat(call.kind()).isEqualTo(NodeKind.CALL);
        assertThat(call.children()).extracting(SyntaxNode::kind).containsExactly(
                NodeKind.NAME, NodeKind.NUMBER, NodeKind.STARRED, NodeKind.KEYWORD, NodeKind.DOUBLE_STARRED);
        assertThat(call.child(3).text()).isEqualTo("key");
    }

    @Test
    @Tag("unit")
    void parsesComprehensionClauses() {
        SyntaxNode comp = parseSingle("{k: v for k in ks if k for v in vs}\n").child(0);

        assertThat(comp.kind()).isEqualTo(NodeKind.DICT_COMP);
        assertThat(comp.comprehensionElements()).hasSize(2);
        List<SyntaxNode> clauses = comp.comprehensionClauses();
        assertThat(clauses).hasSize(2).allMatch(c -> c.is(NodeKind.COMP_FOR));
        assertThat(clauses.get(0).childCount()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void parsesBareGeneratorArgument() {
        SyntaxNode call = parseSingle("sum(x for x in xs)\n").child(0);

        assertThat(call.child(1).kind()).isEqualTo(NodeKind.GENERATOR_EXP);
    }

    @Test
    @Tag("unit")
    void concatenatesAdjacentStrings() {
        SyntaxNode string = parseSingle("'ab' \"cd\"\n").child(0);

        assertThat(string.kind()).isEqualTo(NodeKind.STRING);
        assertThat(string.text()).isEqualTo("abcd");
    }

    @Test
    @Tag("unit")
    void splitsFormattedStrings() {
        SyntaxNode fstring = parseSingle("f'x={x!r:>5} done'\n").child(0);

        assertThat(fstring.kind()).isEqualTo(NodeKind.FSTRING);
        assertThat(fstring.children()).extracting(SyntaxNode::kind)
                .containsExactly(NodeKind.STRING, NodeKind.FORMATTED_VALUE, NodeKind.STRING);
        SyntaxNode field = fstring.child(1);
        assertThat(field.text()).isEqualTo("r");
        assertThat(field.child(0).text()).isEqualTo("x");
        assertThat(field.child(1).kind()).isEqualTo(NodeKind.FSTRING);
    }

    @Test
    @Tag("unit")
    void parsesTryWithHandlers() {
        SyntaxNode node = parseSingle("""
                try:
                    pass
                except ValueError as e:
                    pass
                finally:
                    pass
                """);

        assertThat(node.kind()).isEqualTo(NodeKind.TRY);
        SyntaxNode handler = node.children().stream().filter(c -> c.is(NodeKind.EXCEPT_HANDLER)).findFirst()
                .orElseThrow();
        assertThat(handler.text()).isEqualTo("e");
        assertThat(handler.child(0).text()).isEqualTo("ValueError");
    }

    @Test
    @Tag("unit")
    void reportsPositionOfUnexpectedToken() {
        assertThatThrownBy(() -> parser.parse("x = 1\ny = )\n", "bad.py"))
                .isInstanceOf(ParsingError.class)
                .satisfies(e -> assertThat(((ParsingError) e).getPosition().line()).isEqualTo(2));
    }

    @Test
    @Tag("unit")
    void rejectsDuplicateParameters() {
        assertThatThrownBy(() -> parser.parse("def f(a, a):\n    pass\n", "bad.py"))
                .isInstanceOf(ParsingError.class)
                .hasMessageContaining("Duplicate parameter 'a'");
    }

    @Test
    @Tag("unit")
    void rejectsNonDefaultAfterDefault() {
        assertThatThrownBy(() -> parser.parse("def f(a=1, b):\n    pass\n", "bad.py"))
                .isInstanceOf(ParsingError.class);
    }

    @Test
    @Tag("unit")
    void rejectsBytesLiterals() {
        assertThatThrownBy(() -> parser.parse("x = b'raw'\n", "bad.py"))
                .isInstanceOf(ParsingError.class)
                .hasMessageContaining("Bytes");
    }
}
