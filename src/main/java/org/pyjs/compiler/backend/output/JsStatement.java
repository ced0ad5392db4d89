package org.pyjs.compiler.backend.output;

import java.util.List;

/**
 * One statement of generated code, before indentation is applied.
 *
 * <p>A {@link Kind#SIMPLE} statement is an expression or declaration that the assembler
 * terminates with {@code ;}. A {@link Kind#COMMENT} is emitted verbatim. A
 * {@link Kind#COMPOUND} statement renders as {@code header {}, its indented body and
 * {@code }}, or as a bare block when the header is empty; a continuation clause such as {@code else} or {@code catch (e)} is chained
 * through {@link #continuation()} and renders as <code>} else {</code>.</p>
 *
 * @param kind         The statement shape.
 * @param code         The statement text, or the header of a compound statement.
 * @param body         The nested statements of a compound statement; empty otherwise.
 * @param continuation The next clause of a compound statement, or null.
 */
public record JsStatement(Kind kind, String code, List<JsStatement> body, JsStatement continuation) {

    public enum Kind {
        SIMPLE,
        COMMENT,
        COMPOUND
    }

    public JsStatement {
        body = List.copyOf(body);
    }

    public static JsStatement of(String code) {
        return new JsStatement(Kind.SIMPLE, code, List.of(), null);
    }

    public static JsStatement comment(String text) {
        return new JsStatement(Kind.COMMENT, "// " + text, List.of(), null);
    }

    /**
     * @param header The text before the opening brace, e.g. {@code if (x)} or {@code try}.
     * @param body   The statements inside the braces.
     * @return A compound statement without continuation.
     */
    public static JsStatement block(String header, List<JsStatement> body) {
        return new JsStatement(Kind.COMPOUND, header, body, null);
    }

    /**
     * @param body The statements inside the braces.
     * @return A block statement with no header.
     */
    public static JsStatement bareBlock(List<JsStatement> body) {
        return block("", body);
    }

    /**
     * Appends a clause at the end of this statement's continuation chain.
     * @param header The clause header, e.g. {@code else} or {@code finally}.
     * @param clauseBody The clause statements.
     * @return A new statement with the clause appended.
     */
    public JsStatement then(String header, List<JsStatement> clauseBody) {
        JsStatement clause = continuation == null
                ? block(header, clauseBody)
                : continuation.then(header, clauseBody);
        return new JsStatement(kind, code, body, clause);
    }
}
