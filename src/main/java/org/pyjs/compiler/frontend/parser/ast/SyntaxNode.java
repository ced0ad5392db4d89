package org.pyjs.compiler.frontend.parser.ast;

import org.pyjs.compiler.diagnostics.InternalInvariantError;
import org.pyjs.compiler.diagnostics.SourcePosition;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A node of the generic syntax tree produced by the upstream parser.
 *
 * <p>Nodes are immutable. Identity matters: analysis results are keyed by node identity,
 * so equal-looking nodes at different positions remain distinct.</p>
 */
public final class SyntaxNode {

    private final NodeKind kind;
    private final Object value;
    private final List<SyntaxNode> children;
    private final SourcePosition position;

    private SyntaxNode(NodeKind kind, Object value, List<SyntaxNode> children, SourcePosition position) {
        this.kind = kind;
        this.value = value;
        this.children = children;
        this.position = position == null ? SourcePosition.UNKNOWN : position;
    }

    /**
     * Creates a node.
     * @param kind     The node kind.
     * @param value    The payload: a String, a List of Strings, or null.
     * @param position The source position.
     * @param children The children; must not contain null (use {@link #empty(SourcePosition)}).
     * @return The node.
     */
    public static SyntaxNode of(NodeKind kind, Object value, SourcePosition position, List<SyntaxNode> children) {
        for (SyntaxNode child : children) {
            if (child == null) {
                throw new InternalInvariantError("Null child in " + kind + " node", position);
            }
        }
        if (value instanceof List<?> list) {
            value = List.copyOf(list);
        }
        return new SyntaxNode(kind, value, List.copyOf(children), position);
    }

    public static SyntaxNode of(NodeKind kind, Object value, SourcePosition position, SyntaxNode... children) {
        return of(kind, value, position, Arrays.asList(children));
    }

    public static SyntaxNode of(NodeKind kind, SourcePosition position, SyntaxNode... children) {
        return of(kind, null, position, children);
    }

    public static SyntaxNode empty(SourcePosition position) {
        return new SyntaxNode(NodeKind.EMPTY, null, List.of(), position);
    }

    public NodeKind kind() {
        return kind;
    }

    public Object value() {
        return value;
    }

    /**
     * @return The payload as text (names, literals, operators), or null.
     */
    public String text() {
        return value == null ? null : value.toString();
    }

    /**
     * @return The payload as a list of strings (GLOBAL, NONLOCAL, COMPARE, IMPORT).
     */
    @SuppressWarnings("unchecked")
    public List<String> names() {
        if (value instanceof List<?>) {
            return (List<String>) value;
        }
        throw new InternalInvariantError(kind + " node has no list payload", position);
    }

    public List<SyntaxNode> children() {
        return children;
    }

    public SyntaxNode child(int index) {
        if (index < 0 || index >= children.size()) {
            throw new InternalInvariantError(
                    kind + " node has no child " + index + " (has " + children.size() + ")", position);
        }
        return children.get(index);
    }

    public int childCount() {
        return children.size();
    }

    public boolean is(NodeKind k) {
        return kind == k;
    }

    public boolean isEmpty() {
        return kind == NodeKind.EMPTY;
    }

    public SourcePosition position() {
        return position;
    }

    /**
     * @return The COMP_FOR clauses of a comprehension node.
     */
    public List<SyntaxNode> comprehensionClauses() {
        return children.subList(comprehensionElementCount(), children.size());
    }

    /**
     * @return The element expressions of a comprehension node; key and value for DICT_COMP.
     */
    public List<SyntaxNode> comprehensionElements() {
        return children.subList(0, comprehensionElementCount());
    }

    private int comprehensionElementCount() {
        return switch (kind) {
            case LIST_COMP, SET_COMP, GENERATOR_EXP -> 1;
            case DICT_COMP -> 2;
            default -> throw new InternalInvariantError(kind + " node is not a comprehension", position);
        };
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(").append(kind);
        if (value != null) {
            sb.append(' ').append(value instanceof String s ? '\'' + s + '\'' : value);
        }
        if (!children.isEmpty()) {
            sb.append(' ').append(children.stream().map(SyntaxNode::toString).collect(Collectors.joining(" ")));
        }
        return sb.append(')').toString();
    }
}
