package org.pyjs.compiler.frontend.parser.ast;

/**
 * The closed set of syntax node kinds of the supported Python subset.
 *
 * <p>Each constant documents its payload and child layout. Optional children are always
 * present in their slot and use {@link #EMPTY} when omitted, so positions are stable.
 * Translators switch over this enum with exhaustive switch expressions; adding a kind
 * breaks the build until every translator handles it.</p>
 */
public enum NodeKind {

    // --- structure ---

    /** Children: top-level statements. */
    MODULE,
    /** Children: statements of a suite. */
    BLOCK,
    /** Placeholder for an omitted optional child. */
    EMPTY,

    // --- statements ---

    /** Children: [expression]. */
    EXPR_STMT,
    /** Children: [target1, ..., targetN, value]. */
    ASSIGN,
    /** Payload: operator without '=' (e.g. "+"). Children: [target, value]. */
    AUG_ASSIGN,
    /** Children: [target, annotation, value | EMPTY]. */
    ANN_ASSIGN,
    /** Children: targets. */
    DELETE,
    PASS,
    BREAK,
    CONTINUE,
    /** Children: [value | EMPTY]. */
    RETURN,
    /** Children: [exception | EMPTY, cause | EMPTY]. */
    RAISE,
    /** Payload: list of names. */
    GLOBAL,
    /** Payload: list of names. */
    NONLOCAL,
    /** Children: [test, message | EMPTY]. */
    ASSERT,
    /** Children: [test, BLOCK body, BLOCK orelse | EMPTY]. An elif is an IF inside orelse. */
    IF,
    /** Children: [test, BLOCK body, BLOCK orelse | EMPTY]. */
    WHILE,
    /** Children: [target, iterable, BLOCK body, BLOCK orelse | EMPTY]. */
    FOR,
    /** Same layout as {@link #FOR}. */
    ASYNC_FOR,
    /** Children: [BLOCK body, EXCEPT_HANDLER..., BLOCK orelse | EMPTY, BLOCK finally | EMPTY]. */
    TRY,
    /** Payload: bound name or null. Children: [type | EMPTY, BLOCK body]. */
    EXCEPT_HANDLER,
    /** Children: [WITH_ITEM..., BLOCK body]. */
    WITH,
    /** Same layout as {@link #WITH}. */
    ASYNC_WITH,
    /** Children: [context manager, target | EMPTY]. */
    WITH_ITEM,
    /** Payload: name. Children: [PARAMETERS, BLOCK body, DECORATORS]. */
    FUNCTION_DEF,
    /** Same layout as {@link #FUNCTION_DEF}. */
    ASYNC_FUNCTION_DEF,
    /** Payload: name. Children: [ARGUMENTS bases, BLOCK body, DECORATORS]. */
    CLASS_DEF,
    /** Children: decorator expressions, outermost first. */
    DECORATORS,
    /** Payload: list of imported module/member names as written. */
    IMPORT,

    // --- parameters and arguments ---

    /** Children: PARAM, VARARGS_PARAM, KWONLY_PARAM, KWARGS_PARAM in declaration order. */
    PARAMETERS,
    /** Payload: name. Children: [default | EMPTY]. */
    PARAM,
    /** Payload: name ({@code *args}). */
    VARARGS_PARAM,
    /** Payload: name. Children: [default | EMPTY]. */
    KWONLY_PARAM,
    /** Payload: name ({@code **kwargs}). */
    KWARGS_PARAM,
    /** Children: call-style arguments (expressions, STARRED, KEYWORD, DOUBLE_STARRED). */
    ARGUMENTS,
    /** Payload: keyword name. Children: [value]. */
    KEYWORD,
    /** Children: [value]. */
    STARRED,
    /** Children: [value]. */
    DOUBLE_STARRED,

    // --- expressions ---

    /** Payload: identifier. */
    NAME,
    /** Payload: literal text as written. */
    NUMBER,
    /** Payload: decoded string value. */
    STRING,
    /** Children: STRING and FORMATTED_VALUE parts. */
    FSTRING,
    /** Payload: conversion ("r", "s", "a") or null. Children: [value, FSTRING spec | EMPTY]. */
    FORMATTED_VALUE,
    /** Payload: "True", "False" or "None". */
    CONSTANT,
    /** Payload: attribute name. Children: [object]. */
    ATTRIBUTE,
    /** Children: [object, index]. The index may be a SLICE. */
    SUBSCRIPT,
    /** Children: [lower | EMPTY, upper | EMPTY, step | EMPTY]. */
    SLICE,
    /** Children: [callee, arguments...]. */
    CALL,
    /** Payload: operator. Children: [left, right]. */
    BINARY_OP,
    /** Payload: "not", "-", "+" or "~". Children: [operand]. */
    UNARY_OP,
    /** Payload: "and" or "or". Children: two or more operands. */
    BOOL_OP,
    /** Payload: list of operators. Children: operands (one more than operators). */
    COMPARE,
    /** Children: [test, body, orelse]. */
    IF_EXP,
    /** Children: [PARAMETERS, body expression]. */
    LAMBDA,
    /** Children: elements. */
    LIST,
    /** Children: elements. */
    TUPLE,
    /** Children: elements. */
    SET,
    /** Children: alternating keys and values. */
    DICT,
    /** Children: [element, COMP_FOR...]. */
    LIST_COMP,
    /** Children: [element, COMP_FOR...]. */
    SET_COMP,
    /** Children: [key, value, COMP_FOR...]. */
    DICT_COMP,
    /** Children: [element, COMP_FOR...]. */
    GENERATOR_EXP,
    /** Children: [target, iterable, conditions...]. */
    COMP_FOR,
    /** Children: [value | EMPTY]. */
    YIELD,
    /** Children: [value]. */
    YIELD_FROM,
    /** Children: [value]. */
    AWAIT
}
