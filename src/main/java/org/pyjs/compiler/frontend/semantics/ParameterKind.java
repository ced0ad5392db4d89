package org.pyjs.compiler.frontend.semantics;

public enum ParameterKind {
    POSITIONAL,
    VARARGS,
    KEYWORD_ONLY,
    KWARGS
}
