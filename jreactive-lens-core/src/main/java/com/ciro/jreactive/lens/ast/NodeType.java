package com.ciro.jreactive.lens.ast;

public enum NodeType {
    COMPONENT,
    ELEMENT,
    TEXT,
    EXPRESSION,
    FRAGMENT,
    ITERATION,
    GUARD,
    TERNARY,
    IMPORT
}
