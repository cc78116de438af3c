package com.ciro.jreactive.lens.ast;

public interface JsxNode {
    NodeType type();
    int line();
    void renderRaw(StringBuilder sb); // reconstrucción aproximada en JSX

    default String toRaw() {
        StringBuilder sb = new StringBuilder();
        renderRaw(sb);
        return sb.toString();
    }
}
