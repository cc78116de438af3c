package com.ciro.jreactive.lens.ast;

/**
 * Contenido de {@code {...}} que no encaja en ninguna forma conocida (map, &&, ternario).
 * Se conserva tal cual; no es un error.
 */
public class ExpressionNode implements JsxNode {
    public final String raw;
    public final int line;
    public final int column;

    public ExpressionNode(String raw, int line, int column) {
        this.raw = raw;
        this.line = line;
        this.column = column;
    }

    @Override public NodeType type() { return NodeType.EXPRESSION; }
    @Override public int line() { return line; }

    @Override
    public void renderRaw(StringBuilder sb) {
        sb.append("{").append(raw).append("}");
    }
}
