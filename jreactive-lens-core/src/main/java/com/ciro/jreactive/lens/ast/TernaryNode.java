package com.ciro.jreactive.lens.ast;

/** {@code {cond ? <A/> : <B/>}}. */
public class TernaryNode implements JsxNode {
    public final String condition;
    public final JsxNode consequent;
    public final JsxNode alternate;
    public final int line;

    public TernaryNode(String condition, JsxNode consequent, JsxNode alternate, int line) {
        this.condition = condition;
        this.consequent = consequent;
        this.alternate = alternate;
        this.line = line;
    }

    @Override public NodeType type() { return NodeType.TERNARY; }
    @Override public int line() { return line; }

    @Override
    public void renderRaw(StringBuilder sb) {
        sb.append("{").append(condition).append(" ? ");
        if (consequent != null) consequent.renderRaw(sb);
        sb.append(" : ");
        if (alternate != null) alternate.renderRaw(sb);
        sb.append("}");
    }
}
