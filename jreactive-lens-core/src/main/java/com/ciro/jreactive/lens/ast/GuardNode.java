package com.ciro.jreactive.lens.ast;

/** Render condicional {@code {cond && <X/>}}. */
public class GuardNode implements JsxNode {
    public final String condition;
    public final JsxNode consequent;
    public final int line;

    public GuardNode(String condition, JsxNode consequent, int line) {
        this.condition = condition;
        this.consequent = consequent;
        this.line = line;
    }

    @Override public NodeType type() { return NodeType.GUARD; }
    @Override public int line() { return line; }

    @Override
    public void renderRaw(StringBuilder sb) {
        sb.append("{").append(condition).append(" && ");
        if (consequent != null) consequent.renderRaw(sb);
        sb.append("}");
    }
}
