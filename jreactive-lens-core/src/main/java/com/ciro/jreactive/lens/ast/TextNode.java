package com.ciro.jreactive.lens.ast;

public class TextNode implements JsxNode {
    public final String text;
    public final int line;

    public TextNode(String text, int line) {
        this.text = text;
        this.line = line;
    }

    @Override public NodeType type() { return NodeType.TEXT; }
    @Override public int line() { return line; }

    @Override
    public void renderRaw(StringBuilder sb) {
        sb.append(text);
    }
}
