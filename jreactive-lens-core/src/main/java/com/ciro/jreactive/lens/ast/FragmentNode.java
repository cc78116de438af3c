package com.ciro.jreactive.lens.ast;

import java.util.ArrayList;
import java.util.List;

/** {@code <>...</>}, {@code <Fragment>} o {@code <React.Fragment>}. */
public class FragmentNode implements JsxNode {
    public final List<JsxNode> children = new ArrayList<>();
    public final int line;

    public FragmentNode(int line) {
        this.line = line;
    }

    @Override public NodeType type() { return NodeType.FRAGMENT; }
    @Override public int line() { return line; }

    @Override
    public void renderRaw(StringBuilder sb) {
        sb.append("<>");
        for (JsxNode child : children) child.renderRaw(sb);
        sb.append("</>");
    }
}
