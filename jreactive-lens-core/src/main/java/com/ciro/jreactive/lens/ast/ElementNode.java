package com.ciro.jreactive.lens.ast;

import java.util.ArrayList;
import java.util.List;

public class ElementNode implements JsxNode {
    public final String tagName;
    public final List<Attribute> attributes = new ArrayList<>();
    public final List<JsxNode> children = new ArrayList<>();
    public boolean isSelfClosing;
    public final int line;

    public ElementNode(String tagName, int line) {
        this.tagName = tagName;
        this.line = line;
    }

    /** Los componentes de usuario empiezan con mayúscula ({@code <UserCard/>}). */
    public boolean isComponentTag() {
        return !tagName.isEmpty() && Character.isUpperCase(tagName.charAt(0));
    }

    public Attribute attribute(String name) {
        for (Attribute a : attributes) {
            if (!a.spread && name.equals(a.name)) return a;
        }
        return null;
    }

    public List<Attribute> spreads() {
        return attributes.stream().filter(a -> a.spread).toList();
    }

    @Override public NodeType type() { return NodeType.ELEMENT; }
    @Override public int line() { return line; }

    @Override
    public void renderRaw(StringBuilder sb) {
        sb.append("<").append(tagName);
        for (Attribute attr : attributes) {
            if (attr.spread) continue; // el spread no se renderiza como atributo normal
            sb.append(" ").append(attr.name);
            if (attr.expression != null) {
                attr.expression.renderRaw(sb.append("="));
            } else if (attr.value != null) {
                sb.append("=\"").append(attr.value).append("\"");
            }
        }
        if (isSelfClosing) {
            sb.append("/>");
            return;
        }
        sb.append(">");
        for (JsxNode child : children) child.renderRaw(sb);
        sb.append("</").append(tagName).append(">");
    }
}
