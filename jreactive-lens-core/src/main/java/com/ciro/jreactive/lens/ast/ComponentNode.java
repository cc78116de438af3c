package com.ciro.jreactive.lens.ast;

import com.ciro.jreactive.lens.extract.DerivedVariable;
import com.ciro.jreactive.lens.extract.StateVariable;

import java.util.ArrayList;
import java.util.List;

/**
 * Definición de un componente: {@code function Name(props) {...}} o {@code const Name = (...) => ...}.
 * Las variables de estado/derivadas se asignan después del parseo por rango de líneas.
 */
public class ComponentNode implements JsxNode {
    public final String name;
    public final List<Prop> params = new ArrayList<>();
    public boolean destructuredParams;    // ({ a, b }) frente a (props)
    public JsxNode body;                  // null si no hay return con marcado
    public final List<Hook> hooks = new ArrayList<>();
    public final List<StateVariable> stateVars = new ArrayList<>();
    public final List<DerivedVariable> derivedVars = new ArrayList<>();
    public final boolean exported;
    public final int line;

    public ComponentNode(String name, boolean exported, int line) {
        this.name = name;
        this.exported = exported;
        this.line = line;
    }

    @Override public NodeType type() { return NodeType.COMPONENT; }
    @Override public int line() { return line; }

    @Override
    public void renderRaw(StringBuilder sb) {
        sb.append("function ").append(name).append("(");
        if (destructuredParams) sb.append("{ ");
        for (int i = 0; i < params.size(); i++) {
            Prop p = params.get(i);
            if (i > 0) sb.append(", ");
            if (p.rest()) sb.append("...");
            sb.append(p.name());
            if (p.defaultValue() != null) sb.append(" = ").append(p.defaultValue());
        }
        if (destructuredParams) sb.append(" }");
        sb.append(") { return ");
        if (body != null) body.renderRaw(sb);
        else sb.append("null");
        sb.append("; }");
    }
}
