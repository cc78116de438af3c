package com.ciro.jreactive.lens.ast;

/**
 * Iteración {@code {items.map((item, i) => <li/>)}}.
 * El cuerpo se obtiene re-parseando el texto tras la flecha con un parser nuevo.
 */
public class EachNode implements JsxNode {
    public final String collection;
    public final String itemVar;
    public final String indexVar; // null si no hay índice
    public final JsxNode body;    // null si el cuerpo no es marcado reconocible
    public final int line;

    public EachNode(String collection, String itemVar, String indexVar, JsxNode body, int line) {
        this.collection = collection;
        this.itemVar = itemVar;
        this.indexVar = indexVar;
        this.body = body;
        this.line = line;
    }

    @Override public NodeType type() { return NodeType.ITERATION; }
    @Override public int line() { return line; }

    @Override
    public void renderRaw(StringBuilder sb) {
        sb.append("{").append(collection).append(".map((").append(itemVar);
        if (indexVar != null) sb.append(", ").append(indexVar);
        sb.append(") => ");
        if (body != null) body.renderRaw(sb);
        sb.append(")}");
    }
}
