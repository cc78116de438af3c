package com.ciro.jreactive.lens.ast;

import java.util.LinkedHashMap;
import java.util.Map;

public class ImportNode implements JsxNode {
    public String defaultName;
    public final Map<String, String> named = new LinkedHashMap<>(); // nombre -> alias
    public String namespace;   // import * as ns
    public String source;      // sin comillas
    public final int line;

    public ImportNode(int line) {
        this.line = line;
    }

    @Override public NodeType type() { return NodeType.IMPORT; }
    @Override public int line() { return line; }

    @Override
    public void renderRaw(StringBuilder sb) {
        sb.append("import ");
        boolean any = false;
        if (defaultName != null) {
            sb.append(defaultName);
            any = true;
        }
        if (namespace != null) {
            sb.append(any ? ", " : "").append("* as ").append(namespace);
            any = true;
        }
        if (!named.isEmpty()) {
            sb.append(any ? ", " : "").append("{ ");
            int i = 0;
            for (Map.Entry<String, String> e : named.entrySet()) {
                if (i++ > 0) sb.append(", ");
                sb.append(e.getKey());
                if (!e.getKey().equals(e.getValue())) sb.append(" as ").append(e.getValue());
            }
            sb.append(" }");
            any = true;
        }
        if (any) sb.append(" from ");
        sb.append("'").append(source == null ? "" : source).append("';");
    }
}
