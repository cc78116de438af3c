package com.ciro.jreactive.lens.ast;

import java.util.ArrayList;
import java.util.List;

public class ParsedFile {
    public final List<ImportNode> imports = new ArrayList<>();
    public final List<ComponentNode> components = new ArrayList<>();
    public final List<String> exports = new ArrayList<>();

    public ComponentNode component(String name) {
        for (ComponentNode c : components) {
            if (c.name.equals(name)) return c;
        }
        return null;
    }
}
