package com.ciro.jreactive.lens.ast;

/**
 * Atributo JSX. Una de estas formas:
 * {@code name}, {@code name="literal"}, {@code name={expr}} o el spread {@code {...expr}}.
 */
public class Attribute {
    public final String name;
    public String value;                  // literal sin comillas
    public ExpressionNode expression;     // valor {expr}
    public final boolean spread;
    public final String spreadExpression;
    public EventHandler eventHandler;     // solo para onClick, onChange, ...

    private Attribute(String name, boolean spread, String spreadExpression) {
        this.name = name;
        this.spread = spread;
        this.spreadExpression = spreadExpression;
    }

    public static Attribute named(String name) {
        return new Attribute(name, false, null);
    }

    public static Attribute spread(String expression) {
        return new Attribute(null, true, expression);
    }

    public boolean isBoolean() {
        return !spread && value == null && expression == null;
    }
}
