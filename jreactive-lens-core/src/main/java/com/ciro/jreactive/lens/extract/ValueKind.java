package com.ciro.jreactive.lens.extract;

/**
 * Tipo aproximado de un valor JS, inferido del texto del inicializador.
 * Cada tipo sabe qué campo {@code @State} usaría un componente JReactive.
 */
public enum ValueKind {
    STRING("String", "String"),
    BOOL("Bool", "boolean"),
    INT("Int", "int"),
    FLOAT("Float", "double"),
    ARRAY("ArrayOfAny", "List<Object>"),
    OBJECT("ObjectOfAny", "Map<String, Object>"),
    UNKNOWN("Unknown", "Object");

    private final String displayName;
    private final String javaType;

    ValueKind(String displayName, String javaType) {
        this.displayName = displayName;
        this.javaType = javaType;
    }

    public String displayName() { return displayName; }

    public String javaType() { return javaType; }

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }
}
