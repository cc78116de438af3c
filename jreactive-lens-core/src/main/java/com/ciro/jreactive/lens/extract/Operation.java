package com.ciro.jreactive.lens.extract;

import java.util.Locale;

/** Operaciones de colección reconocidas en valores derivados. */
public enum Operation {
    FILTER(ValueKind.ARRAY),
    MAP(ValueKind.ARRAY),
    FIND(ValueKind.UNKNOWN),
    SOME(ValueKind.BOOL),
    EVERY(ValueKind.BOOL),
    REDUCE(ValueKind.UNKNOWN),
    SORT(ValueKind.ARRAY),
    SLICE(ValueKind.ARRAY);

    private final ValueKind resultKind;

    Operation(ValueKind resultKind) {
        this.resultKind = resultKind;
    }

    public ValueKind resultKind() { return resultKind; }

    /** Nombre tal y como aparece en el código JS ({@code filter}, {@code map}, ...). */
    public String methodName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Operation fromMethod(String method) {
        return valueOf(method.toUpperCase(Locale.ROOT));
    }
}
