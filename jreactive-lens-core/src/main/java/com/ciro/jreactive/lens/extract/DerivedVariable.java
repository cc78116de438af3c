package com.ciro.jreactive.lens.extract;

import java.util.List;

/**
 * Valor calculado a partir de una operación de colección, p.ej.
 * {@code const visible = items.filter(i => i.active)}.
 *
 * @param expression parte derecha completa ({@code items.filter(i => i.active)})
 * @param sourceVar  identificador de la colección origen
 * @param dependsOn  variables de estado mencionadas en la expresión
 */
public record DerivedVariable(String name,
                              String expression,
                              String sourceVar,
                              Operation operation,
                              ValueKind resultKind,
                              List<String> dependsOn,
                              int line) {

    public DerivedVariable {
        dependsOn = List.copyOf(dependsOn);
    }
}
