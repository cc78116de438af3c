package com.ciro.jreactive.lens.extract;

/**
 * Variable reactiva declarada con {@code const [name, setName] = useState(init)}.
 *
 * @param name         nombre de la variable (identificador simple)
 * @param setter       nombre del setter
 * @param initialValue texto literal del inicializador, sin espacios alrededor
 * @param kind         tipo inferido del inicializador
 * @param line         línea de la declaración (1-based)
 */
public record StateVariable(String name, String setter, String initialValue, ValueKind kind, int line) {}
