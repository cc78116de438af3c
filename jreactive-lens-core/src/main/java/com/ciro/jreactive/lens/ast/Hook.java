package com.ciro.jreactive.lens.ast;

/**
 * Uso de un hook dentro de un componente.
 *
 * @param name      nombre del hook tal cual ({@code useState}, {@code useFetch}, ...)
 * @param boundName variable que recibe el resultado ({@code const [theme, ...] = useState}), o null
 */
public record Hook(HookKind kind, String name, String boundName, int line) {}
