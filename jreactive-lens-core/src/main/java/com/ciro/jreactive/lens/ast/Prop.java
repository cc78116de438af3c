package com.ciro.jreactive.lens.ast;

/**
 * Parámetro de un componente.
 *
 * @param defaultValue valor por defecto tal cual aparece en el código (los strings conservan sus comillas), o null
 * @param rest         true para {@code ...others}
 */
public record Prop(String name, String defaultValue, boolean rest) {

    public static Prop of(String name) {
        return new Prop(name, null, false);
    }
}
