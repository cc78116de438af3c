package com.ciro.jreactive.lens.ast;

/** Nota informativa asociada a un hook. */
public record Suggestion(int line, String originalText, String hint, String category) {}
