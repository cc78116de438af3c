package com.ciro.jreactive.lens.ast;

/** Problema estructural recuperable; nunca detiene el parseo. */
public record Warning(int line, int column, String message) {}
