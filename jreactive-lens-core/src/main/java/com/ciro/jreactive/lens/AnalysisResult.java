package com.ciro.jreactive.lens;

import com.ciro.jreactive.lens.ast.ParseResult;
import com.ciro.jreactive.lens.patterns.DetectedPattern;

import java.util.List;

/** Resultado de analizar un fichero JSX: árbol anotado + idiomas detectados. */
public record AnalysisResult(String sourceName, ParseResult parse, List<DetectedPattern> patterns) {

    public AnalysisResult {
        patterns = List.copyOf(patterns);
    }
}
