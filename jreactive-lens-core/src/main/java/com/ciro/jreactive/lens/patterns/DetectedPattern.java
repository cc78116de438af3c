package com.ciro.jreactive.lens.patterns;

import java.util.List;

/**
 * Un idioma detectado. La identidad es (kind, line): un mismo análisis no emite dos iguales.
 *
 * @param snippet     fragmento o regla que disparó la detección
 * @param replacement equivalente JReactive sugerido (texto opaco)
 */
public record DetectedPattern(PatternKind kind,
                              int line,
                              double confidence,
                              String description,
                              String snippet,
                              String replacement,
                              List<String> stateVars,
                              List<String> derivedVars) {

    public DetectedPattern {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
        stateVars = stateVars == null ? List.of() : List.copyOf(stateVars);
        derivedVars = derivedVars == null ? List.of() : List.copyOf(derivedVars);
    }

    public ConfidenceBand band() {
        return ConfidenceBand.of(confidence);
    }

    public boolean sameIdentity(DetectedPattern other) {
        return kind == other.kind && line == other.line;
    }
}
