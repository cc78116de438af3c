package com.ciro.jreactive.lens.patterns;

public enum ConfidenceBand {
    HIGH, MEDIUM, LOW;

    public static ConfidenceBand of(double confidence) {
        if (confidence >= 0.8) return HIGH;
        if (confidence >= 0.6) return MEDIUM;
        return LOW;
    }
}
