package com.ciro.jreactive.lens;

import com.ciro.jreactive.lens.ast.JsxLexer;
import com.ciro.jreactive.lens.ast.JsxParser;
import com.ciro.jreactive.lens.ast.ParseResult;
import com.ciro.jreactive.lens.patterns.DetectedPattern;
import com.ciro.jreactive.lens.patterns.PatternDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Punto de entrada: lexer → parser (+ extracción de variables) → detector.
 * Sin estado mutable entre llamadas; una instancia se puede compartir entre hilos.
 */
public class JsxAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(JsxAnalyzer.class);

    private final LensConfig config;
    private final PatternDetector detector = new PatternDetector();

    public JsxAnalyzer() {
        this(LensConfig.load());
    }

    public JsxAnalyzer(LensConfig config) {
        this.config = config;
    }

    public LensConfig config() {
        return config;
    }

    public AnalysisResult analyze(String source) {
        return analyze("<source>", source);
    }

    public AnalysisResult analyze(String sourceName, String source) {
        String text = source == null ? "" : source;

        ParseResult parse = new JsxParser(JsxLexer.lex(text), text, config.newExtractor()).parse();
        List<DetectedPattern> patterns = detector
                .detect(text, parse, config.isRawTextDetection(), config.isSemanticDetection())
                .stream()
                .filter(p -> p.confidence() >= config.getMinConfidence())
                .toList();

        log.debug("{}: {} components, {} patterns, {} warnings", sourceName,
                parse.file().components.size(), patterns.size(), parse.warnings().size());
        return new AnalysisResult(sourceName, parse, patterns);
    }
}
