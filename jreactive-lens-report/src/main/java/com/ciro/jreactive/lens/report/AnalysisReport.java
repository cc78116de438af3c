package com.ciro.jreactive.lens.report;

import com.ciro.jreactive.lens.AnalysisResult;
import com.ciro.jreactive.lens.ast.ComponentNode;
import com.ciro.jreactive.lens.ast.ElementNode;
import com.ciro.jreactive.lens.ast.Prop;
import com.ciro.jreactive.lens.ast.Suggestion;
import com.ciro.jreactive.lens.ast.Warning;
import com.ciro.jreactive.lens.extract.DerivedVariable;
import com.ciro.jreactive.lens.extract.StateVariable;
import com.ciro.jreactive.lens.patterns.DetectedPattern;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Instantánea serializable de un {@link AnalysisResult}.
 * Solo datos planos: el árbol JSX no se exporta, únicamente su resumen por componente.
 */
public record AnalysisReport(String sourceName,
                             Instant generatedAt,
                             List<ComponentSummary> components,
                             List<PatternEntry> patterns,
                             List<Warning> warnings,
                             List<Suggestion> suggestions) {

    public record ComponentSummary(String name,
                                   boolean exported,
                                   int line,
                                   List<String> params,
                                   Optional<String> rootTag,
                                   List<HookEntry> hooks,
                                   List<StateVariable> stateVars,
                                   List<DerivedVariable> derivedVars) {}

    public record HookEntry(String name, String kind, Optional<String> boundName, int line) {}

    public record PatternEntry(String kind,
                               String label,
                               int line,
                               double confidence,
                               String band,
                               String description,
                               String snippet,
                               String replacement,
                               List<String> stateVars,
                               List<String> derivedVars) {}

    public static AnalysisReport from(AnalysisResult result, Instant generatedAt) {
        List<ComponentSummary> comps = result.parse().file().components.stream()
                .map(AnalysisReport::summarize)
                .toList();
        List<PatternEntry> pats = result.patterns().stream()
                .map(AnalysisReport::entry)
                .toList();
        return new AnalysisReport(result.sourceName(), generatedAt, comps, pats,
                result.parse().warnings(), result.parse().suggestions());
    }

    private static ComponentSummary summarize(ComponentNode c) {
        List<String> params = c.params.stream().map(AnalysisReport::renderProp).toList();
        List<HookEntry> hooks = c.hooks.stream()
                .map(h -> new HookEntry(h.name(), h.kind().name(), Optional.ofNullable(h.boundName()), h.line()))
                .toList();

        Optional<String> rootTag = Optional.ofNullable(c.body)
                .map(b -> b instanceof ElementNode el ? el.tagName : b.type().name().toLowerCase(Locale.ROOT));

        return new ComponentSummary(c.name, c.exported, c.line, params, rootTag, hooks,
                List.copyOf(c.stateVars), List.copyOf(c.derivedVars));
    }

    private static String renderProp(Prop p) {
        String base = p.rest() ? "..." + p.name() : p.name();
        return p.defaultValue() == null ? base : base + " = " + p.defaultValue();
    }

    private static PatternEntry entry(DetectedPattern p) {
        return new PatternEntry(p.kind().id(), p.kind().label(), p.line(), p.confidence(), p.band().name(),
                p.description(), p.snippet(), p.replacement(), p.stateVars(), p.derivedVars());
    }
}
