package com.ciro.jreactive.lens.patterns;

import com.ciro.jreactive.lens.ast.ComponentNode;
import com.ciro.jreactive.lens.ast.Hook;
import com.ciro.jreactive.lens.ast.HookKind;
import com.ciro.jreactive.lens.ast.ParseResult;
import com.ciro.jreactive.lens.extract.DerivedVariable;
import com.ciro.jreactive.lens.extract.Operation;
import com.ciro.jreactive.lens.extract.StateVariable;
import com.ciro.jreactive.lens.extract.ValueKind;
import com.ciro.jreactive.lens.extract.VariableExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detector de idiomas de UI (tabs, filtros, modales...) con dos estrategias:
 * <ul>
 *   <li><b>texto crudo</b>: una lista ordenada de regex por idioma; gana la primera que encaja.</li>
 *   <li><b>semántica</b>: reglas sobre variables de estado, derivadas y hooks de cada componente.</li>
 * </ul>
 * Cada llamada usa su propio acumulador, así que la misma instancia se puede reutilizar sin problemas.
 */
public class PatternDetector {

    private static final Logger log = LoggerFactory.getLogger(PatternDetector.class);

    private record RawRule(PatternKind kind, double confidence, String description, List<Pattern> patterns) {

        static RawRule of(PatternKind kind, double confidence, String description, String... regexes) {
            List<Pattern> compiled = new ArrayList<>();
            for (String r : regexes) compiled.add(Pattern.compile(r));
            return new RawRule(kind, confidence, description, List.copyOf(compiled));
        }
    }

    // El orden de las reglas es el orden de los registros en la salida
    private static final List<RawRule> RAW_RULES = List.of(
        RawRule.of(PatternKind.TABS, 0.8, "Tab UI pattern detected",
            "(?i)role=[\"']tablist[\"']",
            "(?i)role=[\"']tab[\"']",
            "(?i)aria-selected",
            "(?i)className=.*tab.*active",
            "(?i)activeTab|selectedTab|currentTab"),
        RawRule.of(PatternKind.FILTER, 0.7, "Filter/search pattern detected",
            "\\.filter\\s*\\(",
            "(?i)searchTerm|filterValue|query",
            "(?i)type=[\"']search[\"']",
            "(?i)onChange.*filter"),
        RawRule.of(PatternKind.FORM_DEPENDENCIES, 0.6, "Form field dependency pattern detected",
            "(?i)disabled=\\{.*}",
            "(?i)hidden.*&&",
            "(?i)style=\\{.*display.*none",
            "(?i)showIf|hideIf|visibleWhen"),
        RawRule.of(PatternKind.MODAL, 0.7, "Modal/dialog pattern detected",
            "(?i)role=[\"']dialog[\"']",
            "(?i)aria-modal",
            "(?i)Modal|Dialog",
            "(?i)isOpen|showModal|modalOpen"),
        RawRule.of(PatternKind.DARK_MODE, 0.9, "Dark mode pattern detected",
            "(?i)darkMode|darkTheme|isDark",
            "(?i)theme.*dark|dark.*theme",
            "(?i)prefers-color-scheme",
            "(?i)toggleTheme|toggleDark"),
        RawRule.of(PatternKind.PAGINATION, 0.75, "Pagination pattern detected",
            "(?i)pagination|paginate",
            "(?i)pageNumber|currentPage|page\\s*=",
            "(?i)nextPage|prevPage|previousPage",
            "(?i)itemsPerPage|pageSize|limit"),
        RawRule.of(PatternKind.ACCORDION, 0.75, "Accordion/collapsible pattern detected",
            "(?i)accordion",
            "(?i)collapsible",
            "(?i)expand.*collapse|collapse.*expand",
            "(?i)aria-expanded"),
        RawRule.of(PatternKind.TOGGLE, 0.7, "Toggle/switch pattern detected",
            "(?i)toggle|switch",
            "(?i)setIs\\w+\\(!",
            "(?i)prev\\s*=>\\s*!prev",
            "(?i)type=[\"']checkbox[\"']"),
        RawRule.of(PatternKind.SORTABLE_TABLE, 0.75, "Sortable table pattern detected",
            "(?i)sortColumn|sortBy|sortField",
            "(?i)sortDirection|sortOrder|ascending|descending",
            "(?i)\\.sort\\s*\\(",
            "(?i)onClick.*sort")
    );

    /** Registros de una ejecución; descarta duplicados por (kind, line). */
    private static final class Accumulator {
        final List<DetectedPattern> records = new ArrayList<>();

        boolean add(DetectedPattern p) {
            for (DetectedPattern existing : records) {
                if (existing.sameIdentity(p)) return false;
            }
            records.add(p);
            return true;
        }
    }

    // ==============================================================
    // API
    // ==============================================================

    public List<DetectedPattern> analyzeSource(String source) {
        Accumulator acc = new Accumulator();
        detectRaw(source, acc);
        log.debug("Raw-text detection: {} patterns", acc.records.size());
        return List.copyOf(acc.records);
    }

    public List<DetectedPattern> analyze(ParseResult result) {
        Accumulator acc = new Accumulator();
        detectSemantic(result, acc);
        log.debug("Semantic detection: {} patterns", acc.records.size());
        return List.copyOf(acc.records);
    }

    /** Ambas estrategias sobre un mismo acumulador: primero las de texto crudo. */
    public List<DetectedPattern> detect(String source, ParseResult result) {
        return detect(source, result, true, true);
    }

    public List<DetectedPattern> detect(String source, ParseResult result, boolean rawText, boolean semantic) {
        Accumulator acc = new Accumulator();
        if (rawText) detectRaw(source, acc);
        if (semantic) detectSemantic(result, acc);
        log.debug("Detected {} patterns (raw={}, semantic={})", acc.records.size(), rawText, semantic);
        return List.copyOf(acc.records);
    }

    // ==============================================================
    // Estrategia de texto crudo
    // ==============================================================

    private void detectRaw(String source, Accumulator acc) {
        if (source == null || source.isEmpty()) return;

        for (RawRule rule : RAW_RULES) {
            for (Pattern p : rule.patterns()) {
                Matcher m = p.matcher(source);
                if (!m.find()) continue;

                acc.add(new DetectedPattern(rule.kind(), VariableExtractor.lineAt(source, m.start()),
                        rule.confidence(), rule.description(), m.group(),
                        ReplacementTemplates.forKind(rule.kind()), List.of(), List.of()));
                break;
            }
        }
    }

    // ==============================================================
    // Estrategia semántica
    // ==============================================================

    private void detectSemantic(ParseResult result, Accumulator acc) {
        if (result == null || result.file() == null) return;

        for (ComponentNode comp : result.file().components) {
            List<DetectedPattern> own = new ArrayList<>();
            stateRules(comp, acc, own);
            derivedRules(comp, acc, own);
            hookRules(comp, acc, own);
        }
    }

    private void stateRules(ComponentNode comp, Accumulator acc, List<DetectedPattern> own) {
        boolean hasDerivedFilter = comp.derivedVars.stream().anyMatch(dv -> dv.operation() == Operation.FILTER);

        // Tabs: activeTab / selectedX con string
        for (StateVariable sv : comp.stateVars) {
            String name = lower(sv.name());
            if ((name.contains("tab") || name.contains("selected")) && sv.kind() == ValueKind.STRING) {
                addState(acc, own, PatternKind.TABS, sv, 0.85, "Tab state with string selector");
            }
        }

        // Filtro: texto de búsqueda, mejor si hay un derivado .filter()
        for (StateVariable sv : comp.stateVars) {
            String name = lower(sv.name());
            if ((name.contains("filter") || name.contains("search") || name.contains("query"))
                    && sv.kind() == ValueKind.STRING) {
                addState(acc, own, PatternKind.FILTER, sv, hasDerivedFilter ? 0.95 : 0.7,
                        hasDerivedFilter ? "Filter/search with derived filtered list" : "Filter/search state");
            }
        }

        // Booleanos de visibilidad
        for (StateVariable sv : comp.stateVars) {
            if (sv.kind() != ValueKind.BOOL) continue;
            String name = lower(sv.name());
            if (name.contains("modal") || name.contains("dialog")) {
                addState(acc, own, PatternKind.MODAL, sv, 0.85, "Modal visibility state");
            } else if (name.contains("open") || name.contains("expanded") || name.contains("collapsed")) {
                addState(acc, own, PatternKind.ACCORDION, sv, 0.75, "Accordion/collapsible state");
            } else if (name.contains("active") || name.contains("enabled")
                    || name.contains("show") || name.contains("visible")) {
                addState(acc, own, PatternKind.TOGGLE, sv, 0.7, "Toggle/visibility state");
            }
        }

        for (StateVariable sv : comp.stateVars) {
            String name = lower(sv.name());
            if ((name.contains("page") || name.contains("offset")) && sv.kind().isNumeric()) {
                addState(acc, own, PatternKind.PAGINATION, sv, 0.8, "Pagination state");
            }
        }

        for (StateVariable sv : comp.stateVars) {
            if (lower(sv.name()).contains("sort")) {
                addState(acc, own, PatternKind.SORTABLE_TABLE, sv, 0.8, "Sortable table state");
            }
        }
    }

    private void derivedRules(ComponentNode comp, Accumulator acc, List<DetectedPattern> own) {
        for (DerivedVariable dv : comp.derivedVars) {
            switch (dv.operation()) {
                case FILTER -> {
                    if (!hasStronger(own, PatternKind.FILTER, 0.65)) {
                        addDerived(acc, own, PatternKind.FILTER, dv, 0.65, "Client-side filtering detected");
                    }
                }
                case SORT -> {
                    if (!hasStronger(own, PatternKind.SORTABLE_TABLE, 0.75)) {
                        addDerived(acc, own, PatternKind.SORTABLE_TABLE, dv, 0.75, "Client-side sorting detected");
                    }
                }
                default -> { }
            }
        }
    }

    private void hookRules(ComponentNode comp, Accumulator acc, List<DetectedPattern> own) {
        for (Hook hook : comp.hooks) {
            if (hook.kind() == HookKind.STATE && hook.boundName() != null) {
                String bound = lower(hook.boundName());
                if (bound.contains("dark") || bound.contains("theme")) {
                    add(acc, own, new DetectedPattern(PatternKind.DARK_MODE, hook.line(), 0.9,
                            "Dark mode/theme state detected", hook.name() + " bound to " + hook.boundName(),
                            ReplacementTemplates.forKind(PatternKind.DARK_MODE, hook.boundName(), null, "boolean"),
                            List.of(hook.boundName()), List.of()));
                }
            } else if (hook.kind().isEffect()) {
                add(acc, own, new DetectedPattern(PatternKind.SIDE_EFFECT, hook.line(), 0.5,
                        hook.name() + " detected - consider a server-side alternative", hook.name() + "(...)",
                        ReplacementTemplates.forKind(PatternKind.SIDE_EFFECT), List.of(), List.of()));
            }
        }
    }

    // ==============================================================
    // Helpers
    // ==============================================================

    private static void addState(Accumulator acc, List<DetectedPattern> own, PatternKind kind,
                                 StateVariable sv, double confidence, String description) {
        String snippet = "const [" + sv.name() + ", " + sv.setter() + "] = useState(" + sv.initialValue() + ")";
        add(acc, own, new DetectedPattern(kind, sv.line(), confidence, description, snippet,
                ReplacementTemplates.forKind(kind, sv.name(), sv.initialValue(), sv.kind().javaType()),
                List.of(sv.name()), List.of()));
    }

    private static void addDerived(Accumulator acc, List<DetectedPattern> own, PatternKind kind,
                                   DerivedVariable dv, double confidence, String description) {
        String snippet = dv.name() + " = " + dv.sourceVar() + "." + dv.operation().methodName() + "(...)";
        add(acc, own, new DetectedPattern(kind, dv.line(), confidence, description, snippet,
                ReplacementTemplates.forKind(kind), dv.dependsOn(), List.of(dv.name())));
    }

    private static void add(Accumulator acc, List<DetectedPattern> own, DetectedPattern p) {
        if (acc.add(p)) own.add(p);
    }

    private static boolean hasStronger(List<DetectedPattern> own, PatternKind kind, double confidence) {
        return own.stream().anyMatch(p -> p.kind() == kind && p.confidence() > confidence);
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
