package com.ciro.jreactive.lens;

import com.ciro.jreactive.lens.ast.ComponentNode;
import com.ciro.jreactive.lens.ast.EachNode;
import com.ciro.jreactive.lens.ast.ElementNode;
import com.ciro.jreactive.lens.ast.ImportNode;
import com.ciro.jreactive.lens.ast.JsxNode;
import com.ciro.jreactive.lens.ast.TernaryNode;
import com.ciro.jreactive.lens.extract.StateVariable;
import com.ciro.jreactive.lens.patterns.DetectedPattern;
import com.ciro.jreactive.lens.patterns.PatternKind;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsxAnalyzerTest {

    private static String userDirectory;

    @BeforeAll
    static void loadFixture() throws IOException {
        try (InputStream in = JsxAnalyzerTest.class.getResourceAsStream("/fixtures/UserDirectory.jsx")) {
            assertNotNull(in, "fixture no encontrado");
            userDirectory = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static <T extends JsxNode> T findChild(List<JsxNode> children, Class<T> type) {
        return children.stream().filter(type::isInstance).map(type::cast).findFirst()
                .orElseThrow(() -> new AssertionError("sin hijo " + type.getSimpleName()));
    }

    @Test
    void analyzesComponentsImportsAndExports() {
        AnalysisResult result = new JsxAnalyzer(LensConfig.defaults()).analyze("UserDirectory.jsx", userDirectory);

        assertEquals("UserDirectory.jsx", result.sourceName());
        assertEquals(List.of("MemberCard", "UserDirectory"),
                result.parse().file().components.stream().map(c -> c.name).toList());
        assertEquals(List.of("UserDirectory"), result.parse().file().exports);

        assertEquals(1, result.parse().file().imports.size());
        ImportNode imp = result.parse().file().imports.get(0);
        assertEquals("React", imp.defaultName);
        assertEquals("react", imp.source);
        assertEquals(List.of("useState", "useEffect"), List.copyOf(imp.named.keySet()));

        assertTrue(result.parse().warnings().isEmpty(), () -> result.parse().warnings().toString());
    }

    @Test
    void attachesVariablesAndHooksToTheirComponent() {
        AnalysisResult result = new JsxAnalyzer(LensConfig.defaults()).analyze(userDirectory);
        ComponentNode dir = result.parse().file().component("UserDirectory");
        ComponentNode card = result.parse().file().component("MemberCard");

        assertEquals(List.of("query", "activeTab", "showModal"),
                dir.stateVars.stream().map(StateVariable::name).toList());
        assertEquals(1, dir.derivedVars.size());
        assertEquals("visibleMembers", dir.derivedVars.get(0).name());
        assertEquals(List.of("query"), dir.derivedVars.get(0).dependsOn());
        assertEquals(4, dir.hooks.size());
        assertEquals(4, result.parse().suggestions().size());

        assertTrue(card.stateVars.isEmpty());
        assertTrue(card.hooks.isEmpty());
        assertEquals("'viewer'", card.params.get(2).defaultValue());
    }

    @Test
    void detectsPatternsRawFirst() {
        AnalysisResult result = new JsxAnalyzer(LensConfig.defaults()).analyze(userDirectory);

        List<DetectedPattern> patterns = result.patterns();
        assertEquals(List.of(PatternKind.TABS, PatternKind.FILTER, PatternKind.MODAL,
                PatternKind.TABS, PatternKind.FILTER, PatternKind.SIDE_EFFECT),
                patterns.stream().map(DetectedPattern::kind).toList());
        assertEquals(List.of(28, 18, 16, 15, 14, 22),
                patterns.stream().map(DetectedPattern::line).toList());
        assertEquals(List.of(0.8, 0.7, 0.7, 0.85, 0.95, 0.5),
                patterns.stream().map(DetectedPattern::confidence).toList());
    }

    @Test
    void buildsNestedMarkupTree() {
        ComponentNode dir = new JsxAnalyzer(LensConfig.defaults()).analyze(userDirectory)
                .parse().file().component("UserDirectory");

        ElementNode root = (ElementNode) dir.body;
        assertEquals("div", root.tagName);
        assertEquals(27, root.line());

        TernaryNode ternary = findChild(root.children, TernaryNode.class);
        assertEquals(37, ternary.line());
        assertEquals("visibleMembers.length > 0", ternary.condition);

        ElementNode list = (ElementNode) ternary.consequent;
        assertEquals("ul", list.tagName);
        assertEquals(38, list.line());

        EachNode each = findChild(list.children, EachNode.class);
        assertEquals("visibleMembers", each.collection);
        assertEquals("member", each.itemVar);
        assertEquals("index", each.indexVar);
        assertEquals(39, each.line());
        assertEquals("li", ((ElementNode) each.body).tagName);
        assertEquals(40, each.body.line());

        ElementNode empty = (ElementNode) ternary.alternate;
        assertEquals("p", empty.tagName);
        assertEquals(46, empty.line());
    }

    @Test
    void minConfidenceDropsWeakPatterns() {
        LensConfig config = LensConfig.defaults();
        config.setMinConfidence(0.8);

        List<DetectedPattern> patterns = new JsxAnalyzer(config).analyze(userDirectory).patterns();

        assertFalse(patterns.isEmpty());
        assertTrue(patterns.stream().allMatch(p -> p.confidence() >= 0.8));
    }

    @Test
    void rawTextDetectionCanBeDisabled() {
        LensConfig config = LensConfig.defaults();
        config.setRawTextDetection(false);

        List<DetectedPattern> patterns = new JsxAnalyzer(config).analyze(userDirectory).patterns();

        assertTrue(patterns.stream().noneMatch(p -> p.kind() == PatternKind.TABS && p.line() == 28));
        assertTrue(patterns.stream().anyMatch(p -> p.kind() == PatternKind.TABS && p.line() == 15));
    }

    @Test
    void nullSourceIsEmptyResult() {
        AnalysisResult result = new JsxAnalyzer(LensConfig.defaults()).analyze(null);

        assertTrue(result.parse().file().components.isEmpty());
        assertTrue(result.patterns().isEmpty());
        assertTrue(result.parse().warnings().isEmpty());
    }

    @Test
    void analyzerIsReusable() {
        JsxAnalyzer analyzer = new JsxAnalyzer(LensConfig.defaults());

        AnalysisResult first = analyzer.analyze(userDirectory);
        AnalysisResult second = analyzer.analyze(userDirectory);

        assertEquals(first.patterns(), second.patterns());
    }
}
