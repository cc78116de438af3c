package com.ciro.jreactive.lens.extract;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VariableExtractorTest {

    private final VariableExtractor extractor = new VariableExtractor();

    @Test
    void stateVariableWithIntInitializer() {
        String src = """
            function C() {
              const [count, setCount] = useState(0);
            }
            """;

        assertEquals(List.of(new StateVariable("count", "setCount", "0", ValueKind.INT, 2)),
                extractor.extractStateVariables(src));
    }

    @Test
    void genericTypeArgumentIsAccepted() {
        List<StateVariable> vars = extractor.extractStateVariables(
                "const [user, setUser] = useState<User | null>(null);");

        assertEquals(1, vars.size());
        assertEquals("null", vars.get(0).initialValue());
        assertEquals(ValueKind.UNKNOWN, vars.get(0).kind());
    }

    @Test
    void initializerIsDepthMatched() {
        List<StateVariable> vars = extractor.extractStateVariables(
                "const [total, setTotal] = useState(() => compute(a, b));");

        assertEquals("() => compute(a, b)", vars.get(0).initialValue());
    }

    @Test
    void unbalancedInitializerIsSkipped() {
        assertTrue(extractor.extractStateVariables("const [a, setA] = useState(1").isEmpty());
    }

    @Test
    void customStateHooks() {
        VariableExtractor custom = new VariableExtractor(List.of("useState", "useLocalStorage"), 20);

        List<StateVariable> vars = custom.extractStateVariables("const [theme, setTheme] = useLocalStorage('theme');");

        assertEquals(1, vars.size());
        assertEquals("theme", vars.get(0).name());
        assertEquals(ValueKind.STRING, vars.get(0).kind());
        assertTrue(extractor.extractStateVariables("const [theme, setTheme] = useLocalStorage('theme');").isEmpty());
    }

    @Test
    void derivedFilterDependsOnItsStateSource() {
        String src = """
            const [items, setItems] = useState([]);
            const [showAll, setShowAll] = useState(false);

            const visible = items.filter(i => i.active);
            """;
        List<StateVariable> states = extractor.extractStateVariables(src);

        List<DerivedVariable> derived = extractor.extractDerivedVariables(src, states);

        assertEquals(1, derived.size());
        DerivedVariable visible = derived.get(0);
        assertEquals("visible", visible.name());
        assertEquals("items", visible.sourceVar());
        assertEquals(Operation.FILTER, visible.operation());
        assertEquals(ValueKind.ARRAY, visible.resultKind());
        assertEquals("items.filter(i => i.active)", visible.expression());
        assertEquals(List.of("items"), visible.dependsOn());
        assertEquals(4, visible.line());
    }

    @Test
    void dependenciesAreStateNamesOnly() {
        String src = """
            const [query, setQuery] = useState('');

            // resultados
            const hits = products.filter(p => p.name.includes(query));
            """;
        List<StateVariable> states = extractor.extractStateVariables(src);

        DerivedVariable hits = extractor.extractDerivedVariables(src, states).get(0);

        assertEquals("products", hits.sourceVar());
        assertEquals(List.of("query"), hits.dependsOn());
    }

    @Test
    void derivedVariablesComeInSourceOrder() {
        String src = """
            const names = list.map(x => x.name);

            const ok = list.every(Boolean);

            const first = list.find(x => x.id === 1);
            """;

        List<DerivedVariable> derived = extractor.extractDerivedVariables(src, List.of());

        assertEquals(List.of(Operation.MAP, Operation.EVERY, Operation.FIND),
                derived.stream().map(DerivedVariable::operation).toList());
        assertEquals(ValueKind.BOOL, derived.get(1).resultKind());
        assertTrue(derived.get(0).dependsOn().isEmpty());
    }

    @Test
    void bracketInLookbehindWindowSkipsMatch() {
        String src = "const [items, setItems] = useState([]);\nconst visible = items.filter(i => i.active);";

        assertTrue(extractor.extractDerivedVariables(src, List.of()).isEmpty());
        assertEquals(1, new VariableExtractor(List.of("useState"), 0).extractDerivedVariables(src, List.of()).size());
    }

    @Test
    void kindInferencePrecedence() {
        assertEquals(ValueKind.STRING, VariableExtractor.inferKind(""));
        assertEquals(ValueKind.STRING, VariableExtractor.inferKind("''"));
        assertEquals(ValueKind.STRING, VariableExtractor.inferKind("'home'"));
        assertEquals(ValueKind.STRING, VariableExtractor.inferKind("`tpl`"));
        assertEquals(ValueKind.BOOL, VariableExtractor.inferKind("false"));
        assertEquals(ValueKind.INT, VariableExtractor.inferKind("-3"));
        assertEquals(ValueKind.FLOAT, VariableExtractor.inferKind("2.5"));
        assertEquals(ValueKind.FLOAT, VariableExtractor.inferKind(".5"));
        assertEquals(ValueKind.ARRAY, VariableExtractor.inferKind("[1, 2]"));
        assertEquals(ValueKind.OBJECT, VariableExtractor.inferKind("{ a: 1 }"));
        assertEquals(ValueKind.UNKNOWN, VariableExtractor.inferKind("null"));
        assertEquals(ValueKind.UNKNOWN, VariableExtractor.inferKind("undefined"));
        // referencias: plural o nombre con pinta de colección
        assertEquals(ValueKind.ARRAY, VariableExtractor.inferKind("users"));
        assertEquals(ValueKind.ARRAY, VariableExtractor.inferKind("props.items"));
        assertEquals(ValueKind.UNKNOWN, VariableExtractor.inferKind("class"));
        assertEquals(ValueKind.UNKNOWN, VariableExtractor.inferKind("bus"));
        assertEquals(ValueKind.UNKNOWN, VariableExtractor.inferKind("count"));
    }

    @Test
    void lineAtCountsNewlines() {
        assertEquals(1, VariableExtractor.lineAt("abc", 2));
        assertEquals(3, VariableExtractor.lineAt("a\nb\nc", 4));
    }
}
