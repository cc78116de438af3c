package com.ciro.jreactive.lens.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Extracción de variables de estado y valores derivados directamente sobre el texto fuente.
 * <p>
 * Trabaja con regex sobre el texto crudo, nunca sobre los tokens: es una aproximación
 * (best-effort) y se equivoca con código muy "creativo".
 */
public class VariableExtractor {

    private static final Logger log = LoggerFactory.getLogger(VariableExtractor.class);

    public static final List<String> DEFAULT_STATE_HOOKS = List.of("useState");
    public static final int DEFAULT_LOOKBEHIND = 20;

    private static final Pattern DERIVED = Pattern.compile(
            "const\\s+(\\w+)\\s*=\\s*(\\w+)\\.(filter|map|find|some|every|reduce|sort|slice)\\s*\\(");

    private static final Pattern SIMPLE_IDENT = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    private static final Pattern INT_LITERAL = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT_LITERAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final Pattern statePattern;
    private final int lookbehind;

    public VariableExtractor() {
        this(DEFAULT_STATE_HOOKS, DEFAULT_LOOKBEHIND);
    }

    /**
     * @param stateHooks nombres de hooks que declaran estado con la forma {@code const [v, setV] = hook(init)}
     * @param lookbehind caracteres previos en los que un '[' descarta un derivado (es una desestructuración)
     */
    public VariableExtractor(Collection<String> stateHooks, int lookbehind) {
        String hooks = (stateHooks == null || stateHooks.isEmpty() ? DEFAULT_STATE_HOOKS : stateHooks).stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        // const [name, setName] = useState<Tipo>(
        this.statePattern = Pattern.compile(
                "const\\s+\\[\\s*(\\w+)\\s*,\\s*(\\w+)\\s*]\\s*=\\s*(?:" + hooks + ")(?:<[^()=]*?>)?\\s*\\(");
        this.lookbehind = Math.max(0, lookbehind);
    }

    public List<StateVariable> extractStateVariables(String source) {
        List<StateVariable> result = new ArrayList<>();
        if (source == null || source.isEmpty()) return result;

        Matcher m = statePattern.matcher(source);
        while (m.find()) {
            String name = m.group(1);
            if (!isSimpleIdent(name)) continue;

            int close = findMatchingParen(source, m.end());
            if (close < 0) continue; // inicializador sin cerrar

            String init = source.substring(m.end(), close - 1).trim();
            result.add(new StateVariable(name, m.group(2), init, inferKind(init), lineAt(source, m.start())));
        }

        log.debug("Extracted {} state variables", result.size());
        return result;
    }

    public List<DerivedVariable> extractDerivedVariables(String source, List<StateVariable> stateVars) {
        List<DerivedVariable> result = new ArrayList<>();
        if (source == null || source.isEmpty()) return result;

        List<String> stateNames = stateVars == null ? List.of()
                : stateVars.stream().map(StateVariable::name).toList();

        Matcher m = DERIVED.matcher(source);
        while (m.find()) {
            // Un '[' justo antes: es parte de una desestructuración, no un derivado
            String before = source.substring(Math.max(0, m.start() - lookbehind), m.start());
            if (before.contains("[")) continue;

            String name = m.group(1);
            String sourceVar = m.group(2);
            Operation op = Operation.fromMethod(m.group(3));

            int close = findMatchingParen(source, m.end());
            String expression = close > 0
                    ? source.substring(m.start(2), close)
                    : source.substring(m.start(2), m.end());

            Set<String> deps = new LinkedHashSet<>();
            for (String state : stateNames) {
                if (expression.contains(state)) deps.add(state);
            }
            if (stateNames.contains(sourceVar)) deps.add(sourceVar);

            result.add(new DerivedVariable(name, expression, sourceVar, op, op.resultKind(),
                    new ArrayList<>(deps), lineAt(source, m.start())));
        }

        log.debug("Extracted {} derived variables", result.size());
        return result;
    }

    /**
     * Infiere el tipo a partir del texto del inicializador. El orden de las reglas importa.
     */
    public static ValueKind inferKind(String raw) {
        String val = raw == null ? "" : raw.trim();

        if (val.isEmpty() || val.equals("\"\"") || val.equals("''") || val.equals("``")) {
            return ValueKind.STRING;
        }
        if (isQuoted(val, '"') || isQuoted(val, '\'') || isQuoted(val, '`')) {
            return ValueKind.STRING;
        }
        if (val.equals("true") || val.equals("false")) return ValueKind.BOOL;
        if (INT_LITERAL.matcher(val).matches()) return ValueKind.INT;
        if (FLOAT_LITERAL.matcher(val).matches()) return ValueKind.FLOAT;
        if (val.startsWith("[")) return ValueKind.ARRAY;
        if (val.startsWith("{")) return ValueKind.OBJECT;
        if (val.equals("null") || val.equals("undefined")) return ValueKind.UNKNOWN;

        // Referencia a otra variable: si el nombre suena a colección, es una lista
        String lower = val.toLowerCase(Locale.ROOT);
        if (lower.endsWith("s") && !lower.endsWith("ss") && lower.length() > 3 && isSimpleIdent(val)) {
            return ValueKind.ARRAY;
        }
        if (lower.contains("items") || lower.contains("list") || lower.contains("data") || lower.contains("array")) {
            return ValueKind.ARRAY;
        }
        return ValueKind.UNKNOWN;
    }

    /**
     * Busca el ')' que cierra un '(' ya abierto justo antes de {@code start}.
     *
     * @return índice siguiente al ')' de cierre, o -1 si no está balanceado
     */
    public static int findMatchingParen(String s, int start) {
        int depth = 1;
        for (int i = start; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) return i + 1;
            }
        }
        return -1;
    }

    /** Línea (1-based) del carácter en {@code offset}. */
    public static int lineAt(String s, int offset) {
        int line = 1;
        int end = Math.min(offset, s.length());
        for (int i = 0; i < end; i++) {
            if (s.charAt(i) == '\n') line++;
        }
        return line;
    }

    public static boolean isSimpleIdent(String s) {
        return s != null && SIMPLE_IDENT.matcher(s).matches();
    }

    private static boolean isQuoted(String val, char quote) {
        return val.length() >= 2 && val.charAt(0) == quote && val.charAt(val.length() - 1) == quote;
    }
}
