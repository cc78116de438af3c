package com.ciro.jreactive.lens.ast;

import com.ciro.jreactive.lens.ast.JsxLexer.Token;
import com.ciro.jreactive.lens.ast.JsxLexer.TokenType;
import com.ciro.jreactive.lens.extract.DerivedVariable;
import com.ciro.jreactive.lens.extract.StateVariable;
import com.ciro.jreactive.lens.extract.VariableExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser descendente recursivo: convierte los tokens del {@link JsxLexer} en componentes y árboles JSX.
 * <p>
 * No tiene gramática de expresiones JS. El contenido de {@code {...}} se reconoce por forma
 * (map, &&, ternario) y los cuerpos se vuelven a lexear y parsear con una instancia NUEVA
 * de lexer+parser sobre la subcadena. Nunca se toca el cursor del parser externo.
 * <p>
 * Nunca lanza excepciones por entrada mal formada: acumula {@link Warning}s y devuelve lo que pudo.
 */
public class JsxParser {

    private static final Logger log = LoggerFactory.getLogger(JsxParser.class);

    // collection.map((item, index) =>
    static final Pattern MAP_EXPR = Pattern.compile(
            "^(\\w+(?:\\.\\w+)*)\\.map\\s*\\(\\s*\\(?\\s*(\\w+)(?:\\s*,\\s*(\\w+))?\\s*\\)?\\s*=>\\s*");
    static final Pattern GUARD_EXPR = Pattern.compile("^(.+?)\\s*&&\\s*");
    static final Pattern TERNARY_EXPR = Pattern.compile("^([^?]+)\\s*\\?\\s*");

    private static final Pattern SETTER_CALL = Pattern.compile("(set[A-Z]\\w*)\\s*\\(");
    private static final Pattern SETTER_NAME = Pattern.compile("set[A-Z]\\w*");
    private static final Pattern LOWER_IDENT = Pattern.compile("\\b([a-z][a-zA-Z0-9]*)\\b");
    private static final Pattern RETURN_WORD = Pattern.compile("\\breturn\\b");

    private static final Set<String> HANDLER_EXCLUDED = Set.of(
            "true", "false", "null", "undefined", "return", "if", "else", "const", "let",
            "var", "function", "new", "this", "event", "e", "target", "value");

    private static final Set<String> STATEMENT_KEYWORDS = Set.of(
            "import", "export", "function", "const", "let", "var", "class");

    private final List<Token> tokens;
    private final String source;
    private final VariableExtractor extractor;
    private int pos = 0;

    private final List<Warning> warnings = new ArrayList<>();
    private final List<Suggestion> suggestions = new ArrayList<>();

    // Variable que se está declarando (const [x, ...] = useX): se asigna al siguiente hook
    private String pendingBinding;

    public JsxParser(List<Token> tokens) {
        this(tokens, null, new VariableExtractor());
    }

    public JsxParser(List<Token> tokens, String source) {
        this(tokens, source, new VariableExtractor());
    }

    /**
     * @param source texto original; si es null no se extraen variables de estado/derivadas
     */
    public JsxParser(List<Token> tokens, String source, VariableExtractor extractor) {
        this.tokens = tokens;
        this.source = source;
        this.extractor = extractor;
    }

    public static ParseResult parse(String source) {
        String text = source == null ? "" : source;
        return new JsxParser(JsxLexer.lex(text), text).parse();
    }

    /** Parsea un único árbol de marcado (sin componentes ni imports). */
    public static JsxNode parseMarkup(String markup) {
        return new JsxParser(JsxLexer.lex(markup)).parseMarkup();
    }

    public List<Warning> warnings() {
        return warnings;
    }

    // ==============================================================
    // Nivel superior
    // ==============================================================

    public ParseResult parse() {
        ParsedFile file = new ParsedFile();

        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) break;

            int before = pos;
            if (checkIdent("import")) {
                ImportNode imp = parseImport();
                if (imp != null) file.imports.add(imp);
            } else if (checkIdent("export")) {
                parseExport(file);
            } else if (checkIdent("function") || checkIdent("const")) {
                ComponentNode comp = parseComponent(false, current().line());
                if (comp != null) file.components.add(comp);
            }

            // Recuperación: cualquier otra cosa se salta
            if (pos == before) advance();
        }

        if (source != null) attachVariables(file);

        log.debug("Parsed {} components, {} imports ({} warnings)",
                file.components.size(), file.imports.size(), warnings.size());
        return new ParseResult(file, warnings, suggestions);
    }

    public JsxNode parseMarkup() {
        skipWhitespace();
        return parseNode();
    }

    /**
     * Reparte las variables extraídas del texto entre los componentes por rango de líneas:
     * [línea del componente, línea del siguiente) o hasta el final para el último.
     */
    private void attachVariables(ParsedFile file) {
        List<StateVariable> states = extractor.extractStateVariables(source);
        List<DerivedVariable> derived = extractor.extractDerivedVariables(source, states);

        List<ComponentNode> comps = file.components;
        for (int i = 0; i < comps.size(); i++) {
            ComponentNode comp = comps.get(i);
            int start = comp.line;
            int end = i + 1 < comps.size() ? comps.get(i + 1).line : Integer.MAX_VALUE;

            for (StateVariable sv : states) {
                if (sv.line() >= start && sv.line() < end) comp.stateVars.add(sv);
            }
            for (DerivedVariable dv : derived) {
                if (dv.line() >= start && dv.line() < end) comp.derivedVars.add(dv);
            }

            // Hooks de estado sin nombre: lo tomamos de la variable declarada en esa línea
            for (int h = 0; h < comp.hooks.size(); h++) {
                Hook hook = comp.hooks.get(h);
                if (hook.kind() != HookKind.STATE || hook.boundName() != null) continue;
                for (StateVariable sv : comp.stateVars) {
                    if (sv.line() == hook.line()) {
                        comp.hooks.set(h, new Hook(hook.kind(), hook.name(), sv.name(), hook.line()));
                        break;
                    }
                }
            }
        }
    }

    // ==============================================================
    // Imports / exports
    // ==============================================================

    private ImportNode parseImport() {
        Token kw = advance(); // import
        ImportNode imp = new ImportNode(kw.line());
        skipWhitespace();

        // import './styles.css'
        if (check(TokenType.STRING)) {
            imp.source = unquote(advance().text());
            skipToNextStatement();
            return imp;
        }

        // Default: import React
        if (check(TokenType.IDENT) && !checkIdent("from")) {
            imp.defaultName = advance().text();
            skipWhitespace();
            if (matchPunct(",")) skipWhitespace();
        }

        // Namespace: import * as ns
        if (check(TokenType.TEXT) && current().text().equals("*")) {
            advance();
            skipWhitespace();
            if (matchIdent("as")) {
                skipWhitespace();
                if (check(TokenType.IDENT)) imp.namespace = advance().text();
            }
            skipWhitespace();
        }

        // Named: { a, b as c }
        if (match(TokenType.EXPR_OPEN)) {
            while (!isAtEnd() && !check(TokenType.EXPR_CLOSE)) {
                int before = pos;
                skipWhitespace();
                if (check(TokenType.IDENT)) {
                    String name = advance().text();
                    String alias = name;
                    skipWhitespace();
                    if (matchIdent("as")) {
                        skipWhitespace();
                        if (check(TokenType.IDENT)) alias = advance().text();
                    }
                    imp.named.put(name, alias);
                }
                skipWhitespace();
                matchPunct(",");
                if (pos == before) advance();
            }
            match(TokenType.EXPR_CLOSE);
        }

        skipWhitespace();
        if (matchIdent("from")) {
            skipWhitespace();
            if (check(TokenType.STRING)) {
                imp.source = unquote(advance().text());
            } else {
                addWarning("Expected module path after 'from'");
            }
        }

        skipToNextStatement();
        return imp;
    }

    private void parseExport(ParsedFile file) {
        int startLine = advance().line(); // export
        skipWhitespace();
        boolean isDefault = matchIdent("default");
        skipWhitespace();

        if (checkIdent("function") || checkIdent("const")) {
            ComponentNode comp = parseComponent(true, startLine);
            if (comp != null) {
                file.components.add(comp);
                file.exports.add(comp.name);
            }
            return;
        }

        // export { A, B as C }
        if (match(TokenType.EXPR_OPEN)) {
            while (!isAtEnd() && !check(TokenType.EXPR_CLOSE)) {
                int before = pos;
                skipWhitespace();
                if (check(TokenType.IDENT)) {
                    String name = advance().text();
                    skipWhitespace();
                    if (matchIdent("as")) {
                        skipWhitespace();
                        if (check(TokenType.IDENT)) name = advance().text();
                    }
                    file.exports.add(name);
                }
                skipWhitespace();
                matchPunct(",");
                if (pos == before) advance();
            }
            match(TokenType.EXPR_CLOSE);
            return;
        }

        // export default UserList;
        if (isDefault && check(TokenType.IDENT) && !STATEMENT_KEYWORDS.contains(current().text())) {
            file.exports.add(advance().text());
        }
    }

    // ==============================================================
    // Componentes
    // ==============================================================

    private ComponentNode parseComponent(boolean exported, int startLine) {
        boolean isArrow;
        if (matchIdent("const")) {
            isArrow = true;
        } else if (matchIdent("function")) {
            isArrow = false;
        } else {
            return null;
        }
        skipWhitespace();

        if (!check(TokenType.IDENT)) return null; // const [a, b] = ..., function (...) anónima
        String name = advance().text();

        // minúscula y no es un hook (useAlgo): no es un componente
        if (Character.isLowerCase(name.charAt(0)) && !name.startsWith("use")) {
            skipToNextStatement();
            return null;
        }

        ComponentNode comp = new ComponentNode(name, exported, startLine);
        skipWhitespace();

        if (isArrow) {
            // const Card: React.FC<Props> = ...
            if (matchPunct(":")) {
                while (!isAtEnd() && !checkPunct("=") && !checkStatementStart()) advance();
            }
            if (!matchPunct("=")) {
                skipToNextStatement();
                return null;
            }
            skipWhitespace();
            if (matchIdent("async")) skipWhitespace();

            if (matchPunct("(")) {
                parseParams(comp);
            } else if (check(TokenType.IDENT)) {
                comp.params.add(Prop.of(advance().text()));
            } else {
                skipToNextStatement();
                return null;
            }
            skipWhitespace();
            if (matchPunct(":")) skipTypeAnnotation();

            if (!matchPunct("=>")) {
                // const Title = (algo) sin flecha: no es una función
                skipToNextStatement();
                return null;
            }
            skipWhitespace();

            if (check(TokenType.EXPR_OPEN)) {
                comp.body = parseBlockBody(comp);
            } else {
                comp.body = parseImplicitReturn();
            }
            return comp;
        }

        if (matchPunct("(")) parseParams(comp);

        // Buscar la '{' del cuerpo (saltando tipos de retorno)
        while (!isAtEnd() && !check(TokenType.EXPR_OPEN)) {
            if (checkStatementStart()) {
                addWarning("Missing body for function " + name);
                return comp;
            }
            advance();
        }
        if (!isAtEnd()) comp.body = parseBlockBody(comp);
        return comp;
    }

    /** Parámetros tras el '(' ya consumido; deja el cursor después del ')'. */
    private void parseParams(ComponentNode comp) {
        skipWhitespace();

        if (match(TokenType.EXPR_OPEN)) {
            comp.destructuredParams = true;
            while (!isAtEnd() && !check(TokenType.EXPR_CLOSE)) {
                int before = pos;
                skipWhitespace();
                boolean rest = matchPunct("...");
                if (check(TokenType.IDENT)) {
                    String propName = advance().text();
                    String defaultValue = null;
                    skipWhitespace();

                    // { user: alias } o { user: { name } }
                    if (matchPunct(":")) {
                        skipWhitespace();
                        if (check(TokenType.IDENT)) {
                            propName = advance().text();
                        } else if (check(TokenType.EXPR_OPEN)) {
                            skipBalanced();
                        }
                        skipWhitespace();
                    }

                    if (matchPunct("=")) {
                        skipWhitespace();
                        defaultValue = check(TokenType.STRING) ? advance().text() : collectDefaultValue();
                    }
                    comp.params.add(new Prop(propName, defaultValue, rest));
                }
                skipWhitespace();
                matchPunct(",");
                if (pos == before) advance();
            }
            match(TokenType.EXPR_CLOSE);
        } else if (check(TokenType.IDENT)) {
            comp.params.add(Prop.of(advance().text()));
        }

        // Hasta el ')' de cierre (anotaciones de tipo, etc.)
        int depth = 0;
        while (!isAtEnd()) {
            if (checkPunct("(")) {
                depth++;
            } else if (checkPunct(")")) {
                if (depth == 0) {
                    advance();
                    return;
                }
                depth--;
            }
            advance();
        }
        addWarning("Expected ) to close parameter list of " + comp.name);
    }

    /** Valor por defecto complejo: texto crudo hasta la ',' o el cierre al mismo nivel. */
    private String collectDefaultValue() {
        StringBuilder val = new StringBuilder();
        int depth = 0;
        while (!isAtEnd()) {
            Token tok = current();
            if (tok.is(TokenType.EXPR_OPEN) || tok.isPunct("(") || tok.isPunct("[")) {
                depth++;
            } else if (tok.is(TokenType.EXPR_CLOSE) || tok.isPunct(")") || tok.isPunct("]")) {
                if (depth == 0) break;
                depth--;
            } else if (tok.isPunct(",") && depth == 0) {
                break;
            }
            val.append(tok.text());
            advance();
        }
        return val.toString().trim();
    }

    private void skipTypeAnnotation() {
        while (!isAtEnd() && !checkPunct("=>") && !check(TokenType.EXPR_OPEN) && !checkStatementStart()) {
            advance();
        }
    }

    /**
     * Recorre el bloque del componente desde su '{' hasta la '}' de cierre: registra hooks
     * y toma como cuerpo el primer {@code return <...>} del nivel del propio componente.
     */
    private JsxNode parseBlockBody(ComponentNode comp) {
        int depth = 0;
        JsxNode body = null;
        pendingBinding = null;

        while (!isAtEnd()) {
            Token tok = current();

            if (tok.is(TokenType.EXPR_OPEN)) {
                depth++;
            } else if (tok.is(TokenType.EXPR_CLOSE)) {
                depth--;
                if (depth <= 0) {
                    advance();
                    break;
                }
            } else if (tok.isPunct(";")) {
                pendingBinding = null;
            } else if (tok.is(TokenType.IDENT)) {
                String word = tok.text();

                if (word.equals("const") || word.equals("let") || word.equals("var")) {
                    pendingBinding = peekBindingName();
                } else if (HookKind.isHookName(word) && nextSignificantIsCall()) {
                    detectHook(comp, tok);
                } else if (word.equals("return") && depth == 1 && body == null) {
                    advance();
                    skipWhitespace();
                    if (matchPunct("(")) skipWhitespace();
                    if (check(TokenType.TAG_OPEN)) {
                        body = parseNode();
                    }
                    continue;
                }
            }
            advance();
        }
        return body;
    }

    /** {@code => ( <div/> )} o {@code => <div/>}. */
    private JsxNode parseImplicitReturn() {
        boolean paren = matchPunct("(");
        skipWhitespace();
        if (!check(TokenType.TAG_OPEN)) {
            skipToNextStatement();
            return null;
        }
        JsxNode body = parseNode();
        if (paren) {
            skipWhitespace();
            if (!matchPunct(")")) addWarning("Expected ) after implicit return");
        }
        return body;
    }

    private void detectHook(ComponentNode comp, Token tok) {
        HookKind kind = HookKind.of(tok.text());
        comp.hooks.add(new Hook(kind, tok.text(), pendingBinding, tok.line()));
        suggestions.add(new Suggestion(tok.line(), tok.text(), kind.hint(), kind.category()));
        pendingBinding = null;
    }

    /** Nombre declarado tras const/let/var: {@code x}, {@code [x, setX]} o {@code {x, y}}. */
    private String peekBindingName() {
        int i = skipWhitespaceFrom(pos + 1);
        if (i < tokens.size() && (tokens.get(i).isPunct("[") || tokens.get(i).is(TokenType.EXPR_OPEN))) {
            i = skipWhitespaceFrom(i + 1);
        }
        if (i < tokens.size() && tokens.get(i).is(TokenType.IDENT)) return tokens.get(i).text();
        return null;
    }

    private boolean nextSignificantIsCall() {
        int i = skipWhitespaceFrom(pos + 1);
        if (i >= tokens.size()) return false;
        Token next = tokens.get(i);
        return next.isPunct("(") || next.is(TokenType.TAG_OPEN); // useState<string>(
    }

    // ==============================================================
    // Marcado JSX
    // ==============================================================

    private JsxNode parseNode() {
        skipWhitespace();
        if (isAtEnd()) return null;

        if (check(TokenType.EXPR_OPEN)) return parseExpression();
        if (check(TokenType.TAG_OPEN)) return parseElement();
        return parseText();
    }

    private JsxNode parseElement() {
        Token open = advance(); // <
        skipWhitespace();

        // Fragmento <>
        if (match(TokenType.TAG_CLOSE)) {
            return parseFragment(open.line());
        }

        if (!check(TokenType.IDENT)) {
            addWarning("Expected tag name after <");
            return null;
        }

        String tagName = parseTagName();
        ElementNode el = new ElementNode(tagName, open.line());

        while (!isAtEnd() && !check(TokenType.TAG_CLOSE) && !check(TokenType.SELF_CLOSE)) {
            skipWhitespace();
            if (isAtEnd() || check(TokenType.TAG_CLOSE) || check(TokenType.SELF_CLOSE)) break;

            int before = pos;
            Attribute attr = parseAttribute();
            if (attr != null) {
                el.attributes.add(attr);
            } else if (pos == before) {
                addWarning("Unexpected '" + current().text() + "' in <" + tagName + ">");
                advance();
            }
        }

        if (match(TokenType.SELF_CLOSE)) {
            el.isSelfClosing = true;
            return finishElement(el);
        }
        if (!match(TokenType.TAG_CLOSE)) {
            addWarning("Expected > to close tag <" + tagName + ">");
            return finishElement(el);
        }

        // Hijos
        while (!isAtEnd()) {
            skipWhitespace();
            if (check(TokenType.TAG_END)) break;

            int before = pos;
            JsxNode child = parseNode();
            if (child != null) {
                el.children.add(child);
            } else if (pos == before) {
                break;
            }
        }

        // Etiqueta de cierre
        Token end = current();
        if (match(TokenType.TAG_END)) {
            skipWhitespace();
            String closing = check(TokenType.IDENT) ? parseTagName() : "";
            if (!closing.equals(tagName)) {
                addWarning(end, String.format("Mismatched closing tag: expected </%s>, got </%s>", tagName, closing));
            }
            skipWhitespace();
            if (!match(TokenType.TAG_CLOSE)) {
                addWarning("Expected > to close </" + tagName + ">");
            }
        } else {
            addWarning("Unclosed element <" + tagName + ">");
        }

        return finishElement(el);
    }

    /** Nombre de etiqueta, incluidos nombres con punto ({@code React.Fragment}, {@code Tabs.Panel}). */
    private String parseTagName() {
        StringBuilder name = new StringBuilder(advance().text());
        while (checkPunct(".") && peekType(1) == TokenType.IDENT) {
            advance();
            name.append('.').append(advance().text());
        }
        return name.toString();
    }

    private JsxNode finishElement(ElementNode el) {
        if (el.tagName.equals("Fragment") || el.tagName.equals("React.Fragment")) {
            FragmentNode frag = new FragmentNode(el.line);
            frag.children.addAll(el.children);
            return frag;
        }
        return el;
    }

    private JsxNode parseFragment(int line) {
        FragmentNode frag = new FragmentNode(line);

        while (!isAtEnd()) {
            skipWhitespace();

            // </>
            if (match(TokenType.TAG_END)) {
                skipWhitespace();
                if (!match(TokenType.TAG_CLOSE)) addWarning("Expected </> to close fragment");
                return frag;
            }

            int before = pos;
            JsxNode child = parseNode();
            if (child != null) {
                frag.children.add(child);
            } else if (pos == before) {
                break;
            }
        }
        addWarning("Unclosed fragment <>");
        return frag;
    }

    private Attribute parseAttribute() {
        // Spread {...props}
        if (check(TokenType.EXPR_OPEN)) {
            int start = pos;
            advance();
            skipWhitespace();
            if (matchPunct("...")) {
                ExpressionNode spread = parseExpressionContent();
                return Attribute.spread(spread.raw);
            }
            pos = start;
            addWarning("Unexpected expression in attribute list");
            skipBalanced();
            return null;
        }

        if (!check(TokenType.IDENT)) return null;

        Token nameToken = advance();
        Attribute attr = Attribute.named(nameToken.text());
        skipWhitespace();

        if (!matchPunct("=")) return attr; // booleano: <input disabled/>
        skipWhitespace();

        if (check(TokenType.STRING)) {
            attr.value = unquote(advance().text());
            return attr;
        }

        if (match(TokenType.EXPR_OPEN)) {
            ExpressionNode expr = parseExpressionContent();
            attr.expression = expr;
            if (EventHandler.isEventAttribute(attr.name)) {
                attr.eventHandler = parseEventHandler(attr.name, expr.raw, expr.line);
            }
            return attr;
        }

        addWarning("Expected value for attribute " + attr.name);
        return attr;
    }

    private EventHandler parseEventHandler(String eventType, String body, int line) {
        Set<String> setters = new LinkedHashSet<>();
        Matcher sm = SETTER_CALL.matcher(body);
        while (sm.find()) setters.add(sm.group(1));

        Set<String> names = new LinkedHashSet<>();
        Matcher im = LOWER_IDENT.matcher(body);
        while (im.find()) {
            String ident = im.group(1);
            if (HANDLER_EXCLUDED.contains(ident) || SETTER_NAME.matcher(ident).matches()) continue;
            names.add(ident);
        }

        return new EventHandler(eventType, body, body.contains("=>"),
                new ArrayList<>(setters), new ArrayList<>(names), line);
    }

    private JsxNode parseText() {
        StringBuilder content = new StringBuilder();
        int startLine = current().line();

        while (!isAtEnd()) {
            Token tok = current();
            if (tok.is(TokenType.TAG_OPEN) || tok.is(TokenType.TAG_END) || tok.is(TokenType.EXPR_OPEN)) break;
            content.append(tok.text());
            advance();
        }

        String text = content.toString().trim();
        return text.isEmpty() ? null : new TextNode(text, startLine);
    }

    // ==============================================================
    // Expresiones {...}
    // ==============================================================

    private JsxNode parseExpression() {
        advance(); // {
        ExpressionNode expr = parseExpressionContent();
        JsxNode analyzed = analyzeExpression(expr.raw, new Position(expr.line, expr.column));
        return analyzed != null ? analyzed : expr;
    }

    /** Texto crudo entre llaves balanceadas; el '{' inicial ya está consumido. */
    private ExpressionNode parseExpressionContent() {
        StringBuilder content = new StringBuilder();
        int depth = 1;
        int line = -1;
        int column = 1;
        boolean closed = false;

        while (!isAtEnd()) {
            Token tok = current();
            if (tok.is(TokenType.EXPR_OPEN)) {
                depth++;
            } else if (tok.is(TokenType.EXPR_CLOSE)) {
                depth--;
                if (depth == 0) {
                    advance();
                    closed = true;
                    break;
                }
            }
            if (line < 0 && !tok.is(TokenType.WHITESPACE)) {
                line = tok.line();
                column = tok.column();
            }
            content.append(tok.text());
            advance();
        }

        if (!closed) addWarning("Unclosed expression {");
        if (line < 0) {
            line = current().line();
            column = current().column();
        }
        return new ExpressionNode(content.toString().trim(), line, column);
    }

    /**
     * Intenta reconocer, en orden: iteración, guarda (&&) y ternario.
     *
     * @param at posición absoluta del primer carácter de {@code raw}
     * @return el nodo reconocido, o null si no encaja en ninguna forma
     */
    private JsxNode analyzeExpression(String raw, Position at) {
        int line = at.line();
        JsxNode node = analyzeIteration(raw, at);
        if (node != null) return node;

        // cond && <X/>
        Matcher guard = GUARD_EXPR.matcher(raw);
        if (guard.lookingAt()) {
            String condition = guard.group(1).trim();
            String body = stripOuterParens(raw.substring(guard.end()));
            return new GuardNode(condition, parseBranch(body, at.of(raw, body, guard.end())), line);
        }

        // cond ? <A/> : <B/>
        Matcher ternary = TERNARY_EXPR.matcher(raw);
        if (ternary.lookingAt()) {
            String condition = ternary.group(1).trim();
            String rest = raw.substring(ternary.end());
            int colon = findTernaryColon(rest);
            if (colon > 0) {
                String consequent = stripOuterParens(rest.substring(0, colon));
                String alternate = stripOuterParens(rest.substring(colon + 1));
                int altOffset = ternary.end() + colon + 1;
                return new TernaryNode(condition,
                        parseBranch(consequent, at.of(raw, consequent, ternary.end())),
                        parseBranch(alternate, at.of(raw, alternate, altOffset)),
                        line);
            }
        }

        return null;
    }

    private JsxNode analyzeIteration(String raw, Position at) {
        int line = at.line();
        Matcher m = MAP_EXPR.matcher(raw);
        if (!m.lookingAt()) return null;

        String collection = m.group(1);
        String itemVar = m.group(2);
        String indexVar = m.group(3);

        int start = skipSpaces(raw, m.end());
        String bodyText;

        if (start < raw.length() && raw.charAt(start) == '(') {
            // (...) : el interior hasta el ')' que lo cierra
            int close = VariableExtractor.findMatchingParen(raw, start + 1);
            start++;
            bodyText = raw.substring(start, close > 0 ? close - 1 : raw.length());
            bodyText = trimTrailing(bodyText, " \t\r\n)");
        } else if (start < raw.length() && raw.charAt(start) == '{') {
            // { if (!x) return null; return (<li/>); }
            int brace = raw.lastIndexOf('}');
            int ret = markupReturn(raw, start, brace);
            if (ret < 0) {
                return new EachNode(collection, itemVar, indexVar, null, line);
            }
            start = ret;
            bodyText = stripOuterParens(trimTrailing(raw.substring(start, brace), " \t\r\n;"));
        } else {
            bodyText = trimTrailing(raw.substring(start), " \t\r\n)");
        }

        JsxNode body = parseBranch(bodyText, at.of(raw, bodyText.trim(), start));
        return new EachNode(collection, itemVar, indexVar, body, line);
    }

    /**
     * Rama de un &&, ternario o map: marcado si empieza con '<'; si no, se intenta
     * reconocer como expresión (map anidado, ternario encadenado) antes de parsearla como marcado.
     */
    private JsxNode parseBranch(String text, Position at) {
        String t = text.trim();
        if (t.isEmpty() || t.equals("null") || t.equals("undefined") || t.equals("false")) return null;

        if (!t.startsWith("<")) {
            JsxNode analyzed = analyzeExpression(t, at);
            if (analyzed != null) return analyzed;
        }
        return subParse(t, at);
    }

    /** Lexer + parser nuevos sobre la subcadena; sus warnings se suman a los nuestros. */
    private JsxNode subParse(String text, Position at) {
        JsxParser sub = new JsxParser(new JsxLexer(text, at.line(), at.column()).tokenize());
        JsxNode node = sub.parseMarkup();
        warnings.addAll(sub.warnings);
        return node;
    }

    /**
     * Posición del ':' que separa consecuente y alternativa.
     * Cuenta profundidad con ( [ { y también con cada '?' anidado; el ':' nunca la decrementa,
     * así que con ternarios anidados en el consecuente puede no encontrar el separador.
     *
     * @return índice del ':' o -1
     */
    public static int findTernaryColon(String s) {
        int depth = 0;
        for (int i = 0; i < s.length(); i++) {
            switch (s.charAt(i)) {
                case '(', '[', '{', '?' -> depth++;
                case ')', ']', '}' -> depth--;
                case ':' -> {
                    if (depth == 0) return i;
                }
                default -> { }
            }
        }
        return -1;
    }

    /** Quita paréntesis externos solo si abarcan todo el texto. */
    public static String stripOuterParens(String s) {
        String t = s.trim();
        if (!t.startsWith("(")) return t;

        int depth = 0;
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    if (i < t.length() - 1) return t; // no son externos: (a) && (b)
                    return t.substring(1, t.length() - 1).trim();
                }
            }
        }
        return t;
    }

    // ==============================================================
    // Helpers
    // ==============================================================

    private Token current() {
        return pos < tokens.size() ? tokens.get(pos) : tokens.get(tokens.size() - 1);
    }

    private TokenType peekType(int ahead) {
        int i = pos + ahead;
        return i < tokens.size() ? tokens.get(i).type() : TokenType.EOF;
    }

    private Token advance() {
        Token tok = current();
        if (!isAtEnd()) pos++;
        return tok;
    }

    private boolean isAtEnd() {
        return pos >= tokens.size() || tokens.get(pos).is(TokenType.EOF);
    }

    private boolean check(TokenType type) {
        return !tokens.isEmpty() && current().is(type);
    }

    private boolean checkIdent(String value) {
        return !tokens.isEmpty() && current().isIdent(value);
    }

    private boolean checkPunct(String value) {
        return !tokens.isEmpty() && current().isPunct(value);
    }

    private boolean checkStatementStart() {
        return check(TokenType.IDENT) && STATEMENT_KEYWORDS.contains(current().text());
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchIdent(String value) {
        if (checkIdent(value)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchPunct(String value) {
        if (checkPunct(value)) {
            advance();
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (check(TokenType.WHITESPACE)) advance();
    }

    private int skipWhitespaceFrom(int i) {
        while (i < tokens.size() && tokens.get(i).is(TokenType.WHITESPACE)) i++;
        return i;
    }

    /** Salta un bloque {...} completo empezando en su '{'. */
    private void skipBalanced() {
        int depth = 0;
        while (!isAtEnd()) {
            if (check(TokenType.EXPR_OPEN)) {
                depth++;
            } else if (check(TokenType.EXPR_CLOSE)) {
                depth--;
                if (depth <= 0) {
                    advance();
                    return;
                }
            }
            advance();
        }
    }

    private void skipToNextStatement() {
        int depth = 0;
        while (!isAtEnd()) {
            Token tok = current();
            if (tok.is(TokenType.EXPR_OPEN)) {
                depth++;
            } else if (tok.is(TokenType.EXPR_CLOSE)) {
                depth--;
                if (depth < 0) return;
            }
            if (depth == 0 && tok.is(TokenType.IDENT) && STATEMENT_KEYWORDS.contains(tok.text())) return;
            advance();
        }
    }

    private void addWarning(String message) {
        addWarning(current(), message);
    }

    private void addWarning(Token at, String message) {
        warnings.add(new Warning(at.line(), at.column(), message));
    }

    private static String unquote(String literal) {
        if (literal.length() >= 2) {
            char first = literal.charAt(0);
            char last = literal.charAt(literal.length() - 1);
            if (first == last && (first == '"' || first == '\'' || first == '`')) {
                return literal.substring(1, literal.length() - 1);
            }
        }
        return literal;
    }

    private static int skipSpaces(String s, int i) {
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
        return i;
    }

    private static String trimTrailing(String s, String chars) {
        int end = s.length();
        while (end > 0 && chars.indexOf(s.charAt(end - 1)) >= 0) end--;
        return s.substring(0, end);
    }

    /**
     * Offset tras el {@code return} cuyo valor es marcado ({@code (} o {@code <}); si ninguno lo es,
     * el último antes de {@code end}. -1 si no hay ninguno.
     */
    private static int markupReturn(String raw, int from, int end) {
        Matcher ret = RETURN_WORD.matcher(raw);
        int last = -1;
        int searchFrom = from;
        while (searchFrom < raw.length() && ret.find(searchFrom) && ret.end() <= end) {
            int value = skipSpaces(raw, ret.end());
            if (value < raw.length() && (raw.charAt(value) == '(' || raw.charAt(value) == '<')) return ret.end();
            last = ret.end();
            searchFrom = ret.end();
        }
        return last;
    }

    /** Línea y columna absolutas del primer carácter de una expresión en el fichero. */
    private record Position(int line, int column) {

        /** Posición donde empieza {@code text}, subcadena de {@code raw} a partir de {@code from}. */
        Position of(String raw, String text, int from) {
            int idx = text.isEmpty() ? -1 : raw.indexOf(text, from);
            return at(raw, idx < 0 ? from : idx);
        }

        /** Posición del primer carácter no blanco de {@code raw} a partir de {@code offset}. */
        Position at(String raw, int offset) {
            int target = skipSpaces(raw, Math.min(offset, raw.length()));
            int newline = raw.lastIndexOf('\n', target - 1);
            int col = newline < 0 ? column + target : target - newline;
            return new Position(line + VariableExtractor.lineAt(raw, target) - 1, col);
        }
    }
}
