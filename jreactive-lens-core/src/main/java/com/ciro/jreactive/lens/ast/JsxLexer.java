package com.ciro.jreactive.lens.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Lexer O(N) de un solo paso para código JSX.
 * No sabe nada de gramática: solo clasifica caracteres y guarda línea/columna/offset.
 * La concatenación del texto de todos los tokens reproduce la entrada exacta.
 */
public class JsxLexer {

    public enum TokenType {
        TAG_OPEN,      // <
        TAG_CLOSE,     // >
        SELF_CLOSE,    // />
        TAG_END,       // </
        IDENT,
        STRING,        // '...' "..." `...` (con comillas)
        NUMBER,
        BOOLEAN,       // true / false
        NULL,          // null / undefined
        PUNCT,         // = => ... . ( ) [ ] , : ; ? && || !
        WHITESPACE,
        EXPR_OPEN,     // {
        EXPR_CLOSE,    // }
        TEXT,          // cualquier otro carácter suelto
        ERROR,         // string sin cerrar
        EOF
    }

    public record Token(TokenType type, String text, int line, int column, int offset) {

        public boolean is(TokenType t) { return type == t; }

        public boolean isIdent(String value) {
            return type == TokenType.IDENT && text.equals(value);
        }

        public boolean isPunct(String value) {
            return type == TokenType.PUNCT && text.equals(value);
        }
    }

    // Orden importante: los de 3 y 2 caracteres antes que los de 1
    private static final String[] PUNCTUATION = {
        "...", "=>", "&&", "||", "=", ".", "(", ")", "[", "]", ",", ":", ";", "?", "!"
    };

    private final String input;
    private int pos = 0;
    private int line;
    private int column;
    private final List<Token> tokens = new ArrayList<>();

    public JsxLexer(String input) {
        this(input, 1);
    }

    /** @param firstLine línea absoluta del primer carácter (para sub-parseos de expresiones) */
    public JsxLexer(String input, int firstLine) {
        this(input, firstLine, 1);
    }

    /**
     * @param firstLine   línea absoluta del primer carácter
     * @param firstColumn columna absoluta del primer carácter; solo afecta a la primera línea
     */
    public JsxLexer(String input, int firstLine, int firstColumn) {
        this.input = input == null ? "" : input;
        this.line = Math.max(1, firstLine);
        this.column = Math.max(1, firstColumn);
    }

    public static List<Token> lex(String input) {
        return new JsxLexer(input).tokenize();
    }

    public List<Token> tokenize() {
        if (!tokens.isEmpty()) return tokens;

        while (pos < input.length()) {
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", line, column, input.length()));
        return tokens;
    }

    private void scanToken() {
        char ch = input.charAt(pos);

        if (Character.isWhitespace(ch)) {
            scanWhile(TokenType.WHITESPACE, Character::isWhitespace);
            return;
        }

        if (ch == '{') { emitFixed(TokenType.EXPR_OPEN, 1); return; }
        if (ch == '}') { emitFixed(TokenType.EXPR_CLOSE, 1); return; }

        // ==============================================================
        // Marcadores de etiqueta (1-2 caracteres de lookahead)
        // ==============================================================
        if (ch == '<') {
            emitFixed(peekIs(1, '/') ? TokenType.TAG_END : TokenType.TAG_OPEN, peekIs(1, '/') ? 2 : 1);
            return;
        }
        if (ch == '/' && peekIs(1, '>')) { emitFixed(TokenType.SELF_CLOSE, 2); return; }
        if (ch == '>') { emitFixed(TokenType.TAG_CLOSE, 1); return; }

        for (String p : PUNCTUATION) {
            if (input.startsWith(p, pos)) {
                emitFixed(TokenType.PUNCT, p.length());
                return;
            }
        }

        if (ch == '"' || ch == '\'' || ch == '`') {
            scanString(ch);
            return;
        }

        if (Character.isDigit(ch)) {
            scanNumber();
            return;
        }

        if (isIdentStart(ch)) {
            scanIdent();
            return;
        }

        emitFixed(TokenType.TEXT, 1);
    }

    private void scanString(char quote) {
        int start = pos;
        int startLine = line;
        int startCol = column;
        advance(); // comilla de apertura

        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '\\') {
                advance();
                if (pos < input.length()) advance(); // carácter escapado
                continue;
            }
            advance();
            if (c == quote) {
                tokens.add(new Token(TokenType.STRING, input.substring(start, pos), startLine, startCol, start));
                return;
            }
        }
        // Sin cerrar: un único token de error con el resto de la entrada, y seguimos
        tokens.add(new Token(TokenType.ERROR, input.substring(start, pos), startLine, startCol, start));
    }

    private void scanNumber() {
        int start = pos;
        int startLine = line;
        int startCol = column;
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) advance();

        // un solo punto embebido, y solo si le sigue un dígito
        if (pos + 1 < input.length() && input.charAt(pos) == '.' && Character.isDigit(input.charAt(pos + 1))) {
            advance();
            while (pos < input.length() && Character.isDigit(input.charAt(pos))) advance();
        }
        tokens.add(new Token(TokenType.NUMBER, input.substring(start, pos), startLine, startCol, start));
    }

    private void scanIdent() {
        int start = pos;
        int startLine = line;
        int startCol = column;
        while (pos < input.length() && isIdentChar(input.charAt(pos))) advance();

        String value = input.substring(start, pos);
        TokenType type = switch (value) {
            case "true", "false" -> TokenType.BOOLEAN;
            case "null", "undefined" -> TokenType.NULL;
            default -> TokenType.IDENT;
        };
        tokens.add(new Token(type, value, startLine, startCol, start));
    }

    private void scanWhile(TokenType type, IntPredicate accept) {
        int start = pos;
        int startLine = line;
        int startCol = column;
        while (pos < input.length() && accept.test(input.charAt(pos))) advance();
        tokens.add(new Token(type, input.substring(start, pos), startLine, startCol, start));
    }

    private void emitFixed(TokenType type, int length) {
        int start = pos;
        int startLine = line;
        int startCol = column;
        for (int i = 0; i < length && pos < input.length(); i++) advance();
        tokens.add(new Token(type, input.substring(start, pos), startLine, startCol, start));
    }

    private boolean peekIs(int ahead, char expected) {
        int idx = pos + ahead;
        return idx < input.length() && input.charAt(idx) == expected;
    }

    private void advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
    }

    static boolean isIdentStart(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_' || ch == '$';
    }

    // '-' permitido para atributos kebab-case (data-id, aria-selected)
    static boolean isIdentChar(char ch) {
        return isIdentStart(ch) || (ch >= '0' && ch <= '9') || ch == '-';
    }
}
