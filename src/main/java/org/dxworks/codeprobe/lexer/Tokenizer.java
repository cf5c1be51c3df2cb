package org.dxworks.codeprobe.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.dxworks.codeprobe.lexer.CharClasses.*;

/**
 * Hand-written scanner for JavaScript source text.
 *
 * <p>Each call to {@link #tokenize(String)} runs a fresh scanner instance holding the cursor
 * (offset, line, column) and the last significant token, which decides whether a {@code /}
 * opens a regex literal or is the division operator. The scanner never fails on malformed
 * input: unterminated literals are closed at end of line (strings, regexes) or end of input
 * (templates, block comments) and unrecognized characters become {@link TokenKind#UNKNOWN}
 * tokens. Whitespace is skipped, comments are kept.</p>
 */
public final class Tokenizer {

    private static final Set<String> KEYWORDS = Set.of(
            "break", "case", "catch", "class", "const", "continue", "debugger",
            "default", "delete", "do", "else", "export", "extends", "false",
            "finally", "for", "from", "function", "get", "if", "import", "in",
            "instanceof", "let", "new", "null", "of", "return", "set", "static",
            "super", "switch", "this", "throw", "true", "try", "typeof", "undefined",
            "var", "void", "while", "with", "yield", "async", "await");

    /** Keywords after which a {@code /} divides a value. */
    private static final Set<String> VALUE_KEYWORDS = Set.of("this", "true", "false", "null", "undefined");

    // Longest first: the first prefix match wins.
    private static final String[] OPERATORS = {
            ">>>=",
            "**=", "&&=", "||=", "??=", "...", "===", "!==", ">>>", "<<=", ">>=",
            "<=", ">=", "==", "!=", "&&", "||", "??", "++", "--", "+=", "-=", "*=", "/=", "%=",
            "**", "<<", ">>", "=>", "?.", "&=", "|=", "^=",
            "~", "!", "+", "-", "*", "/", "%", "&", "|", "^", "<", ">", "=", "?", ":"
    };

    private static final String PUNCTUATION = "{}()[];,.";

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos;
    private int line = 1;
    private int column = 1;
    private Token lastSignificant;

    private Tokenizer(String source) {
        this.source = source;
    }

    /**
     * Splits {@code source} into tokens in source order.
     *
     * @throws IllegalArgumentException if {@code source} is null
     */
    public static List<Token> tokenize(String source) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        return Collections.unmodifiableList(new Tokenizer(source).run());
    }

    private List<Token> run() {
        while (pos < source.length()) {
            char ch = source.charAt(pos);

            if (isBlank(ch) || isLineFeed(ch)) {
                advance(1);
                continue;
            }

            int startLine = line;
            int startColumn = column;
            int start = pos;

            if (ch == '/' && peek(1) == '/') {
                scanLineComment();
                emit(TokenKind.COMMENT, start, startLine, startColumn);
            } else if (ch == '/' && peek(1) == '*') {
                scanBlockComment();
                emit(TokenKind.COMMENT, start, startLine, startColumn);
            } else if (ch == '`') {
                scanTemplate();
                emit(TokenKind.TEMPLATE, start, startLine, startColumn);
            } else if (isQuote(ch)) {
                scanString(ch);
                emit(TokenKind.STRING, start, startLine, startColumn);
            } else if (isDigit(ch) || (ch == '.' && isDigit(peek(1)))) {
                scanNumber();
                emit(TokenKind.NUMBER, start, startLine, startColumn);
            } else if (isIdentifierStart(ch)) {
                while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
                    advance(1);
                }
                String word = source.substring(start, pos);
                emit(KEYWORDS.contains(word) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER, start, startLine, startColumn);
            } else if (ch == '/' && regexAllowed()) {
                scanRegex();
                emit(TokenKind.REGEX, start, startLine, startColumn);
            } else {
                String operator = matchOperator();
                if (operator != null) {
                    advance(operator.length());
                    emit(TokenKind.OPERATOR, start, startLine, startColumn);
                } else if (PUNCTUATION.indexOf(ch) >= 0) {
                    advance(1);
                    emit(TokenKind.PUNCTUATION, start, startLine, startColumn);
                } else {
                    advance(1);
                    emit(TokenKind.UNKNOWN, start, startLine, startColumn);
                }
            }
        }
        return tokens;
    }

    private void scanLineComment() {
        while (pos < source.length() && !isLineFeed(source.charAt(pos))) {
            advance(1);
        }
    }

    private void scanBlockComment() {
        advance(2);
        while (pos < source.length() && !(source.charAt(pos) == '*' && peek(1) == '/')) {
            advance(1);
        }
        advance(2);
    }

    /**
     * Template literals count open {@code ${} regions. A backtick only closes the literal when no
     * region is open, so templates nested inside an embedded expression stay part of the outer token.
     */
    private void scanTemplate() {
        advance(1);
        int depth = 0;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                advance(2);
            } else if (c == '$' && peek(1) == '{') {
                depth++;
                advance(2);
            } else if (c == '{' && depth > 0) {
                depth++;
                advance(1);
            } else if (c == '}' && depth > 0) {
                depth--;
                advance(1);
            } else if (c == '`' && depth == 0) {
                advance(1);
                return;
            } else {
                advance(1);
            }
        }
    }

    private void scanString(char quote) {
        advance(1);
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                advance(2);
            } else if (c == quote) {
                advance(1);
                return;
            } else if (isLineFeed(c)) {
                // unterminated: the literal ends with its line
                return;
            } else {
                advance(1);
            }
        }
    }

    private void scanNumber() {
        if (source.charAt(pos) == '0' && isRadixMarker(peek(1))) {
            char marker = Character.toLowerCase(peek(1));
            advance(2);
            while (pos < source.length() && isRadixDigit(marker, source.charAt(pos))) {
                advance(1);
            }
        } else {
            skipDecimalDigits();
            if (pos < source.length() && source.charAt(pos) == '.') {
                advance(1);
                skipDecimalDigits();
            }
            if (isExponentStart()) {
                advance(1);
                if (source.charAt(pos) == '+' || source.charAt(pos) == '-') {
                    advance(1);
                }
                skipDecimalDigits();
            }
        }
        if (pos < source.length() && source.charAt(pos) == 'n') {
            advance(1);
        }
    }

    private static boolean isRadixDigit(char marker, char c) {
        return switch (marker) {
            case 'x' -> isHexDigitOrSeparator(c);
            case 'b' -> isBinaryDigitOrSeparator(c);
            default -> isOctalDigitOrSeparator(c);
        };
    }

    private void skipDecimalDigits() {
        while (pos < source.length() && isDecimalDigitOrSeparator(source.charAt(pos))) {
            advance(1);
        }
    }

    private boolean isExponentStart() {
        if (pos >= source.length()) return false;
        char c = source.charAt(pos);
        if (c != 'e' && c != 'E') return false;
        char next = peek(1);
        return isDigit(next) || ((next == '+' || next == '-') && isDigit(peek(2)));
    }

    private void scanRegex() {
        advance(1);
        boolean inClass = false;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                if (isLineFeed(peek(1))) break;
                advance(2);
                continue;
            }
            if (isLineFeed(c)) {
                // unterminated: flags cannot follow
                return;
            }
            advance(1);
            if (c == '[') {
                inClass = true;
            } else if (c == ']') {
                inClass = false;
            } else if (c == '/' && !inClass) {
                break;
            }
        }
        while (pos < source.length() && isRegexFlag(source.charAt(pos))) {
            advance(1);
        }
    }

    /**
     * A slash opens a regex at start of input and after operators, opening brackets, separators
     * and keywords other than the value-producing ones. After a value it divides.
     */
    private boolean regexAllowed() {
        if (lastSignificant == null) return true;
        String text = lastSignificant.text;
        return switch (lastSignificant.kind) {
            case NUMBER, STRING, TEMPLATE, REGEX, IDENTIFIER -> false;
            case KEYWORD -> !VALUE_KEYWORDS.contains(text);
            case PUNCTUATION -> !(")".equals(text) || "]".equals(text) || "}".equals(text));
            default -> true;
        };
    }

    private String matchOperator() {
        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                // `a?.5:1` is a conditional followed by a number, not optional chaining
                if (op.equals("?.") && isDigit(peek(2))) continue;
                return op;
            }
        }
        return null;
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private void advance(int count) {
        for (int k = 0; k < count && pos < source.length(); k++) {
            if (isLineFeed(source.charAt(pos))) {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }
    }

    private void emit(TokenKind kind, int start, int startLine, int startColumn) {
        Token token = new Token(kind, source.substring(start, pos), startLine, startColumn);
        tokens.add(token);
        if (token.isSignificant()) {
            lastSignificant = token;
        }
    }
}
