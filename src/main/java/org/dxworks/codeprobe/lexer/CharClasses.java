package org.dxworks.codeprobe.lexer;

/**
 * Single-character predicates used by the {@link Tokenizer} state machine.
 */
public final class CharClasses {

    private CharClasses() {}

    /** Blanks that separate tokens on the same line. Line feeds are handled separately. */
    public static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == '\u000B'
                || c == '\u00A0' || c == '\uFEFF';
    }

    public static boolean isLineFeed(char c) {
        return c == '\n';
    }

    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    public static boolean isDecimalDigitOrSeparator(char c) {
        return isDigit(c) || c == '_';
    }

    public static boolean isHexDigitOrSeparator(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F') || c == '_';
    }

    public static boolean isBinaryDigitOrSeparator(char c) {
        return c == '0' || c == '1' || c == '_';
    }

    public static boolean isOctalDigitOrSeparator(char c) {
        return (c >= '0' && c <= '7') || c == '_';
    }

    public static boolean isRadixMarker(char c) {
        return c == 'x' || c == 'X' || c == 'b' || c == 'B' || c == 'o' || c == 'O';
    }

    public static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    public static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || Character.isDigit(c);
    }

    public static boolean isRegexFlag(char c) {
        return "dgimsuvy".indexOf(c) >= 0;
    }

    public static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
