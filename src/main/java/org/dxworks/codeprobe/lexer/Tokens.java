package org.dxworks.codeprobe.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers shared by the analyzers that walk token sequences.
 */
public final class Tokens {

    private Tokens() {}

    /**
     * Drops comment tokens. Every structural analysis works on this view.
     */
    public static List<Token> significant(List<Token> tokens) {
        List<Token> result = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.isSignificant()) {
                result.add(token);
            }
        }
        return result;
    }

    public static boolean isPunctuation(Token token, String text) {
        return token != null && token.is(TokenKind.PUNCTUATION, text);
    }

    public static boolean isKeyword(Token token, String text) {
        return token != null && token.is(TokenKind.KEYWORD, text);
    }

    public static boolean isOperator(Token token, String text) {
        return token != null && token.is(TokenKind.OPERATOR, text);
    }

    public static boolean isIdentifier(Token token) {
        return token != null && token.kind == TokenKind.IDENTIFIER;
    }

    public static Token at(List<Token> tokens, int index) {
        return index >= 0 && index < tokens.size() ? tokens.get(index) : null;
    }

    /**
     * Index of the {@code )} matching the {@code (} at {@code openIndex}, or -1 when unbalanced.
     */
    public static int findMatchingParen(List<Token> tokens, int openIndex) {
        return findMatching(tokens, openIndex, "(", ")");
    }

    /**
     * Index of the {@code }} matching the {@code {} at {@code openIndex}, or -1 when unbalanced.
     */
    public static int findMatchingBrace(List<Token> tokens, int openIndex) {
        return findMatching(tokens, openIndex, "{", "}");
    }

    /**
     * Index of the {@code (} matching the {@code )} at {@code closeIndex}, scanning backwards.
     */
    public static int findOpeningParen(List<Token> tokens, int closeIndex) {
        int depth = 0;
        for (int i = closeIndex; i >= 0; i--) {
            Token t = tokens.get(i);
            if (isPunctuation(t, ")")) {
                depth++;
            } else if (isPunctuation(t, "(")) {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    private static int findMatching(List<Token> tokens, int openIndex, String open, String close) {
        int depth = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (isPunctuation(t, open)) {
                depth++;
            } else if (isPunctuation(t, close)) {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    /**
     * Brace nesting depth before each token, floored at zero.
     */
    public static int[] braceDepths(List<Token> tokens) {
        int[] depthBefore = new int[tokens.size()];
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            depthBefore[i] = depth;
            Token t = tokens.get(i);
            if (isPunctuation(t, "{")) {
                depth++;
            } else if (isPunctuation(t, "}")) {
                depth = Math.max(0, depth - 1);
            }
        }
        return depthBefore;
    }
}
