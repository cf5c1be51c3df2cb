package org.dxworks.codeprobe.analyzer;

import org.dxworks.codeprobe.lexer.Token;
import org.dxworks.codeprobe.lexer.TokenKind;
import org.dxworks.codeprobe.model.FunctionRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.dxworks.codeprobe.lexer.Tokens.*;

/**
 * Finds functions with block bodies in a significant-token list (comments already removed).
 *
 * <p>Three kinds of sites introduce a function: the {@code function} keyword, the {@code =>}
 * marker and method shorthand ({@code name(params) {}}) in classes and object literals. For
 * {@code function} and method sites the body is located through the parameter list: the opening
 * parenthesis, its depth-matched closing parenthesis, then the {@code {} right after it. A brace
 * inside the parameter list, such as an {@code opts = {}} default, is therefore never taken for
 * the body. Expression-bodied arrows have no block and are skipped.</p>
 */
public final class FunctionLocator {

    public static final String ANONYMOUS = "(anonymous)";
    public static final String ARROW = "(arrow)";

    private static final Set<String> NON_METHOD_KEYWORDS = Set.of(
            "if", "for", "while", "switch", "catch", "with", "function", "super", "import");

    private FunctionLocator() {}

    public static List<FunctionRecord> locate(List<Token> significant) {
        List<FunctionRecord> functions = new ArrayList<>();
        for (int i = 0; i < significant.size(); i++) {
            Token token = significant.get(i);
            FunctionRecord record = null;
            if (isKeyword(token, "function")) {
                record = functionSite(significant, i);
            } else if (isOperator(token, "=>")) {
                record = arrowSite(significant, i);
            } else if (isMethodName(significant, i)) {
                record = methodSite(significant, i);
            }
            if (record != null) {
                functions.add(record);
            }
        }
        return functions;
    }

    private static FunctionRecord functionSite(List<Token> tokens, int index) {
        int j = index + 1;
        if (isOperator(at(tokens, j), "*")) j++;

        String name = null;
        Token candidate = at(tokens, j);
        if (candidate != null && isNameToken(candidate) && isPunctuation(at(tokens, j + 1), "(")) {
            name = candidate.text;
            j++;
        }
        if (!isPunctuation(at(tokens, j), "(")) return null;

        if (name == null) {
            String inferred = inferAssignedName(tokens, index);
            name = inferred != null ? inferred : ANONYMOUS;
        }
        return bodyAfterParameters(tokens, j, name, tokens.get(index).line);
    }

    private static FunctionRecord arrowSite(List<Token> tokens, int index) {
        int bodyStart = index + 1;
        if (!isPunctuation(at(tokens, bodyStart), "{")) return null;

        int paramStart = index;
        Token previous = at(tokens, index - 1);
        if (isPunctuation(previous, ")")) {
            int open = findOpeningParen(tokens, index - 1);
            paramStart = open >= 0 ? open : index - 1;
        } else if (isIdentifier(previous)) {
            paramStart = index - 1;
        }

        String inferred = inferAssignedName(tokens, paramStart);
        return record(tokens, inferred != null ? inferred : ARROW, tokens.get(index).line, bodyStart);
    }

    private static FunctionRecord methodSite(List<Token> tokens, int index) {
        Token name = tokens.get(index);
        return bodyAfterParameters(tokens, index + 1, name.text, name.line);
    }

    /**
     * A name directly followed by {@code (} that is neither a member call target, the name of a
     * {@code function} declaration nor a class heritage call ({@code extends mixin(B) {}}). Keywords
     * such as {@code get}, {@code set} or {@code delete} are valid method names; control keywords are
     * not. Whether it really is a method is settled by the block that must follow its parameter list.
     */
    private static boolean isMethodName(List<Token> tokens, int index) {
        Token token = tokens.get(index);
        if (!isPunctuation(at(tokens, index + 1), "(")) return false;
        if (token.kind == TokenKind.KEYWORD) {
            if (NON_METHOD_KEYWORDS.contains(token.text)) return false;
        } else if (token.kind != TokenKind.IDENTIFIER) {
            return false;
        }

        Token previous = at(tokens, index - 1);
        if (isPunctuation(previous, ".") || isOperator(previous, "?.")) return false;
        if (isKeyword(previous, "function") || isKeyword(previous, "new") || isKeyword(previous, "extends")) return false;
        return !(isOperator(previous, "*") && isKeyword(at(tokens, index - 2), "function"));
    }

    private static FunctionRecord bodyAfterParameters(List<Token> tokens, int openParen, String name, int line) {
        int closeParen = findMatchingParen(tokens, openParen);
        if (closeParen < 0) return null;
        int bodyStart = closeParen + 1;
        if (!isPunctuation(at(tokens, bodyStart), "{")) return null;
        return record(tokens, name, line, bodyStart);
    }

    private static FunctionRecord record(List<Token> tokens, String name, int line, int bodyStart) {
        int bodyEnd = findMatchingBrace(tokens, bodyStart);
        if (bodyEnd < 0) {
            // unclosed body runs to end of input
            bodyEnd = tokens.size() - 1;
        }
        if (bodyEnd <= bodyStart) return null;
        return new FunctionRecord(name, line, bodyStart, bodyEnd);
    }

    /**
     * Name of the assignment or property target in front of a function expression:
     * {@code const name = ...}, {@code name: ...}, {@code this.name = ...}, with an optional {@code async}.
     */
    private static String inferAssignedName(List<Token> tokens, int expressionStart) {
        int k = expressionStart - 1;
        if (isKeyword(at(tokens, k), "async")) k--;

        Token operator = at(tokens, k);
        if (!isOperator(operator, "=") && !isOperator(operator, ":")) return null;

        Token target = at(tokens, k - 1);
        if (target == null) return null;
        if (target.kind == TokenKind.IDENTIFIER) return target.text;
        if (target.kind == TokenKind.STRING && target.text.length() >= 2) {
            return target.text.substring(1, target.text.length() - 1);
        }
        return null;
    }

    private static boolean isNameToken(Token token) {
        return token.kind == TokenKind.IDENTIFIER || token.kind == TokenKind.KEYWORD;
    }
}
