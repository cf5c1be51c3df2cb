package org.dxworks.codeprobe.analyzer;

import org.dxworks.codeprobe.lexer.Token;
import org.dxworks.codeprobe.lexer.TokenKind;
import org.dxworks.codeprobe.lexer.Tokens;
import org.dxworks.codeprobe.model.ComplexityResult;
import org.dxworks.codeprobe.model.FunctionRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.dxworks.codeprobe.lexer.Tokens.at;
import static org.dxworks.codeprobe.lexer.Tokens.isKeyword;

/**
 * Cyclomatic complexity per function: 1 plus one for each branch indicator in the function's own
 * body. Nested function bodies are skipped and scored on their own.
 *
 * <p>{@code else if} counts once (for the {@code if}); a bare {@code else} counts. A {@code default}
 * label is not a branch, so a switch with N cases adds N.</p>
 */
public final class ComplexityAnalyzer {

    private static final Set<String> BRANCH_KEYWORDS = Set.of("if", "for", "while", "do", "case", "catch");
    private static final Set<String> BRANCH_OPERATORS = Set.of("&&", "||", "??", "?");

    private ComplexityAnalyzer() {}

    public static List<ComplexityResult> analyze(List<Token> tokens) {
        List<Token> significant = Tokens.significant(tokens);
        List<FunctionRecord> functions = FunctionLocator.locate(significant);

        Map<Integer, Integer> bodyEndByStart = new HashMap<>();
        for (FunctionRecord function : functions) {
            bodyEndByStart.put(function.bodyStartIndex, function.bodyEndIndex);
        }

        List<ComplexityResult> results = new ArrayList<>(functions.size());
        for (FunctionRecord function : functions) {
            results.add(new ComplexityResult(function.name, function.declLine,
                    score(significant, function, bodyEndByStart)));
        }
        return results;
    }

    static int score(List<Token> significant, FunctionRecord function, Map<Integer, Integer> bodyEndByStart) {
        int score = 1;
        for (int i = function.bodyStartIndex + 1; i < function.bodyEndIndex; i++) {
            Integer nestedEnd = bodyEndByStart.get(i);
            if (nestedEnd != null) {
                i = nestedEnd;
                continue;
            }
            if (isBranch(significant, i)) {
                score++;
            }
        }
        return score;
    }

    private static boolean isBranch(List<Token> significant, int index) {
        Token token = significant.get(index);
        if (token.kind == TokenKind.KEYWORD) {
            if (token.text.equals("else")) {
                return !isKeyword(at(significant, index + 1), "if");
            }
            return BRANCH_KEYWORDS.contains(token.text);
        }
        return token.kind == TokenKind.OPERATOR && BRANCH_OPERATORS.contains(token.text);
    }
}
