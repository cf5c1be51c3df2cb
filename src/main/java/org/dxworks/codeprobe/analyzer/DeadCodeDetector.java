package org.dxworks.codeprobe.analyzer;

import org.dxworks.codeprobe.lexer.Token;
import org.dxworks.codeprobe.lexer.TokenKind;
import org.dxworks.codeprobe.lexer.Tokens;
import org.dxworks.codeprobe.model.DeadCodeIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.dxworks.codeprobe.lexer.Tokens.*;

/**
 * Reports the first statement that follows an unconditional {@code return}, {@code throw},
 * {@code break} or {@code continue} in the same block.
 *
 * <p>A jump that is the body of a braceless {@code if}/{@code else}/{@code for}/{@code while}/{@code do}
 * is conditional and never makes the next statement dead. The jump's own operand may contain
 * braces, parentheses and brackets ({@code return { a: 1 };}), so its statement ends at the first
 * {@code ;} or unmatched {@code }} outside them. Switch labels and hoisted function declarations
 * are reachable even when they follow a jump. One finding is produced per dead region: the scan
 * resumes right after the reported statement, but jumps at the region's own depth are not checked
 * again until the enclosing block or the next switch label ends the region. Jumps in deeper blocks
 * and nested function bodies inside the region are still analyzed.</p>
 */
public final class DeadCodeDetector {

    private static final Set<String> JUMP_KEYWORDS = Set.of("return", "throw", "break", "continue");
    private static final Set<String> BRACELESS_CONTROL = Set.of("if", "else", "for", "while", "do");
    private static final Set<String> SWITCH_LABELS = Set.of("case", "default");

    private DeadCodeDetector() {}

    public static List<DeadCodeIssue> detect(List<Token> tokens, List<String> lines) {
        List<DeadCodeIssue> issues = new ArrayList<>();
        List<Token> significant = Tokens.significant(tokens);
        int[] depthBefore = braceDepths(significant);
        int regionEnd = -1;
        int regionDepth = -1;

        for (int i = 0; i < significant.size(); i++) {
            Token jump = significant.get(i);
            if (jump.kind != TokenKind.KEYWORD || !JUMP_KEYWORDS.contains(jump.text)) continue;

            int depth = depthBefore[i];
            if (i < regionEnd && depth == regionDepth) continue;
            if (isInsideBracelessControl(significant, i, depthBefore)) continue;

            int next = statementEnd(significant, i + 1);
            if (next >= significant.size()) continue;

            Token follower = significant.get(next);
            if (isPunctuation(follower, "}")) continue;
            if (depthBefore[next] != depth) continue;
            if (isReachableDeclaration(follower)) continue;

            issues.add(new DeadCodeIssue(
                    follower.line,
                    follower.column,
                    "Unreachable code after '" + jump.text + "' (at line " + jump.line + ")",
                    snippet(lines, follower.line)));

            regionEnd = endOfDeadRegion(significant, next, depth, depthBefore);
            regionDepth = depth;
        }
        return issues;
    }

    /**
     * Walks backwards at the jump's depth to the construct that owns it. A closing parenthesis whose
     * opening one follows a control keyword, or a bare {@code else} or {@code do}, makes the jump conditional; a
     * {@code ;} or {@code {} means the jump stands on its own.
     */
    static boolean isInsideBracelessControl(List<Token> significant, int jumpIndex, int[] depthBefore) {
        int jumpDepth = depthBefore[jumpIndex];

        for (int i = jumpIndex - 1; i >= 0; i--) {
            int depth = depthBefore[i];
            if (depth > jumpDepth) continue;
            if (depth < jumpDepth) return false;

            Token token = significant.get(i);
            if (isPunctuation(token, ")")) {
                int open = findOpeningParen(significant, i);
                Token owner = at(significant, open - 1);
                return open >= 0 && owner != null && owner.kind == TokenKind.KEYWORD
                        && BRACELESS_CONTROL.contains(owner.text);
            }
            if (isPunctuation(token, "{") || isPunctuation(token, ";")) return false;
            if (isKeyword(token, "else") || isKeyword(token, "do")) return true;
        }
        return false;
    }

    /**
     * Index of the first token after the statement that starts at {@code from}.
     */
    private static int statementEnd(List<Token> significant, int from) {
        int nesting = 0;
        int j = from;
        while (j < significant.size()) {
            Token token = significant.get(j);
            if (isOpener(token)) {
                nesting++;
            } else if (isCloser(token)) {
                if (nesting == 0) break;
                nesting--;
            } else if (nesting == 0 && isPunctuation(token, ";")) {
                return j + 1;
            }
            j++;
        }
        return j;
    }

    private static int endOfDeadRegion(List<Token> significant, int from, int depth, int[] depthBefore) {
        for (int k = from + 1; k < significant.size(); k++) {
            if (depthBefore[k] != depth) continue;
            Token token = significant.get(k);
            if (isPunctuation(token, "}") || isSwitchLabel(token)) return k;
        }
        return significant.size();
    }

    private static boolean isReachableDeclaration(Token token) {
        return isSwitchLabel(token) || isKeyword(token, "function");
    }

    private static boolean isSwitchLabel(Token token) {
        return token.kind == TokenKind.KEYWORD && SWITCH_LABELS.contains(token.text);
    }

    private static boolean isOpener(Token token) {
        return isPunctuation(token, "{") || isPunctuation(token, "(") || isPunctuation(token, "[");
    }

    private static boolean isCloser(Token token) {
        return isPunctuation(token, "}") || isPunctuation(token, ")") || isPunctuation(token, "]");
    }

    private static String snippet(List<String> lines, int line) {
        if (line < 1 || line > lines.size() || lines.get(line - 1) == null) return "";
        return lines.get(line - 1).trim();
    }
}
