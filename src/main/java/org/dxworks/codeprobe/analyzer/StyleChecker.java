package org.dxworks.codeprobe.analyzer;

import org.dxworks.codeprobe.lexer.Token;
import org.dxworks.codeprobe.lexer.TokenKind;
import org.dxworks.codeprobe.model.StyleIssue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import static org.dxworks.codeprobe.lexer.Tokens.*;

/**
 * Line and token level style rules. Issues come back ordered by line, then column.
 */
public final class StyleChecker {

    public static final String MAX_LINE_LENGTH = "max-line-length";
    public static final String NO_TRAILING_WHITESPACE = "no-trailing-whitespace";
    public static final String NO_VAR = "no-var";
    public static final String NO_DEBUGGER = "no-debugger";
    public static final String NO_CONSOLE = "no-console";
    public static final String CAMEL_CASE = "camel-case";

    private static final Comparator<StyleIssue> BY_POSITION =
            Comparator.<StyleIssue>comparingInt(issue -> issue.line).thenComparingInt(issue -> issue.column);

    private static final Set<String> ACRONYMS = Set.of(
            "URL", "ID", "OK", "API", "HTTP", "HTTPS", "JSON", "HTML", "CSS",
            "DOM", "RPC", "SQL", "TCP", "UDP", "TTL", "UUID", "XML");

    private static final Pattern SCREAMING_SNAKE = Pattern.compile("[A-Z][A-Z0-9_]*");
    private static final Pattern PASCAL_CASE = Pattern.compile("[A-Z][a-zA-Z0-9]*");
    private static final Pattern CAMEL_CASE_NAME = Pattern.compile("_?[a-z][a-zA-Z0-9]*");
    private static final Pattern UNDERSCORE_PRIVATE = Pattern.compile("__?[a-zA-Z][a-zA-Z0-9]*");
    private static final Pattern DOLLAR_PREFIXED = Pattern.compile("\\$[a-zA-Z0-9_]*");

    private StyleChecker() {}

    public static List<StyleIssue> check(String source, List<Token> tokens, StyleRules rules) {
        List<StyleIssue> issues = new ArrayList<>();
        checkLines(source, rules, issues);
        checkTokens(tokens, rules, issues);
        issues.sort(BY_POSITION);
        return issues;
    }

    private static void checkLines(String source, StyleRules rules, List<StyleIssue> issues) {
        String[] lines = source.split("\n", -1);
        for (int idx = 0; idx < lines.length; idx++) {
            String line = stripCarriageReturn(lines[idx]);
            int lineNumber = idx + 1;

            if (rules.maxLineLength > 0 && line.length() > rules.maxLineLength) {
                issues.add(new StyleIssue(lineNumber, rules.maxLineLength + 1, MAX_LINE_LENGTH,
                        "Line is " + line.length() + " characters (max " + rules.maxLineLength + ")"));
            }

            if (rules.noTrailingWhitespace) {
                int end = line.length();
                int start = end;
                while (start > 0 && (line.charAt(start - 1) == ' ' || line.charAt(start - 1) == '\t')) {
                    start--;
                }
                if (start < end) {
                    issues.add(new StyleIssue(lineNumber, start + 1, NO_TRAILING_WHITESPACE, "Trailing whitespace"));
                }
            }
        }
    }

    private static void checkTokens(List<Token> tokens, StyleRules rules, List<StyleIssue> issues) {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.isSignificant()) continue;

            if (rules.noVar && isKeyword(token, "var")) {
                issues.add(new StyleIssue(token.line, token.column, NO_VAR, "Use 'let' or 'const' instead of 'var'"));
            }

            if (rules.noDebugger && isKeyword(token, "debugger")) {
                issues.add(new StyleIssue(token.line, token.column, NO_DEBUGGER,
                        "'debugger' statement should not be in production code"));
            }

            if (rules.noConsole && token.is(TokenKind.IDENTIFIER, "console")
                    && isPunctuation(at(tokens, i + 1), ".")) {
                Token method = at(tokens, i + 2);
                String methodName = method != null ? method.text : "";
                issues.add(new StyleIssue(token.line, token.column, NO_CONSOLE,
                        "console." + methodName + " should not be used in production code"));
            }

            if (rules.camelCase && token.kind == TokenKind.IDENTIFIER && !isExemptFromNaming(tokens, i)
                    && !isConventionalName(token.text)) {
                issues.add(new StyleIssue(token.line, token.column, CAMEL_CASE,
                        "Identifier '" + token.text
                                + "' does not follow naming conventions (camelCase/PascalCase/SCREAMING_SNAKE)"));
            }
        }
    }

    /** Property names after a dot and names right after {@code import}/{@code from} are not ours to rename. */
    private static boolean isExemptFromNaming(List<Token> tokens, int index) {
        if (isPunctuation(at(tokens, index - 1), ".")) return true;
        Token previous = previousSignificant(tokens, index);
        return isKeyword(previous, "from") || isKeyword(previous, "import");
    }

    static boolean isConventionalName(String name) {
        if (ACRONYMS.contains(name) || name.length() == 1) return true;
        return SCREAMING_SNAKE.matcher(name).matches()
                || PASCAL_CASE.matcher(name).matches()
                || CAMEL_CASE_NAME.matcher(name).matches()
                || UNDERSCORE_PRIVATE.matcher(name).matches()
                || DOLLAR_PREFIXED.matcher(name).matches();
    }

    private static Token previousSignificant(List<Token> tokens, int index) {
        for (int i = index - 1; i >= 0; i--) {
            if (tokens.get(i).isSignificant()) return tokens.get(i);
        }
        return null;
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
