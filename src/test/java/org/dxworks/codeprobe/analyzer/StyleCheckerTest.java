package org.dxworks.codeprobe.analyzer;

import org.dxworks.codeprobe.lexer.Tokenizer;
import org.dxworks.codeprobe.model.StyleIssue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StyleCheckerTest {

    private static List<StyleIssue> check(String source, StyleRules rules) {
        return StyleChecker.check(source, Tokenizer.tokenize(source), rules);
    }

    private static List<StyleIssue> check(String source) {
        return check(source, StyleRules.defaults());
    }

    private static List<StyleIssue> ofRule(List<StyleIssue> issues, String rule) {
        return issues.stream().filter(i -> i.rule.equals(rule)).collect(Collectors.toList());
    }

    @Test
    void noVar_FlagsEachVar() {
        List<StyleIssue> issues = ofRule(check("var x = 1;\nconst y = 2;"), StyleChecker.NO_VAR);
        assertEquals(1, issues.size());
        assertEquals(1, issues.get(0).line);
        assertEquals(1, issues.get(0).column);
        assertEquals("Use 'let' or 'const' instead of 'var'", issues.get(0).message);
    }

    @Test
    void noConsole_NamesTheMethod() {
        List<StyleIssue> issues = ofRule(check("console.log('hello');\nconsole.error('bad');"), StyleChecker.NO_CONSOLE);
        assertEquals(2, issues.size());
        assertEquals("console.log should not be used in production code", issues.get(0).message);
        assertEquals("console.error should not be used in production code", issues.get(1).message);
    }

    @Test
    void noConsole_BareIdentifierIsFine() {
        assertTrue(ofRule(check("const c = console;"), StyleChecker.NO_CONSOLE).isEmpty());
    }

    @Test
    void maxLineLength_ReportsPastTheLimit() {
        String source = "x".repeat(130) + "\nshort line";
        List<StyleIssue> issues = ofRule(check(source), StyleChecker.MAX_LINE_LENGTH);
        assertEquals(1, issues.size());
        assertEquals(1, issues.get(0).line);
        assertEquals(121, issues.get(0).column);
        assertEquals("Line is 130 characters (max 120)", issues.get(0).message);
    }

    @Test
    void maxLineLength_CustomAndDisabled() {
        String source = "x".repeat(50);
        assertTrue(ofRule(check(source, StyleRules.builder().maxLineLength(80).build()), StyleChecker.MAX_LINE_LENGTH).isEmpty());
        assertEquals(1, ofRule(check(source, StyleRules.builder().maxLineLength(40).build()), StyleChecker.MAX_LINE_LENGTH).size());
        assertTrue(ofRule(check(source, StyleRules.builder().maxLineLength(0).build()), StyleChecker.MAX_LINE_LENGTH).isEmpty());
    }

    @Test
    void maxLineLength_NegativeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> StyleRules.builder().maxLineLength(-1));
    }

    @Test
    void trailingWhitespace_PointsAtFirstTrailingBlank() {
        List<StyleIssue> issues = ofRule(check("const x = 1;   \nconst y = 2;\t"), StyleChecker.NO_TRAILING_WHITESPACE);
        assertEquals(2, issues.size());
        assertEquals(1, issues.get(0).line);
        assertEquals(13, issues.get(0).column);
        assertEquals(2, issues.get(1).line);
    }

    @Test
    void trailingWhitespace_CarriageReturnIsNotWhitespace() {
        assertTrue(check("const x = 1;\r\nconst y = 2;\r\n").isEmpty());
    }

    @Test
    void noDebugger() {
        List<StyleIssue> issues = ofRule(check("function f() { debugger; }"), StyleChecker.NO_DEBUGGER);
        assertEquals(1, issues.size());
        assertEquals("'debugger' statement should not be in production code", issues.get(0).message);
    }

    @Test
    void camelCase_FlagsSnakeCase() {
        List<StyleIssue> issues = ofRule(check("const my_variable = 1;"), StyleChecker.CAMEL_CASE);
        assertEquals(1, issues.size());
        assertEquals(7, issues.get(0).column);
        assertEquals("Identifier 'my_variable' does not follow naming conventions (camelCase/PascalCase/SCREAMING_SNAKE)",
                issues.get(0).message);
    }

    @Test
    void camelCase_AcceptsConventionalNames() {
        String source = "const myVariable = 1;\n"
                + "class MyClass {}\n"
                + "const MAX_RETRIES = 5;\n"
                + "const _privateVar = true;\n"
                + "const __internal = 1;\n"
                + "const $el = 1;\n"
                + "const i = 0;\n"
                + "const URL = 'x';\n"
                + "const UUID = 'y';\n";
        assertTrue(ofRule(check(source), StyleChecker.CAMEL_CASE).isEmpty());
    }

    @Test
    void camelCase_PropertyAccessAndModuleNamesAreExempt() {
        String source = "obj.some_prop = 1;\nimport my_mod from './x.js';";
        assertTrue(ofRule(check(source), StyleChecker.CAMEL_CASE).isEmpty());
    }

    @Test
    void isConventionalName() {
        assertTrue(StyleChecker.isConventionalName("camelCase"));
        assertTrue(StyleChecker.isConventionalName("PascalCase"));
        assertTrue(StyleChecker.isConventionalName("SCREAMING_SNAKE_2"));
        assertTrue(StyleChecker.isConventionalName("x"));
        assertFalse(StyleChecker.isConventionalName("snake_case"));
        assertFalse(StyleChecker.isConventionalName("Mixed_Case"));
    }

    @Test
    void cleanCodeHasNoIssues() {
        assertTrue(check("const x = 1;\nconst y = 2;\n").isEmpty());
    }

    @Test
    void rulesCanBeDisabled() {
        StyleRules off = StyleRules.builder()
                .noVar(false).noConsole(false).camelCase(false)
                .noTrailingWhitespace(false).noDebugger(false).maxLineLength(0)
                .build();
        assertTrue(check("var bad_name = 1;  \nconsole.log(1); debugger;", off).isEmpty());
    }

    @Test
    void issuesAreSortedByLineThenColumn() {
        List<StyleIssue> issues = check("var my_x = 1;   \nvar b = 2;\nvar c = 3;");
        assertEquals(List.of(1, 1, 1, 2, 3), issues.stream().map(i -> i.line).collect(Collectors.toList()));
        assertEquals(List.of(1, 5, 14, 1, 1), issues.stream().map(i -> i.column).collect(Collectors.toList()));
        assertEquals(List.of(StyleChecker.NO_VAR, StyleChecker.CAMEL_CASE, StyleChecker.NO_TRAILING_WHITESPACE,
                StyleChecker.NO_VAR, StyleChecker.NO_VAR), issues.stream().map(i -> i.rule).collect(Collectors.toList()));
    }

    @Test
    void toBuilderKeepsSettings() {
        StyleRules rules = StyleRules.builder().maxLineLength(80).noVar(false).build();
        StyleRules copy = rules.toBuilder().noConsole(false).build();
        assertEquals(80, copy.maxLineLength);
        assertFalse(copy.noVar);
        assertFalse(copy.noConsole);
        assertTrue(copy.camelCase);
    }
}
