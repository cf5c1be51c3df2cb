package org.dxworks.codeprobe.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    private static List<String> texts(List<Token> tokens, TokenKind kind) {
        return tokens.stream().filter(t -> t.kind == kind).map(t -> t.text).collect(Collectors.toList());
    }

    @Test
    void tokenize_Keywords() {
        List<Token> tokens = Tokenizer.tokenize("if (x) { return; }");
        assertEquals(List.of("if", "return"), texts(tokens, TokenKind.KEYWORD));
    }

    @Test
    void tokenize_Identifiers() {
        List<Token> tokens = Tokenizer.tokenize("const foo = bar;");
        assertEquals(List.of("foo", "bar"), texts(tokens, TokenKind.IDENTIFIER));
    }

    @Test
    void tokenize_Numbers() {
        List<Token> tokens = Tokenizer.tokenize("42 3.14 0xFF 0b1010 0o777 1_000 .5 1e10 2.5E-3 42n");
        assertEquals(List.of("42", "3.14", "0xFF", "0b1010", "0o777", "1_000", ".5", "1e10", "2.5E-3", "42n"),
                texts(tokens, TokenKind.NUMBER));
    }

    @Test
    void tokenize_ExponentWithoutDigitsIsNotPartOfNumber() {
        List<Token> tokens = Tokenizer.tokenize("1e");
        assertEquals(2, tokens.size());
        assertEquals(new Token(TokenKind.NUMBER, "1", 1, 1), tokens.get(0));
        assertEquals(new Token(TokenKind.IDENTIFIER, "e", 1, 2), tokens.get(1));
    }

    @Test
    void tokenize_Strings() {
        List<Token> tokens = Tokenizer.tokenize("\"hello world\" 'foo bar' \"line1\\nline2\" 'it\\'s'");
        assertEquals(List.of("\"hello world\"", "'foo bar'", "\"line1\\nline2\"", "'it\\'s'"),
                texts(tokens, TokenKind.STRING));
    }

    @Test
    void tokenize_UnterminatedStringEndsAtLineEnd() {
        List<Token> tokens = Tokenizer.tokenize("'abc\nnext");
        assertEquals(new Token(TokenKind.STRING, "'abc", 1, 1), tokens.get(0));
        assertEquals(new Token(TokenKind.IDENTIFIER, "next", 2, 1), tokens.get(1));
    }

    @Test
    void tokenize_TemplateWithNestedTemplate() {
        List<Token> tokens = Tokenizer.tokenize("`${a ? `inner ${b}` : c}` + 1");
        assertEquals(List.of("`${a ? `inner ${b}` : c}`"), texts(tokens, TokenKind.TEMPLATE));
        assertEquals(List.of("+"), texts(tokens, TokenKind.OPERATOR));
    }

    @Test
    void tokenize_TemplateWithObjectLiteralInExpression() {
        List<Token> tokens = Tokenizer.tokenize("`a ${ {x: 1}.x } b`;");
        assertEquals(List.of("`a ${ {x: 1}.x } b`"), texts(tokens, TokenKind.TEMPLATE));
        assertEquals(List.of(";"), texts(tokens, TokenKind.PUNCTUATION));
    }

    @Test
    void tokenize_MultilineTemplateAdvancesLines() {
        List<Token> tokens = Tokenizer.tokenize("`a\nb`\nx");
        assertEquals(new Token(TokenKind.TEMPLATE, "`a\nb`", 1, 1), tokens.get(0));
        assertEquals(new Token(TokenKind.IDENTIFIER, "x", 3, 1), tokens.get(1));
    }

    @Test
    void tokenize_Comments() {
        List<Token> tokens = Tokenizer.tokenize("// line\n/* multi\nline */\nconst x = 1;");
        assertEquals(List.of("// line", "/* multi\nline */"), texts(tokens, TokenKind.COMMENT));
        Token constKeyword = tokens.get(2);
        assertEquals(new Token(TokenKind.KEYWORD, "const", 4, 1), constKeyword);
    }

    @Test
    void tokenize_UnterminatedBlockCommentRunsToEnd() {
        List<Token> tokens = Tokenizer.tokenize("a /* never closed");
        assertEquals(2, tokens.size());
        assertEquals(new Token(TokenKind.COMMENT, "/* never closed", 1, 3), tokens.get(1));
    }

    @Test
    void tokenize_OperatorsLongestFirst() {
        List<Token> tokens = Tokenizer.tokenize("a === b && c !== d || e >= f ?? g >>>= 1 ... x ** y => z");
        assertEquals(List.of("===", "&&", "!==", "||", ">=", "??", ">>>=", "...", "**", "=>"),
                texts(tokens, TokenKind.OPERATOR));
    }

    @Test
    void tokenize_OptionalChaining() {
        List<Token> tokens = Tokenizer.tokenize("a?.b?.c");
        assertEquals(List.of("?.", "?."), texts(tokens, TokenKind.OPERATOR));
    }

    @Test
    void tokenize_ConditionalBeforeDecimalIsNotOptionalChaining() {
        List<Token> tokens = Tokenizer.tokenize("a?.5:1");
        assertEquals(List.of("?", ":"), texts(tokens, TokenKind.OPERATOR));
        assertEquals(List.of(".5", "1"), texts(tokens, TokenKind.NUMBER));
    }

    @Test
    void tokenize_Punctuation() {
        List<Token> tokens = Tokenizer.tokenize("{ ( [ ] ) } ; , .");
        assertEquals(List.of("{", "(", "[", "]", ")", "}", ";", ",", "."), texts(tokens, TokenKind.PUNCTUATION));
    }

    @Test
    void tokenize_RegexVersusDivision() {
        String source = "const re = /abc/g;\nconst x = 10 / 2;\nif (/test/.test(s)) {}\nconst y = a / b / c;";
        List<Token> tokens = Tokenizer.tokenize(source);
        assertEquals(List.of("/abc/g", "/test/"), texts(tokens, TokenKind.REGEX));
        assertEquals(3, texts(tokens, TokenKind.OPERATOR).stream().filter("/"::equals).count());
    }

    @Test
    void tokenize_RegexWithClassContainingSlash() {
        List<Token> tokens = Tokenizer.tokenize("x = /[a-z/]+\\//gi;");
        assertEquals(List.of("/[a-z/]+\\//gi"), texts(tokens, TokenKind.REGEX));
    }

    @Test
    void tokenize_DivisionAfterClosingBracketAndValueKeyword() {
        List<Token> tokens = Tokenizer.tokenize("(a) / 2; arr[0] / 2; this / 2");
        assertTrue(texts(tokens, TokenKind.REGEX).isEmpty());
    }

    @Test
    void tokenize_RegexAfterKeyword() {
        List<Token> tokens = Tokenizer.tokenize("return /x+/.test(s)");
        assertEquals(List.of("/x+/"), texts(tokens, TokenKind.REGEX));
    }

    @Test
    void tokenize_UnknownCharacters() {
        List<Token> tokens = Tokenizer.tokenize("a # b @ c");
        assertEquals(List.of("#", "@"), texts(tokens, TokenKind.UNKNOWN));
    }

    @Test
    void tokenize_PrivateFieldSplitsIntoUnknownAndIdentifier() {
        List<Token> tokens = Tokenizer.tokenize("this.#items");
        assertEquals(List.of("#"), texts(tokens, TokenKind.UNKNOWN));
        assertEquals(List.of("items"), texts(tokens, TokenKind.IDENTIFIER));
    }

    @Test
    void tokenize_LineAndColumnTracking() {
        List<Token> tokens = Tokenizer.tokenize("const a = 1;\n  let b = 2;\r\n\tc");
        assertEquals(new Token(TokenKind.KEYWORD, "const", 1, 1), tokens.get(0));
        assertEquals(new Token(TokenKind.IDENTIFIER, "a", 1, 7), tokens.get(1));
        assertEquals(new Token(TokenKind.KEYWORD, "let", 2, 3), tokens.get(5));
        assertEquals(new Token(TokenKind.IDENTIFIER, "c", 3, 2), tokens.get(tokens.size() - 1));
    }

    @Test
    void tokenize_EmptyAndBlankSource() {
        assertTrue(Tokenizer.tokenize("").isEmpty());
        assertTrue(Tokenizer.tokenize("  \n\t\r\n").isEmpty());
    }

    @Test
    void tokenize_NullSourceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Tokenizer.tokenize(null));
    }

    @Test
    void tokenize_IsDeterministic() {
        String source = "export async function f(a = {}) { return a?.b ?? /re/g.test(`${a}`); }";
        assertEquals(Tokenizer.tokenize(source), Tokenizer.tokenize(source));
    }

    @Test
    void tokenize_ConcatenatedTextsReproduceSourceWithoutWhitespace() {
        String source = "const msg = `Hello ${user.name}`; // hi\nlet n = 0x1F + 2n;";
        String joined = Tokenizer.tokenize(source).stream().map(t -> t.text).collect(Collectors.joining());
        assertEquals(source.replaceAll("\\s", ""), joined.replaceAll("\\s", ""));
    }

    @Test
    void tokenize_StackFixture() {
        String source = "export class Stack {\n"
                + "  #items;\n"
                + "  constructor() { this.#items = []; }\n"
                + "  push(value) { this.#items.push(value); return this.#items.length; }\n"
                + "}";
        List<Token> tokens = Tokenizer.tokenize(source);
        List<String> keywords = texts(tokens, TokenKind.KEYWORD);
        assertTrue(keywords.containsAll(List.of("export", "class", "return", "this")));
    }
}
