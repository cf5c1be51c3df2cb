package org.dxworks.codeprobe.analyzer;

import org.dxworks.codeprobe.lexer.Token;
import org.dxworks.codeprobe.lexer.TokenKind;
import org.dxworks.codeprobe.lexer.Tokens;
import org.dxworks.codeprobe.model.ImportKind;
import org.dxworks.codeprobe.model.ImportRecord;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.codeprobe.lexer.Tokens.*;

/**
 * Extracts module references from a token stream:
 * <ul>
 *   <li>{@code import x from 'm'}, {@code import {a, b as c} from 'm'}, {@code import * as ns from 'm'}
 *       and the bare {@code import 'm'}</li>
 *   <li>{@code export {a} from 'm'}, {@code export * from 'm'}</li>
 *   <li>{@code import('m')} with a string or template argument</li>
 *   <li>{@code require('m')}</li>
 * </ul>
 */
public final class ImportParser {

    private ImportParser() {}

    public static List<ImportRecord> parse(List<Token> tokens) {
        List<ImportRecord> imports = new ArrayList<>();
        List<Token> significant = Tokens.significant(tokens);

        for (int i = 0; i < significant.size(); i++) {
            Token token = significant.get(i);

            if (isKeyword(token, "import")) {
                Token next = at(significant, i + 1);
                if (isPunctuation(next, "(")) {
                    Token argument = at(significant, i + 2);
                    if (isLiteral(argument, true) && isPunctuation(at(significant, i + 3), ")")) {
                        imports.add(new ImportRecord(stripQuotes(argument.text), ImportKind.DYNAMIC_IMPORT, token.line));
                    }
                } else if (isLiteral(next, false)) {
                    imports.add(new ImportRecord(stripQuotes(next.text), ImportKind.STATIC_IMPORT, token.line));
                } else {
                    String specifier = specifierAfterFrom(significant, i + 1);
                    if (specifier != null) {
                        imports.add(new ImportRecord(specifier, ImportKind.STATIC_IMPORT, token.line));
                    }
                }
            } else if (isKeyword(token, "export")) {
                String specifier = specifierAfterFrom(significant, i + 1);
                if (specifier != null) {
                    imports.add(new ImportRecord(specifier, ImportKind.EXPORT_FROM, token.line));
                }
            } else if (isRequireCall(significant, i)) {
                Token argument = significant.get(i + 2);
                imports.add(new ImportRecord(stripQuotes(argument.text), ImportKind.MODULE_REQUIRE, token.line));
            }
        }
        return imports;
    }

    /**
     * Walks an import/export clause ({@code x}, {@code * as ns}, {@code { a, b as c }}, {@code default})
     * up to the {@code from} that is followed by a quoted specifier and returns that specifier, or null
     * when the statement is not of that shape. Binding names may be keywords ({@code of}, {@code get},
     * even {@code from}); the walk stops at {@code ;}, at the next {@code import}/{@code export} or at
     * any token a clause cannot contain.
     */
    private static String specifierAfterFrom(List<Token> significant, int start) {
        for (int j = start; j < significant.size(); j++) {
            Token token = significant.get(j);
            if (isKeyword(token, "from")) {
                Token source = at(significant, j + 1);
                if (isLiteral(source, false)) return stripQuotes(source.text);
                continue;
            }
            if (isKeyword(token, "import") || isKeyword(token, "export")) return null;
            if (!isClauseToken(token)) return null;
        }
        return null;
    }

    private static boolean isClauseToken(Token token) {
        return token.kind == TokenKind.IDENTIFIER
                || token.kind == TokenKind.KEYWORD
                || isOperator(token, "*")
                || isPunctuation(token, "{")
                || isPunctuation(token, "}")
                || isPunctuation(token, ",");
    }

    private static boolean isRequireCall(List<Token> significant, int index) {
        Token token = significant.get(index);
        return token.is(TokenKind.IDENTIFIER, "require")
                && isPunctuation(at(significant, index + 1), "(")
                && isLiteral(at(significant, index + 2), false)
                && isPunctuation(at(significant, index + 3), ")");
    }

    private static boolean isLiteral(Token token, boolean allowTemplate) {
        if (token == null) return false;
        return token.kind == TokenKind.STRING || (allowTemplate && token.kind == TokenKind.TEMPLATE);
    }

    static String stripQuotes(String literal) {
        int start = 0;
        int end = literal.length();
        if (end > 0 && isQuoteChar(literal.charAt(0))) start = 1;
        if (end > start && isQuoteChar(literal.charAt(end - 1))) end--;
        return literal.substring(start, end);
    }

    private static boolean isQuoteChar(char c) {
        return c == '\'' || c == '"' || c == '`';
    }
}
