package org.dxworks.codeprobe.lexer;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * A single lexical unit. Lines and columns are 1-based and point at the first character of the token.
 */
public final class Token {
    public final TokenKind kind;
    public final String text;
    public final int line;
    public final int column;

    public Token(TokenKind kind, String text, int line, int column) {
        this.kind = kind;
        this.text = text;
        this.line = line;
        this.column = column;
    }

    public boolean is(TokenKind kind, String text) {
        return this.kind == kind && this.text.equals(text);
    }

    @JsonIgnore
    public boolean isSignificant() {
        return kind != TokenKind.COMMENT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return line == other.line && column == other.column && kind == other.kind && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, line, column);
    }

    @Override
    public String toString() {
        return kind.getName() + "(" + text + ")@" + line + ":" + column;
    }
}
