package org.dxworks.codeprobe.lexer;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TokenKind {
    KEYWORD("keyword"),
    IDENTIFIER("identifier"),
    NUMBER("number"),
    STRING("string"),
    TEMPLATE("template"),
    REGEX("regex-literal"),
    OPERATOR("operator"),
    PUNCTUATION("punctuation"),
    COMMENT("comment"),
    UNKNOWN("unknown");

    private final String name;

    TokenKind(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
