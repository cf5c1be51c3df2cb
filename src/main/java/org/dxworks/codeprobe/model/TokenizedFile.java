package org.dxworks.codeprobe.model;

import org.dxworks.codeprobe.lexer.Token;

import java.util.List;

public final class TokenizedFile {
    public final String file;
    public final List<Token> tokens;

    public TokenizedFile(String file, List<Token> tokens) {
        this.file = file;
        this.tokens = List.copyOf(tokens);
    }
}
