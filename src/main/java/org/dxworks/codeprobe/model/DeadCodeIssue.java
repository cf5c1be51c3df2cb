package org.dxworks.codeprobe.model;

public final class DeadCodeIssue {
    public final int line;
    public final int column;
    public final String message;
    public final String snippet;

    public DeadCodeIssue(int line, int column, String message, String snippet) {
        this.line = line;
        this.column = column;
        this.message = message;
        this.snippet = snippet;
    }
}
