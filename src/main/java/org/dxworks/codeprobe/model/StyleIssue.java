package org.dxworks.codeprobe.model;

public final class StyleIssue {
    public final int line;
    public final int column;
    public final String rule;
    public final String message;

    public StyleIssue(int line, int column, String rule, String message) {
        this.line = line;
        this.column = column;
        this.rule = rule;
        this.message = message;
    }
}
