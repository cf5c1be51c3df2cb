package org.dxworks.codeprobe.model;

public final class ComplexityResult {
    public final String name;
    public final int line;
    public final int score;

    public ComplexityResult(String name, int line, int score) {
        this.name = name;
        this.line = line;
        this.score = score;
    }

    @Override
    public String toString() {
        return name + "@" + line + "=" + score;
    }
}
