package org.dxworks.codeprobe.model;

/**
 * A discovered function whose body is a brace-delimited block. The indices point into the
 * significant-token list at the body's opening brace and its matching closing brace.
 */
public final class FunctionRecord {
    public final String name;
    public final int declLine;
    public final int bodyStartIndex;
    public final int bodyEndIndex;

    public FunctionRecord(String name, int declLine, int bodyStartIndex, int bodyEndIndex) {
        if (bodyStartIndex >= bodyEndIndex) {
            throw new IllegalArgumentException("body start " + bodyStartIndex + " must precede body end " + bodyEndIndex);
        }
        this.name = name;
        this.declLine = declLine;
        this.bodyStartIndex = bodyStartIndex;
        this.bodyEndIndex = bodyEndIndex;
    }

    public boolean encloses(FunctionRecord other) {
        return other.bodyStartIndex > bodyStartIndex && other.bodyEndIndex < bodyEndIndex;
    }

    @Override
    public String toString() {
        return name + "@" + declLine + "[" + bodyStartIndex + ".." + bodyEndIndex + "]";
    }
}
