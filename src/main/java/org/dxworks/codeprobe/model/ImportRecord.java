package org.dxworks.codeprobe.model;

/**
 * One module reference declared by a file. The specifier is kept exactly as written, without quotes.
 */
public final class ImportRecord {
    public final String sourceSpecifier;
    public final ImportKind kind;
    public final int line;

    public ImportRecord(String sourceSpecifier, ImportKind kind, int line) {
        this.sourceSpecifier = sourceSpecifier;
        this.kind = kind;
        this.line = line;
    }

    @Override
    public String toString() {
        return kind.getName() + " " + sourceSpecifier + " (line " + line + ")";
    }
}
