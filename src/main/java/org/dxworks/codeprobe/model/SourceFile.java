package org.dxworks.codeprobe.model;

public final class SourceFile {
    public final String file;
    public final String source;

    public SourceFile(String file, String source) {
        if (file == null) {
            throw new IllegalArgumentException("file must not be null");
        }
        if (source == null) {
            throw new IllegalArgumentException("source must not be null for " + file);
        }
        this.file = file;
        this.source = source;
    }
}
