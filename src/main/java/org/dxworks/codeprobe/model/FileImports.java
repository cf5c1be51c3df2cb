package org.dxworks.codeprobe.model;

import java.util.List;

public final class FileImports {
    public final String file;
    public final List<ImportRecord> imports;

    public FileImports(String file, List<ImportRecord> imports) {
        this.file = file;
        this.imports = List.copyOf(imports);
    }
}
