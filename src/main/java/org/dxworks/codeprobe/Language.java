package org.dxworks.codeprobe;

import java.util.List;
import java.util.Locale;

public enum Language {
    JAVASCRIPT("javascript", ".js", ".mjs", ".cjs", ".jsx");

    private final String name;
    private final List<String> extensions;

    Language(String name, String... extensions) {
        this.name = name;
        this.extensions = List.of(extensions);
    }

    public String getName() {
        return name;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public boolean matchesFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(lower::endsWith);
    }
}
