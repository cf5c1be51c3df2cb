package org.dxworks.codeprobe.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * A closed dependency path {@code [f0, f1, ..., fk, f0]}. A file importing itself is {@code [f0, f0]}.
 */
public final class Cycle {
    private final List<String> files;

    public Cycle(List<String> files) {
        if (files.size() < 2 || !files.get(0).equals(files.get(files.size() - 1))) {
            throw new IllegalArgumentException("a cycle must start and end on the same file: " + files);
        }
        this.files = List.copyOf(files);
    }

    @JsonValue
    public List<String> getFiles() {
        return files;
    }

    /** Distinct files on the cycle, without the closing repeat. */
    public List<String> members() {
        return files.subList(0, files.size() - 1);
    }

    public boolean contains(String file) {
        return files.contains(file);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Cycle && files.equals(((Cycle) o).files);
    }

    @Override
    public int hashCode() {
        return files.hashCode();
    }

    @Override
    public String toString() {
        return String.join(" -> ", files);
    }
}
