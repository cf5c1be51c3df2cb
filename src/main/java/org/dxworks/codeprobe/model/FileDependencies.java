package org.dxworks.codeprobe.model;

import org.dxworks.codeprobe.graph.DependencyGraph;

import java.util.List;

/**
 * Dependency section of a single-file analysis. The graph and cycles cover the analyzed file
 * together with every other file supplied alongside it.
 */
public final class FileDependencies {
    public final List<ImportRecord> imports;
    public final DependencyGraph graph;
    public final List<Cycle> cycles;

    public FileDependencies(List<ImportRecord> imports, DependencyGraph graph, List<Cycle> cycles) {
        this.imports = List.copyOf(imports);
        this.graph = graph;
        this.cycles = List.copyOf(cycles);
    }
}
