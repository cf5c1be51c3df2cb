package org.dxworks.codeprobe.model;

import org.dxworks.codeprobe.graph.DependencyGraph;

import java.util.List;

/**
 * Cross-file dependency result: every file's declared imports, the merged graph and its cycles.
 */
public final class DependencyAnalysis {
    public final List<FileImports> allImports;
    public final DependencyGraph graph;
    public final List<Cycle> cycles;

    public DependencyAnalysis(List<FileImports> allImports, DependencyGraph graph, List<Cycle> cycles) {
        this.allImports = List.copyOf(allImports);
        this.graph = graph;
        this.cycles = List.copyOf(cycles);
    }

    public List<ImportRecord> importsOf(String file) {
        for (FileImports fileImports : allImports) {
            if (fileImports.file.equals(file)) {
                return fileImports.imports;
            }
        }
        return List.of();
    }
}
