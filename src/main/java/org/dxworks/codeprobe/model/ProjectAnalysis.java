package org.dxworks.codeprobe.model;

import java.util.List;

public final class ProjectAnalysis {
    public final List<FileAnalysis> files;
    public final DependencyAnalysis dependencies;

    public ProjectAnalysis(List<FileAnalysis> files, DependencyAnalysis dependencies) {
        this.files = List.copyOf(files);
        this.dependencies = dependencies;
    }
}
