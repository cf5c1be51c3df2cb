package org.dxworks.codeprobe.graph;

import com.fasterxml.jackson.annotation.JsonValue;
import org.dxworks.codeprobe.model.FileImports;
import org.dxworks.codeprobe.model.ImportRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Directed file-to-file reference graph. Every referenced identifier is a node, including
 * external packages and files that were never supplied for analysis; those simply have no
 * outgoing edges. Iteration follows insertion order so results are reproducible.
 */
public final class DependencyGraph {

    private final Map<String, Set<String>> adjacency;

    private DependencyGraph(Map<String, Set<String>> adjacency) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        adjacency.forEach((node, targets) ->
                copy.put(node, Collections.unmodifiableSet(new LinkedHashSet<>(targets))));
        this.adjacency = Collections.unmodifiableMap(copy);
    }

    /**
     * Merges per-file import lists into one graph, resolving relative specifiers against the
     * importing file.
     */
    public static DependencyGraph build(Collection<FileImports> files) {
        Builder builder = builder();
        for (FileImports fileImports : files) {
            builder.addNode(fileImports.file);
            for (ImportRecord record : fileImports.imports) {
                builder.addEdge(fileImports.file, ImportResolver.resolve(fileImports.file, record.sourceSpecifier));
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> nodes() {
        return adjacency.keySet();
    }

    public Set<String> dependenciesOf(String node) {
        return adjacency.getOrDefault(node, Set.of());
    }

    public boolean contains(String node) {
        return adjacency.containsKey(node);
    }

    public int edgeCount() {
        return adjacency.values().stream().mapToInt(Set::size).sum();
    }

    @JsonValue
    public Map<String, Set<String>> adjacency() {
        return adjacency;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DependencyGraph && adjacency.equals(((DependencyGraph) o).adjacency);
    }

    @Override
    public int hashCode() {
        return adjacency.hashCode();
    }

    public static final class Builder {
        private final Map<String, Set<String>> adjacency = new LinkedHashMap<>();

        private Builder() {}

        public Builder addNode(String node) {
            adjacency.computeIfAbsent(node, k -> new LinkedHashSet<>());
            return this;
        }

        public Builder addEdge(String from, String to) {
            addNode(from);
            addNode(to);
            adjacency.get(from).add(to);
            return this;
        }

        public DependencyGraph build() {
            return new DependencyGraph(adjacency);
        }
    }
}
