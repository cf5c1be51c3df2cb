package org.dxworks.codeprobe.graph;

import org.dxworks.codeprobe.analyzer.ImportParser;
import org.dxworks.codeprobe.lexer.Token;
import org.dxworks.codeprobe.model.Cycle;
import org.dxworks.codeprobe.model.DependencyAnalysis;
import org.dxworks.codeprobe.model.FileImports;
import org.dxworks.codeprobe.model.TokenizedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Per-file import extraction plus the fan-in step that merges every file's imports into one
 * graph and searches it for cycles. Extraction is independent per file and safe to run in
 * parallel; {@link #analyze(Collection)} needs the complete set.
 */
public final class DependencyMapper {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyMapper.class);

    private DependencyMapper() {}

    public static FileImports parseImports(List<Token> tokens, String file) {
        if (tokens == null) {
            throw new IllegalArgumentException("tokens must not be null");
        }
        if (file == null) {
            throw new IllegalArgumentException("file must not be null");
        }
        return new FileImports(file, ImportParser.parse(tokens));
    }

    public static DependencyAnalysis analyze(Collection<FileImports> files) {
        DependencyGraph graph = DependencyGraph.build(files);
        List<Cycle> cycles = CycleDetector.findCycles(graph);
        if (!cycles.isEmpty()) {
            LOG.debug("Found {} dependency cycle(s) among {} nodes", cycles.size(), graph.nodes().size());
        }
        return new DependencyAnalysis(new ArrayList<>(files), graph, cycles);
    }

    public static DependencyAnalysis analyzeTokenized(List<TokenizedFile> files) {
        List<FileImports> imports = new ArrayList<>(files.size());
        for (TokenizedFile file : files) {
            imports.add(parseImports(file.tokens, file.file));
        }
        return analyze(imports);
    }
}
