package org.dxworks.codeprobe;

import org.dxworks.codeprobe.analyzer.AnalysisOptions;
import org.dxworks.codeprobe.analyzer.JavaScriptAnalyzer;
import org.dxworks.codeprobe.analyzer.LanguageAnalyzer;
import org.dxworks.codeprobe.graph.DependencyMapper;
import org.dxworks.codeprobe.lexer.Tokenizer;
import org.dxworks.codeprobe.model.DependencyAnalysis;
import org.dxworks.codeprobe.model.FileAnalysis;
import org.dxworks.codeprobe.model.FileImports;
import org.dxworks.codeprobe.model.ProjectAnalysis;
import org.dxworks.codeprobe.model.SourceFile;
import org.dxworks.codeprobe.model.TokenizedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Multi-file driver. Tokenizing and per-file analysis fan out over a parallel stream; the
 * project-wide dependency graph is built once all files are in.
 */
public class ProjectAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectAnalyzer.class);

    private final LanguageAnalyzer analyzer;

    public ProjectAnalyzer() {
        this(new JavaScriptAnalyzer());
    }

    public ProjectAnalyzer(LanguageAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * Analyzes every file with all other files supplied for its dependency graph. Results keep
     * the input order.
     */
    public List<FileAnalysis> analyzeFiles(List<SourceFile> files, AnalysisOptions options) {
        if (files == null) {
            throw new IllegalArgumentException("analyzeFiles: files must not be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("analyzeFiles: options must not be null");
        }

        List<TokenizedFile> tokenized = files.parallelStream()
                .map(f -> new TokenizedFile(f.file, Tokenizer.tokenize(f.source)))
                .collect(Collectors.toList());

        return IntStream.range(0, files.size())
                .parallel()
                .mapToObj(i -> {
                    AnalysisOptions fileOptions = options.skipDependencies
                            ? options
                            : options.withOtherFiles(othersThan(tokenized, i));
                    return analyzer.analyze(tokenized.get(i), files.get(i).source, fileOptions);
                })
                .collect(Collectors.toList());
    }

    public ProjectAnalysis analyzeProject(List<SourceFile> files, AnalysisOptions options) {
        List<FileAnalysis> analyses = analyzeFiles(files, options);
        if (options.skipDependencies) {
            return new ProjectAnalysis(analyses, null);
        }

        List<FileImports> imports = new ArrayList<>(analyses.size());
        for (FileAnalysis analysis : analyses) {
            imports.add(new FileImports(analysis.file, analysis.dependencies.imports));
        }
        DependencyAnalysis dependencies = DependencyMapper.analyze(imports);
        LOG.debug("Analyzed project of {} files, {} cycle(s)", analyses.size(), dependencies.cycles.size());
        return new ProjectAnalysis(analyses, dependencies);
    }

    private static List<TokenizedFile> othersThan(List<TokenizedFile> tokenized, int index) {
        List<TokenizedFile> others = new ArrayList<>(tokenized.size() - 1);
        for (int i = 0; i < tokenized.size(); i++) {
            if (i != index) {
                others.add(tokenized.get(i));
            }
        }
        return others;
    }
}
