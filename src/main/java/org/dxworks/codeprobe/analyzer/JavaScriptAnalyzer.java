package org.dxworks.codeprobe.analyzer;

import org.dxworks.codeprobe.Language;
import org.dxworks.codeprobe.graph.DependencyMapper;
import org.dxworks.codeprobe.lexer.Token;
import org.dxworks.codeprobe.lexer.Tokenizer;
import org.dxworks.codeprobe.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs every enabled analysis over one token stream per file, tokenizing only when the caller
 * has not already done so.
 */
public class JavaScriptAnalyzer implements LanguageAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(JavaScriptAnalyzer.class);

    public static final String DEFAULT_FILE = "<source>";

    @Override
    public FileAnalysis analyze(String filePath, String sourceCode, AnalysisOptions options) {
        if (sourceCode == null) {
            throw new IllegalArgumentException("analyze: source must be a string, got null");
        }
        String file = filePath != null ? filePath : DEFAULT_FILE;
        return analyze(new TokenizedFile(file, Tokenizer.tokenize(sourceCode)), sourceCode, options);
    }

    @Override
    public FileAnalysis analyze(TokenizedFile tokenized, String sourceCode, AnalysisOptions options) {
        if (tokenized == null) {
            throw new IllegalArgumentException("analyze: tokenized file must not be null");
        }
        if (sourceCode == null) {
            throw new IllegalArgumentException("analyze: source must be a string, got null");
        }
        if (options == null) {
            throw new IllegalArgumentException("analyze: options must not be null");
        }
        String file = tokenized.file != null ? tokenized.file : DEFAULT_FILE;

        long start = System.nanoTime();
        List<Token> tokens = tokenized.tokens;
        List<String> lines = Arrays.asList(sourceCode.split("\n", -1));

        List<ComplexityResult> complexity = options.skipComplexity ? List.of() : ComplexityAnalyzer.analyze(tokens);
        List<DeadCodeIssue> deadCode = options.skipDeadCode ? List.of() : DeadCodeDetector.detect(tokens, lines);
        List<StyleIssue> style = options.skipStyle ? List.of() : StyleChecker.check(sourceCode, tokens, options.styleRules);
        FileDependencies dependencies = options.skipDependencies ? null : dependencies(file, tokens, options);

        FileAnalysis analysis = new FileAnalysis(file, Language.JAVASCRIPT.getName(), tokens,
                complexity, deadCode, style, dependencies);

        LOG.debug("Analyzed {}: {} tokens, {} functions, {} dead code issues, {} style issues in {} ms",
                file, tokens.size(), complexity.size(), deadCode.size(), style.size(),
                (System.nanoTime() - start) / 1_000_000);
        return analysis;
    }

    private FileDependencies dependencies(String file, List<Token> tokens, AnalysisOptions options) {
        FileImports own = DependencyMapper.parseImports(tokens, file);

        List<FileImports> all = new ArrayList<>();
        all.add(own);
        for (TokenizedFile other : options.otherFiles) {
            all.add(DependencyMapper.parseImports(other.tokens, other.file));
        }

        DependencyAnalysis merged = DependencyMapper.analyze(all);
        return new FileDependencies(own.imports, merged.graph, merged.cycles);
    }
}
