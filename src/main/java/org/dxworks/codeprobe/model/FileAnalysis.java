package org.dxworks.codeprobe.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.dxworks.codeprobe.lexer.Token;

import java.util.List;

/**
 * Aggregated result for one analyzed file. Lists are empty, and {@code dependencies} is null,
 * for analyses that were skipped.
 */
public final class FileAnalysis {
    public final String file;
    public final String language;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final List<Token> tokens;
    public final List<ComplexityResult> complexity;
    public final List<DeadCodeIssue> deadCode;
    public final List<StyleIssue> style;
    public final FileDependencies dependencies;
    public final Summary summary;

    public FileAnalysis(String file, String language, List<Token> tokens, List<ComplexityResult> complexity,
                        List<DeadCodeIssue> deadCode, List<StyleIssue> style, FileDependencies dependencies) {
        this.file = file;
        this.language = language;
        this.tokens = List.copyOf(tokens);
        this.complexity = List.copyOf(complexity);
        this.deadCode = List.copyOf(deadCode);
        this.style = List.copyOf(style);
        this.dependencies = dependencies;
        this.summary = Summary.of(tokens.size(), complexity, deadCode, style, dependencies);
    }

    private FileAnalysis(FileAnalysis other) {
        this.file = other.file;
        this.language = other.language;
        this.tokens = null;
        this.complexity = other.complexity;
        this.deadCode = other.deadCode;
        this.style = other.style;
        this.dependencies = other.dependencies;
        this.summary = other.summary;
    }

    /**
     * Same analysis with the token stream left out, for compact output. The summary keeps the
     * original token count.
     */
    public FileAnalysis withoutTokens() {
        return tokens == null ? this : new FileAnalysis(this);
    }
}
