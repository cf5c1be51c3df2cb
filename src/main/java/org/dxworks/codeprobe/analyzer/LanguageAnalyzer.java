package org.dxworks.codeprobe.analyzer;

import org.dxworks.codeprobe.model.FileAnalysis;
import org.dxworks.codeprobe.model.TokenizedFile;

public interface LanguageAnalyzer {
    FileAnalysis analyze(String filePath, String sourceCode, AnalysisOptions options);

    /**
     * Same as {@link #analyze(String, String, AnalysisOptions)} over a token stream produced
     * earlier from {@code sourceCode}, so multi-file drivers tokenize each file once.
     */
    FileAnalysis analyze(TokenizedFile tokenized, String sourceCode, AnalysisOptions options);

    default FileAnalysis analyze(String filePath, String sourceCode) {
        return analyze(filePath, sourceCode, AnalysisOptions.defaults());
    }
}
