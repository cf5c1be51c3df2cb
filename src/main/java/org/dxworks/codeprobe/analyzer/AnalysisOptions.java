package org.dxworks.codeprobe.analyzer;

import org.dxworks.codeprobe.model.TokenizedFile;

import java.util.List;

/**
 * Per-run switches for {@link LanguageAnalyzer}. {@code otherFiles} are already tokenized files whose
 * imports join the analyzed file's own in the dependency graph.
 */
public final class AnalysisOptions {

    private static final AnalysisOptions DEFAULTS = new Builder().build();

    public final StyleRules styleRules;
    public final boolean skipComplexity;
    public final boolean skipDeadCode;
    public final boolean skipStyle;
    public final boolean skipDependencies;
    public final List<TokenizedFile> otherFiles;

    private AnalysisOptions(Builder builder) {
        this.styleRules = builder.styleRules;
        this.skipComplexity = builder.skipComplexity;
        this.skipDeadCode = builder.skipDeadCode;
        this.skipStyle = builder.skipStyle;
        this.skipDependencies = builder.skipDependencies;
        this.otherFiles = List.copyOf(builder.otherFiles);
    }

    public static AnalysisOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .styleRules(styleRules)
                .skipComplexity(skipComplexity)
                .skipDeadCode(skipDeadCode)
                .skipStyle(skipStyle)
                .skipDependencies(skipDependencies)
                .otherFiles(otherFiles);
    }

    public AnalysisOptions withOtherFiles(List<TokenizedFile> otherFiles) {
        return toBuilder().otherFiles(otherFiles).build();
    }

    public static final class Builder {
        private StyleRules styleRules = StyleRules.defaults();
        private boolean skipComplexity;
        private boolean skipDeadCode;
        private boolean skipStyle;
        private boolean skipDependencies;
        private List<TokenizedFile> otherFiles = List.of();

        private Builder() {}

        public Builder styleRules(StyleRules styleRules) {
            if (styleRules == null) {
                throw new IllegalArgumentException("styleRules must not be null");
            }
            this.styleRules = styleRules;
            return this;
        }

        public Builder skipComplexity(boolean skipComplexity) {
            this.skipComplexity = skipComplexity;
            return this;
        }

        public Builder skipDeadCode(boolean skipDeadCode) {
            this.skipDeadCode = skipDeadCode;
            return this;
        }

        public Builder skipStyle(boolean skipStyle) {
            this.skipStyle = skipStyle;
            return this;
        }

        public Builder skipDependencies(boolean skipDependencies) {
            this.skipDependencies = skipDependencies;
            return this;
        }

        public Builder otherFiles(List<TokenizedFile> otherFiles) {
            if (otherFiles == null) {
                throw new IllegalArgumentException("otherFiles must not be null");
            }
            this.otherFiles = otherFiles;
            return this;
        }

        public AnalysisOptions build() {
            return new AnalysisOptions(this);
        }
    }
}
