package org.dxworks.codeprobe;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.codeprobe.analyzer.AnalysisOptions;
import org.dxworks.codeprobe.analyzer.StyleRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CodeprobeConfig {

    private static final Logger LOG = LoggerFactory.getLogger(CodeprobeConfig.class);

    static final String CONFIG_FILE_NAME = "codeprobe-config.yml";
    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final boolean DEFAULT_INCLUDE_TOKENS = false;

    private final int maxFileLines;
    private final boolean includeTokens;
    private final AnalysisOptions analysisOptions;

    private CodeprobeConfig(int maxFileLines, boolean includeTokens, AnalysisOptions analysisOptions) {
        this.maxFileLines = maxFileLines;
        this.includeTokens = includeTokens;
        this.analysisOptions = analysisOptions;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public boolean isIncludeTokens() {
        return includeTokens;
    }

    public AnalysisOptions getAnalysisOptions() {
        return analysisOptions;
    }

    public static CodeprobeConfig defaults() {
        return new CodeprobeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_INCLUDE_TOKENS, AnalysisOptions.defaults());
    }

    public static CodeprobeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CodeprobeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return fromYaml(yamlConfig);
            }
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static CodeprobeConfig with(int maxFileLines, boolean includeTokens, AnalysisOptions analysisOptions) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        AnalysisOptions effectiveOptions = analysisOptions != null ? analysisOptions : AnalysisOptions.defaults();
        return new CodeprobeConfig(effectiveMaxFileLines, includeTokens, effectiveOptions);
    }

    private static CodeprobeConfig fromYaml(YamlConfig yamlConfig) {
        int effectiveMaxFileLines = DEFAULT_MAX_FILE_LINES;
        if (yamlConfig.maxFileLines != null) {
            if (yamlConfig.maxFileLines > 0) {
                effectiveMaxFileLines = yamlConfig.maxFileLines;
            } else {
                LOG.warn("Ignoring non-positive maxFileLines {}, using {}", yamlConfig.maxFileLines, DEFAULT_MAX_FILE_LINES);
            }
        }
        boolean effectiveIncludeTokens = yamlConfig.includeTokens != null ? yamlConfig.includeTokens : DEFAULT_INCLUDE_TOKENS;

        AnalysisOptions.Builder options = AnalysisOptions.builder()
                .skipComplexity(Boolean.TRUE.equals(yamlConfig.skipComplexity))
                .skipDeadCode(Boolean.TRUE.equals(yamlConfig.skipDeadCode))
                .skipStyle(Boolean.TRUE.equals(yamlConfig.skipStyle))
                .skipDependencies(Boolean.TRUE.equals(yamlConfig.skipDependencies));
        if (yamlConfig.style != null) {
            options.styleRules(yamlConfig.style.toStyleRules());
        }

        return new CodeprobeConfig(effectiveMaxFileLines, effectiveIncludeTokens, options.build());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class YamlConfig {
        public Integer maxFileLines;
        public Boolean includeTokens;
        public Boolean skipComplexity;
        public Boolean skipDeadCode;
        public Boolean skipStyle;
        public Boolean skipDependencies;
        public StyleYaml style;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class StyleYaml {
        public Integer maxLineLength;
        public Boolean noVar;
        public Boolean noConsole;
        public Boolean camelCase;
        public Boolean noTrailingWhitespace;
        public Boolean noDebugger;

        StyleRules toStyleRules() {
            StyleRules.Builder rules = StyleRules.builder();
            if (maxLineLength != null) {
                if (maxLineLength >= 0) {
                    rules.maxLineLength(maxLineLength);
                } else {
                    LOG.warn("Ignoring negative style.maxLineLength {}, using {}",
                            maxLineLength, StyleRules.DEFAULT_MAX_LINE_LENGTH);
                }
            }
            if (noVar != null) rules.noVar(noVar);
            if (noConsole != null) rules.noConsole(noConsole);
            if (camelCase != null) rules.camelCase(camelCase);
            if (noTrailingWhitespace != null) rules.noTrailingWhitespace(noTrailingWhitespace);
            if (noDebugger != null) rules.noDebugger(noDebugger);
            return rules.build();
        }
    }
}
