package org.dxworks.codeprobe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.codeprobe.analyzer.AnalysisOptions;
import org.dxworks.codeprobe.analyzer.JavaScriptAnalyzer;
import org.dxworks.codeprobe.analyzer.LanguageAnalyzer;
import org.dxworks.codeprobe.graph.DependencyMapper;
import org.dxworks.codeprobe.model.DependencyAnalysis;
import org.dxworks.codeprobe.model.FileAnalysis;
import org.dxworks.codeprobe.model.FileImports;
import org.dxworks.codeprobe.report.HumanReporter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Map<Language, LanguageAnalyzer> ANALYZERS = new EnumMap<>(Language.class);


    static {
        ANALYZERS.put(Language.JAVASCRIPT, new JavaScriptAnalyzer());
    }

    enum Format {
        JSONL, TEXT
    }

    public static void main(String[] args) throws Exception {
        Optional<Format> format = parseFormat(args);
        if (args.length < 2 || format.isEmpty()) {
            System.err.println("Usage: java -jar codeprobe.jar <input-path> <output-file> [--format jsonl|text]");
            System.err.println("  <input-path>:  Path to a JavaScript source directory or file");
            System.err.println("  <output-file>: Path to the output file");
            System.err.println("  --format:      jsonl (default) or text");
            System.err.println("Supported extensions: " + String.join(", ", Language.JAVASCRIPT.getExtensions()));
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path output = Paths.get(args[1]);
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }

        System.out.println("Starting code analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        CodeprobeConfig config = CodeprobeConfig.load();
        List<Path> files = collectSourceFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " source files");

        RunStats stats = format.get() == Format.TEXT
                ? writeText(files, output, config)
                : writeJsonl(input, files, output, config);

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + stats.successCount + " files");
        if (stats.errorCount > 0) {
            System.out.println("Errors: " + stats.errorCount);
        }
        if (stats.cycleCount > 0) {
            System.out.println("Circular dependencies: " + stats.cycleCount);
        }
        System.out.println("Output written to: " + output.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    private static RunStats writeJsonl(Path input, List<Path> files, Path output, CodeprobeConfig config) throws IOException {
        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);
        FileImports[] importSlots = new FileImports[files.size()];

        try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            IntStream.range(0, files.size()).parallel().forEach(i -> {
                Path file = files.get(i);
                Language language = LanguageDetector.detectLanguage(file).orElseThrow();
                int current = progressCounter.incrementAndGet();

                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Analyzing "
                            + language.getName() + ": " + file.getFileName());
                }

                try {
                    FileAnalysis analysis = analyzeFile(file, language, config.getAnalysisOptions());
                    if (analysis.dependencies != null) {
                        importSlots[i] = new FileImports(analysis.file, analysis.dependencies.imports);
                    }
                    FileAnalysis record = config.isIncludeTokens() ? analysis : analysis.withoutTokens();

                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(record));
                        writer.newLine();
                        writer.flush();
                    }

                    successCount.incrementAndGet();
                } catch (Exception e) {
                    Map<String, String> error = new LinkedHashMap<>();
                    error.put("kind", "error");
                    error.put("file", fileId(file));
                    error.put("language", language.getName());
                    error.put("error", e.getMessage());

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error analyzing " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            int cycleCount = 0;
            if (!config.getAnalysisOptions().skipDependencies) {
                DependencyAnalysis dependencies = DependencyMapper.analyze(collectImports(importSlots));
                cycleCount = dependencies.cycles.size();

                Map<String, Object> dependencyInfo = new LinkedHashMap<>();
                dependencyInfo.put("kind", "dependencies");
                dependencyInfo.put("graph", dependencies.graph);
                dependencyInfo.put("cycles", dependencies.cycles);
                writer.write(MAPPER.writeValueAsString(dependencyInfo));
                writer.newLine();
            }

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("circular_dependencies", cycleCount);
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();

            return new RunStats(successCount.get(), errorCount.get(), cycleCount);
        }
    }

    private static RunStats writeText(List<Path> files, Path output, CodeprobeConfig config) throws IOException {
        String[] reports = new String[files.size()];
        FileImports[] importSlots = new FileImports[files.size()];
        AtomicInteger errorCount = new AtomicInteger(0);

        IntStream.range(0, files.size()).parallel().forEach(i -> {
            Path file = files.get(i);
            Language language = LanguageDetector.detectLanguage(file).orElseThrow();
            try {
                FileAnalysis analysis = analyzeFile(file, language, config.getAnalysisOptions());
                if (analysis.dependencies != null) {
                    importSlots[i] = new FileImports(analysis.file, analysis.dependencies.imports);
                }
                reports[i] = HumanReporter.render(analysis, true);
            } catch (Exception e) {
                reports[i] = "\nError analyzing " + fileId(file) + ": " + e.getMessage() + "\n";
                errorCount.incrementAndGet();
                synchronized (System.err) {
                    System.err.println("  Error analyzing " + file.getFileName() + ": " + e.getMessage());
                }
            }
        });

        int cycleCount = 0;
        try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            for (String report : reports) {
                writer.write(report);
                writer.newLine();
            }
            if (!config.getAnalysisOptions().skipDependencies) {
                DependencyAnalysis dependencies = DependencyMapper.analyze(collectImports(importSlots));
                cycleCount = dependencies.cycles.size();
                writer.write("Project");
                writer.newLine();
                writer.write(HumanReporter.renderCycles(dependencies.cycles, true));
            }
        }
        return new RunStats(files.size() - errorCount.get(), errorCount.get(), cycleCount);
    }

    private static List<FileImports> collectImports(FileImports[] slots) {
        return Arrays.stream(slots).filter(Objects::nonNull).collect(Collectors.toList());
    }

    static Optional<Format> parseFormat(String[] args) {
        Format format = Format.JSONL;
        for (int i = 2; i < args.length; i++) {
            if (!args[i].equals("--format") || i + 1 >= args.length) {
                return Optional.empty();
            }
            String value = args[++i].toLowerCase(Locale.ROOT);
            switch (value) {
                case "jsonl" -> format = Format.JSONL;
                case "text" -> format = Format.TEXT;
                default -> {
                    return Optional.empty();
                }
            }
        }
        return Optional.of(format);
    }

    static List<Path> collectSourceFiles(Path input, int maxFileLines) throws IOException {
        return collectSourceFiles(input, maxFileLines, SourceFilter.load());
    }

    static List<Path> collectSourceFiles(Path input, int maxFileLines, SourceFilter filter) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> filter.accepts(input, p))
                      .filter(p -> LanguageDetector.detectLanguage(p).isPresent())
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (filter.accepts(input.toAbsolutePath().getParent(), input)
                    && withinMaxLines(input, maxFileLines)
                    && LanguageDetector.detectLanguage(input).isPresent()) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | java.io.UncheckedIOException e) {
            // analyzeFile reports it
            return true;
        }
    }

    static String fileId(Path path) {
        return path.toString().replace('\\', '/');
    }

    public static FileAnalysis analyzeFile(Path filePath, Language language) throws IOException {
        return analyzeFile(filePath, language, AnalysisOptions.defaults());
    }

    public static FileAnalysis analyzeFile(Path filePath, Language language, AnalysisOptions options) throws IOException {
        String sourceCode = Files.readString(filePath, StandardCharsets.UTF_8);

        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }

        LanguageAnalyzer analyzer = ANALYZERS.get(language);
        if (analyzer == null) {
            throw new IllegalArgumentException("No analyzer available for: " + language);
        }

        return analyzer.analyze(fileId(filePath), sourceCode, options);
    }

    private static final class RunStats {
        final int successCount;
        final int errorCount;
        final int cycleCount;

        RunStats(int successCount, int errorCount, int cycleCount) {
            this.successCount = successCount;
            this.errorCount = errorCount;
            this.cycleCount = cycleCount;
        }
    }
}
