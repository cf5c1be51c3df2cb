package org.dxworks.codeprobe.report;

import org.dxworks.codeprobe.model.ComplexityResult;
import org.dxworks.codeprobe.model.Cycle;
import org.dxworks.codeprobe.model.DeadCodeIssue;
import org.dxworks.codeprobe.model.FileAnalysis;
import org.dxworks.codeprobe.model.FileDependencies;
import org.dxworks.codeprobe.model.ImportKind;
import org.dxworks.codeprobe.model.ImportRecord;
import org.dxworks.codeprobe.model.StyleIssue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal-oriented rendering of a {@link FileAnalysis}. Pure formatting: nothing here changes
 * what the analyses found.
 */
public final class HumanReporter {

    static final int RULE_WIDTH = 60;
    static final int MAX_ISSUES_PER_RULE = 5;
    static final int LOW_COMPLEXITY = 5;
    static final int MODERATE_COMPLEXITY = 10;

    private enum Color {
        RESET("\u001B[0m"),
        BOLD("\u001B[1m"),
        DIM("\u001B[2m"),
        RED("\u001B[31m"),
        GREEN("\u001B[32m"),
        YELLOW("\u001B[33m"),
        BLUE("\u001B[34m"),
        MAGENTA("\u001B[35m"),
        CYAN("\u001B[36m");

        private final String code;

        Color(String code) {
            this.code = code;
        }
    }

    private final boolean noColor;

    private HumanReporter(boolean noColor) {
        this.noColor = noColor;
    }

    public static String render(FileAnalysis analysis, boolean noColor) {
        return new HumanReporter(noColor).render(analysis);
    }

    /**
     * Cycle listing for a whole project run, in the same layout as the per-file section.
     */
    public static String renderCycles(List<Cycle> cycles, boolean noColor) {
        List<String> lines = new ArrayList<>();
        new HumanReporter(noColor).appendCycles(cycles, lines);
        lines.add("");
        return String.join("\n", lines);
    }

    private String render(FileAnalysis analysis) {
        List<String> lines = new ArrayList<>();
        lines.add("");
        lines.add(paint(Color.BOLD, "Analysis: " + paint(Color.CYAN, analysis.file)));
        lines.add(paint(Color.DIM, "-".repeat(RULE_WIDTH)));

        appendComplexity(analysis.complexity, lines);
        appendDeadCode(analysis.deadCode, lines);
        appendStyle(analysis.style, lines);
        if (analysis.dependencies != null) {
            appendImports(analysis.file, analysis.dependencies, lines);
            appendCycles(analysis.dependencies.cycles, lines);
        }
        appendFooter(analysis, lines);
        return String.join("\n", lines);
    }

    private void appendComplexity(List<ComplexityResult> complexity, List<String> lines) {
        if (complexity.isEmpty()) return;
        lines.add("");
        lines.add(paint(Color.BOLD, "Cyclomatic Complexity"));
        for (ComplexityResult result : complexity) {
            lines.add("  " + paint(Color.CYAN, result.name) + " (line " + result.line + ") - complexity: "
                    + paint(levelColor(result.score), String.valueOf(result.score)) + " "
                    + paint(Color.DIM, "[" + level(result.score) + "]"));
        }
    }

    private void appendDeadCode(List<DeadCodeIssue> deadCode, List<String> lines) {
        lines.add("");
        if (deadCode.isEmpty()) {
            lines.add(paint(Color.GREEN, "OK") + " No dead code detected");
            return;
        }
        lines.add(paint(Color.BOLD, "Dead Code"));
        for (DeadCodeIssue issue : deadCode) {
            lines.add("  " + paint(Color.YELLOW, "line " + issue.line + ":" + issue.column) + " - " + issue.message);
            if (!issue.snippet.isEmpty()) {
                lines.add("    " + paint(Color.DIM, issue.snippet));
            }
        }
    }

    private void appendStyle(List<StyleIssue> style, List<String> lines) {
        lines.add("");
        if (style.isEmpty()) {
            lines.add(paint(Color.GREEN, "OK") + " No style issues");
            return;
        }
        lines.add(paint(Color.BOLD, "Style Issues"));

        Map<String, List<StyleIssue>> byRule = new LinkedHashMap<>();
        for (StyleIssue issue : style) {
            byRule.computeIfAbsent(issue.rule, k -> new ArrayList<>()).add(issue);
        }
        byRule.forEach((rule, issues) -> {
            lines.add("  " + paint(Color.MAGENTA, rule) + " (" + plural(issues.size(), "occurrence") + ")");
            for (StyleIssue issue : issues.subList(0, Math.min(MAX_ISSUES_PER_RULE, issues.size()))) {
                lines.add("    " + paint(Color.YELLOW, "line " + issue.line + ":" + issue.column) + " - " + issue.message);
            }
            if (issues.size() > MAX_ISSUES_PER_RULE) {
                lines.add("    " + paint(Color.DIM, "... and " + (issues.size() - MAX_ISSUES_PER_RULE) + " more"));
            }
        });
    }

    private void appendImports(String file, FileDependencies dependencies, List<String> lines) {
        if (dependencies.imports.isEmpty()) return;
        lines.add("");
        lines.add(paint(Color.BOLD, "Dependencies"));
        lines.add("  " + paint(Color.CYAN, file));
        for (ImportRecord record : dependencies.imports) {
            Color kindColor = record.kind == ImportKind.MODULE_REQUIRE ? Color.YELLOW : Color.BLUE;
            lines.add("    " + paint(kindColor, record.kind.getName()) + " " + record.sourceSpecifier + " "
                    + paint(Color.DIM, "(line " + record.line + ")"));
        }
    }

    private void appendCycles(List<Cycle> cycles, List<String> lines) {
        lines.add("");
        if (cycles.isEmpty()) {
            lines.add(paint(Color.GREEN, "OK") + " No circular dependencies");
            return;
        }
        lines.add(paint(Color.RED, "Circular Dependencies Detected!"));
        for (Cycle cycle : cycles) {
            lines.add("  " + paint(Color.RED, cycle.toString()));
        }
    }

    private void appendFooter(FileAnalysis analysis, List<String> lines) {
        lines.add("");
        lines.add(paint(Color.DIM, "-".repeat(RULE_WIDTH)));

        int totalIssues = analysis.summary.totalIssues;
        long highComplexity = analysis.complexity.stream().filter(r -> r.score > MODERATE_COMPLEXITY).count();
        if (totalIssues == 0 && highComplexity == 0) {
            lines.add(paint(Color.GREEN, "All checks passed - no issues found"));
        } else {
            List<String> parts = new ArrayList<>();
            if (totalIssues > 0) parts.add(plural(totalIssues, "issue"));
            if (highComplexity > 0) parts.add(plural(highComplexity, "high-complexity function"));
            lines.add(paint(Color.YELLOW, "Found: " + String.join(", ", parts)));
        }
        lines.add("");
    }

    static String level(int score) {
        if (score <= LOW_COMPLEXITY) return "low";
        return score <= MODERATE_COMPLEXITY ? "moderate" : "high";
    }

    private static Color levelColor(int score) {
        if (score <= LOW_COMPLEXITY) return Color.GREEN;
        return score <= MODERATE_COMPLEXITY ? Color.YELLOW : Color.RED;
    }

    private static String plural(long count, String noun) {
        return count + " " + noun + (count != 1 ? "s" : "");
    }

    private String paint(Color color, String text) {
        return noColor ? text : color.code + text + Color.RESET.code;
    }
}
