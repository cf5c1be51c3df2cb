package org.dxworks.codeprobe.model;

import java.util.List;

public final class Summary {
    public final int totalTokens;
    public final int functions;
    public final double avgComplexity;
    public final int maxComplexity;
    public final int deadCodeIssues;
    public final int styleIssues;
    public final int circularDeps;
    public final int totalIssues;

    private Summary(int totalTokens, int functions, double avgComplexity, int maxComplexity,
                    int deadCodeIssues, int styleIssues, int circularDeps) {
        this.totalTokens = totalTokens;
        this.functions = functions;
        this.avgComplexity = avgComplexity;
        this.maxComplexity = maxComplexity;
        this.deadCodeIssues = deadCodeIssues;
        this.styleIssues = styleIssues;
        this.circularDeps = circularDeps;
        this.totalIssues = deadCodeIssues + styleIssues + circularDeps;
    }

    public static Summary of(int totalTokens, List<ComplexityResult> complexity, List<DeadCodeIssue> deadCode,
                             List<StyleIssue> style, FileDependencies dependencies) {
        int maxComplexity = 0;
        long totalScore = 0;
        for (ComplexityResult result : complexity) {
            totalScore += result.score;
            maxComplexity = Math.max(maxComplexity, result.score);
        }
        double avgComplexity = complexity.isEmpty()
                ? 0
                : Math.round(totalScore * 100.0 / complexity.size()) / 100.0;
        int cycles = dependencies == null ? 0 : dependencies.cycles.size();
        return new Summary(totalTokens, complexity.size(), avgComplexity, maxComplexity,
                deadCode.size(), style.size(), cycles);
    }
}
