package org.dxworks.codeprobe.analyzer;

/**
 * Switches and limits for {@link StyleChecker}. A {@code maxLineLength} of 0 disables the length rule.
 */
public final class StyleRules {

    public static final int DEFAULT_MAX_LINE_LENGTH = 120;

    private static final StyleRules DEFAULTS = new Builder().build();

    public final int maxLineLength;
    public final boolean noVar;
    public final boolean noConsole;
    public final boolean camelCase;
    public final boolean noTrailingWhitespace;
    public final boolean noDebugger;

    private StyleRules(Builder builder) {
        this.maxLineLength = builder.maxLineLength;
        this.noVar = builder.noVar;
        this.noConsole = builder.noConsole;
        this.camelCase = builder.camelCase;
        this.noTrailingWhitespace = builder.noTrailingWhitespace;
        this.noDebugger = builder.noDebugger;
    }

    public static StyleRules defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxLineLength(maxLineLength)
                .noVar(noVar)
                .noConsole(noConsole)
                .camelCase(camelCase)
                .noTrailingWhitespace(noTrailingWhitespace)
                .noDebugger(noDebugger);
    }

    public static final class Builder {
        private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;
        private boolean noVar = true;
        private boolean noConsole = true;
        private boolean camelCase = true;
        private boolean noTrailingWhitespace = true;
        private boolean noDebugger = true;

        private Builder() {}

        public Builder maxLineLength(int maxLineLength) {
            if (maxLineLength < 0) {
                throw new IllegalArgumentException("maxLineLength must not be negative: " + maxLineLength);
            }
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder noVar(boolean noVar) {
            this.noVar = noVar;
            return this;
        }

        public Builder noConsole(boolean noConsole) {
            this.noConsole = noConsole;
            return this;
        }

        public Builder camelCase(boolean camelCase) {
            this.camelCase = camelCase;
            return this;
        }

        public Builder noTrailingWhitespace(boolean noTrailingWhitespace) {
            this.noTrailingWhitespace = noTrailingWhitespace;
            return this;
        }

        public Builder noDebugger(boolean noDebugger) {
            this.noDebugger = noDebugger;
            return this;
        }

        public StyleRules build() {
            return new StyleRules(this);
        }
    }
}
