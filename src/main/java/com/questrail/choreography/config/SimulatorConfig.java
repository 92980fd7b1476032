package com.questrail.choreography.config;

import java.util.Objects;

/**
 * Configuration of one simulator instance.
 *
 * @param recordTrace         keep every emitted event in the execution trace
 * @param choiceStrategy      resolution of a choice point when no option is named
 * @param maxSteps            successful steps allowed in one run, 0 for unbounded
 * @param maxRecursionEntries entries into one recursion label allowed per cursor,
 *                            0 for unbounded
 * @param historyLimit        prior states kept for {@code stepBack}, 0 disables history
 */
public record SimulatorConfig(
    boolean recordTrace,
    ChoiceStrategy choiceStrategy,
    int maxSteps,
    int maxRecursionEntries,
    int historyLimit
) {
    public SimulatorConfig {
        Objects.requireNonNull(choiceStrategy, "choiceStrategy");
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must be >= 0");
        }
        if (maxRecursionEntries < 0) {
            throw new IllegalArgumentException("maxRecursionEntries must be >= 0");
        }
        if (historyLimit < 0) {
            throw new IllegalArgumentException("historyLimit must be >= 0");
        }
    }

    public static SimulatorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean stepLimited() {
        return maxSteps > 0;
    }

    public boolean recursionLimited() {
        return maxRecursionEntries > 0;
    }

    public static final class Builder {
        private boolean recordTrace = false;
        private ChoiceStrategy choiceStrategy = ChoiceStrategy.FIRST;
        private int maxSteps = 0;
        private int maxRecursionEntries = 0;
        private int historyLimit = 0;

        public Builder withRecordTrace(boolean recordTrace) {
            this.recordTrace = recordTrace;
            return this;
        }

        public Builder withChoiceStrategy(ChoiceStrategy choiceStrategy) {
            this.choiceStrategy = choiceStrategy;
            return this;
        }

        public Builder withMaxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder withMaxRecursionEntries(int maxRecursionEntries) {
            this.maxRecursionEntries = maxRecursionEntries;
            return this;
        }

        public Builder withHistoryLimit(int historyLimit) {
            this.historyLimit = historyLimit;
            return this;
        }

        public SimulatorConfig build() {
            return new SimulatorConfig(recordTrace, choiceStrategy, maxSteps, maxRecursionEntries, historyLimit);
        }
    }
}
