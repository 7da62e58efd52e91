package com.commandlab.engine.capture;

public record PerformanceAnalysis(
        long                executionTimeMs,
        DurationCategory    durationCategory,
        RelativePerformance relativePerformance,
        Consistency         consistency) {

    public enum DurationCategory {
        FAST, MODERATE, SLOW, VERY_SLOW;

        public static DurationCategory of(long durationMs) {
            if (durationMs < 100) return FAST;
            if (durationMs < 1000) return MODERATE;
            if (durationMs < 5000) return SLOW;
            return VERY_SLOW;
        }
    }

    /** Compared with earlier results for the same command. */
    public enum RelativePerformance { FASTER, SIMILAR, SLOWER, UNKNOWN }

    public enum Consistency { CONSISTENT, VARIABLE, UNKNOWN }
}
