package com.stagewise.engine.api.model;

/**
 * Completed versus visible unit counts.
 */
public record Progress(int completed, int total, double percentage) {

    public static Progress of(int completed, int total) {
        double pct = total > 0 ? Math.round(completed * 1000.0 / total) / 10.0 : 0.0;
        return new Progress(completed, total, pct);
    }
}
