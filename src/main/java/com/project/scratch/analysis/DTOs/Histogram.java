package com.project.scratch.analysis.DTOs;

import java.util.Arrays;

/**
 * Brightness distribution over the 256 gray levels together with its summary statistics.
 * Instances are immutable; the statistics are derived once from the counts.
 */
public final class Histogram {
    public static final int LEVELS = 256;

    private final long[] counts;
    private final long totalPixels;
    private final int dominantBrightness;
    private final long dominantCount;
    private final double weightedAverageBrightness;
    private final int brightnessLevelsCount;

    private Histogram(long[] counts) {
        this.counts = counts;
        long total = 0;
        long weightedSum = 0;
        int dominant = 0;
        long maxCount = -1;
        int nonEmpty = 0;
        for (int q = 0; q < LEVELS; q++) {
            long c = counts[q];
            if (c < 0) {
                throw new IllegalArgumentException("Negative count " + c + " at level " + q);
            }
            total += c;
            weightedSum += q * c;
            // strict comparison keeps the lowest level on ties
            if (c > maxCount) {
                maxCount = c;
                dominant = q;
            }
            if (c > 0) {
                nonEmpty++;
            }
        }
        this.totalPixels = total;
        this.dominantBrightness = dominant;
        this.dominantCount = maxCount;
        this.weightedAverageBrightness = total == 0 ? 0.0 : (double) weightedSum / total;
        this.brightnessLevelsCount = nonEmpty;
    }

    /**
     * @param counts pixel count per level; must have exactly {@link #LEVELS} entries
     */
    public static Histogram fromCounts(long[] counts) {
        if (counts.length != LEVELS) {
            throw new IllegalArgumentException("Histogram needs " + LEVELS + " levels, got " + counts.length);
        }
        return new Histogram(Arrays.copyOf(counts, LEVELS));
    }

    /** Histogram where all pixels fall on a single level. */
    public static Histogram singleLevel(int level, long pixels) {
        long[] counts = new long[LEVELS];
        counts[level] = pixels;
        return new Histogram(counts);
    }

    public long count(int level) {
        return counts[level];
    }

    /** Fraction of the pixels that have the given level. */
    public double ratio(int level) {
        return totalPixels == 0 ? 0.0 : (double) counts[level] / totalPixels;
    }

    public long totalPixels() {
        return totalPixels;
    }

    public int dominantBrightness() {
        return dominantBrightness;
    }

    public double averageBrightnessRatio() {
        return totalPixels == 0 ? 0.0 : (double) dominantCount / totalPixels;
    }

    public double weightedAverageBrightness() {
        return weightedAverageBrightness;
    }

    public int brightnessLevelsCount() {
        return brightnessLevelsCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Histogram)) return false;
        return Arrays.equals(counts, ((Histogram) o).counts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        return "Histogram{total=" + totalPixels + ", dominant=" + dominantBrightness
                + ", levels=" + brightnessLevelsCount + "}";
    }
}
