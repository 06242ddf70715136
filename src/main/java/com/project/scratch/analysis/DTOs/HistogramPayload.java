package com.project.scratch.analysis.DTOs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Wire shape of a histogram: every level "0".."255" is present, with 0 for empty levels.
 */
public record HistogramPayload(UUID imageId, Map<String, Long> histogram, Statistics statistics) {

    public record Statistics(
            int dominantBrightness,
            double averageBrightnessRatio,
            double weightedAverageBrightness,
            long totalPixels,
            int brightnessLevelsCount
    ) {}

    public static HistogramPayload of(UUID imageId, Histogram h) {
        Map<String, Long> levels = new LinkedHashMap<>();
        for (int q = 0; q < Histogram.LEVELS; q++) {
            levels.put(Integer.toString(q), h.count(q));
        }
        Statistics stats = new Statistics(
                h.dominantBrightness(),
                h.averageBrightnessRatio(),
                h.weightedAverageBrightness(),
                h.totalPixels(),
                h.brightnessLevelsCount()
        );
        return new HistogramPayload(imageId, levels, stats);
    }
}
