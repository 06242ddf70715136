package com.project.scratch.analysis.DTOs;

import java.util.List;

public record RecalculationSummary(int count, double average, double max, double min) {

    public static RecalculationSummary of(List<AnalysisResult> results) {
        if (results.isEmpty()) {
            return new RecalculationSummary(0, 0.0, 0.0, 0.0);
        }
        double sum = 0.0;
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (AnalysisResult r : results) {
            sum += r.scratchIndex();
            max = Math.max(max, r.scratchIndex());
            min = Math.min(min, r.scratchIndex());
        }
        return new RecalculationSummary(results.size(), sum / results.size(), max, min);
    }
}
