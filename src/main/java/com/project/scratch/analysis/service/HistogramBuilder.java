package com.project.scratch.analysis.service;

import com.project.scratch.analysis.DTOs.Histogram;
import com.project.scratch.analysis.DTOs.LuminanceGrid;
import org.springframework.stereotype.Component;

@Component
public class HistogramBuilder {

    public Histogram build(LuminanceGrid grid) {
        long[] counts = new long[Histogram.LEVELS];
        int n = grid.size();
        for (int i = 0; i < n; i++) {
            counts[grid.valueAt(i)]++;
        }
        return Histogram.fromCounts(counts);
    }
}
