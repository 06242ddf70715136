package com.project.scratch.analysis.service;

import com.project.scratch.analysis.DTOs.Histogram;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Scratch index as a linear convolution of per-level criteria:
 *
 * <pre>
 *   raw   = sum_q w(q) * |r_ref(q) - r_test(q)|      r_x(q) = count_x(q) / total_x
 *   index = clamp(raw / (max(w) + min(w)), 0, 1)
 * </pre>
 *
 * The normalizer is the score of a completely white reference against a completely black
 * test image, so that pair scores 1.0. Identical histograms score exactly 0 and the score
 * is symmetric in its arguments.
 *
 * <p>The score saturates: any pair whose raw value reaches the white/black extreme scores 1.0.
 * With the default weighting that includes pairs which are not the white/black extreme, e.g. a
 * white reference against a uniform level-128 test image (raw = 1 + 128/255).
 */
@Component
public class ScratchIndexCalculator {
    private final double[] weights = new double[Histogram.LEVELS];
    private final double normalizer;

    public ScratchIndexCalculator() {
        this(new LinearBrightnessWeighting());
    }

    @Autowired
    public ScratchIndexCalculator(BrightnessWeighting weighting) {
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (int q = 0; q < Histogram.LEVELS; q++) {
            double w = weighting.weight(q);
            if (!(w >= 0.0 && w <= 1.0)) {
                throw new IllegalArgumentException("Weight for level " + q + " must be within [0,1], got " + w);
            }
            weights[q] = w;
            max = Math.max(max, w);
            min = Math.min(min, w);
        }
        if (max <= 0.0) {
            throw new IllegalArgumentException("Weighting must be positive for at least one level");
        }
        this.normalizer = max + min;
    }

    public double scratchIndex(Histogram reference, Histogram test) {
        if (reference.equals(test)) {
            return 0.0;
        }
        double raw = 0.0;
        for (int q = 0; q < Histogram.LEVELS; q++) {
            double diff = Math.abs(reference.ratio(q) - test.ratio(q));
            raw += weights[q] * diff;
        }
        double index = raw / normalizer;
        return Math.max(0.0, Math.min(1.0, index));
    }

    double weight(int level) {
        return weights[level];
    }

    double normalizer() {
        return normalizer;
    }
}
