package com.project.scratch.analysis.service;

import com.project.scratch.analysis.DTOs.Histogram;
import com.project.scratch.analysis.DTOs.LuminanceGrid;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HistogramBuilderTest {
    private final HistogramBuilder builder = new HistogramBuilder();

    @Test
    void build_countsSumToPixelCount() {
        Random rnd = new Random(42);
        int w = 37, h = 23;
        int[] values = new int[w * h];
        for (int i = 0; i < values.length; i++) {
            values[i] = rnd.nextInt(256);
        }

        Histogram hist = builder.build(new LuminanceGrid(w, h, values));

        long sum = 0;
        for (int q = 0; q < Histogram.LEVELS; q++) {
            sum += hist.count(q);
        }
        assertThat(sum).isEqualTo(w * h);
        assertThat(hist.totalPixels()).isEqualTo(w * h);
    }

    @Test
    void build_flatImage() {
        int[] values = new int[100 * 100];
        Arrays.fill(values, 255);

        Histogram hist = builder.build(new LuminanceGrid(100, 100, values));

        assertThat(hist.count(255)).isEqualTo(10_000);
        assertThat(hist.count(0)).isZero();
        assertThat(hist.dominantBrightness()).isEqualTo(255);
        assertThat(hist.averageBrightnessRatio()).isEqualTo(1.0);
        assertThat(hist.weightedAverageBrightness()).isEqualTo(255.0);
        assertThat(hist.brightnessLevelsCount()).isEqualTo(1);
    }

    @Test
    void build_statistics() {
        // levels 10, 20, 20, 30 -> 20 dominant, mean 20
        Histogram hist = builder.build(new LuminanceGrid(2, 2, new int[]{10, 20, 20, 30}));

        assertThat(hist.dominantBrightness()).isEqualTo(20);
        assertThat(hist.averageBrightnessRatio()).isEqualTo(0.5);
        assertThat(hist.weightedAverageBrightness()).isCloseTo(20.0, within(1e-12));
        assertThat(hist.brightnessLevelsCount()).isEqualTo(3);
    }

    @Test
    void dominantBrightness_tieGoesToLowestLevel() {
        Histogram hist = builder.build(new LuminanceGrid(4, 1, new int[]{200, 7, 200, 7}));

        assertThat(hist.dominantBrightness()).isEqualTo(7);
        assertThat(hist.averageBrightnessRatio()).isEqualTo(0.5);
        assertThat(hist.weightedAverageBrightness()).isCloseTo(103.5, within(1e-12));
    }

    @Test
    void emptyHistogram_hasZeroStatistics() {
        Histogram hist = Histogram.fromCounts(new long[Histogram.LEVELS]);

        assertThat(hist.totalPixels()).isZero();
        assertThat(hist.dominantBrightness()).isZero();
        assertThat(hist.averageBrightnessRatio()).isZero();
        assertThat(hist.weightedAverageBrightness()).isZero();
        assertThat(hist.ratio(0)).isZero();
    }
}
