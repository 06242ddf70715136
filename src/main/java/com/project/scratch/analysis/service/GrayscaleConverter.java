package com.project.scratch.analysis.service;

import com.project.scratch.analysis.DTOs.LuminanceGrid;
import com.project.scratch.analysis.DTOs.PixelGrid;
import org.springframework.stereotype.Component;

/**
 * Luminance conversion {@code Y = 0.3 R + 0.59 G + 0.11 B}, rounded and clamped to 0..255.
 */
@Component
public class GrayscaleConverter {
    static final double RED_WEIGHT = 0.3;
    static final double GREEN_WEIGHT = 0.59;
    static final double BLUE_WEIGHT = 0.11;

    public static int toGrayscale(int r, int g, int b) {
        long y = Math.round(RED_WEIGHT * r + GREEN_WEIGHT * g + BLUE_WEIGHT * b);
        return clamp((int) y);
    }

    public static int toGrayscale(int packedRgb) {
        return toGrayscale(PixelGrid.red(packedRgb), PixelGrid.green(packedRgb), PixelGrid.blue(packedRgb));
    }

    public LuminanceGrid convert(PixelGrid grid) {
        int n = grid.pixelCount();
        int[] gray = new int[n];
        for (int i = 0; i < n; i++) {
            gray[i] = toGrayscale(grid.rgbAt(i));
        }
        return new LuminanceGrid(grid.width(), grid.height(), gray);
    }

    private static int clamp(int v) {
        return (v < 0) ? 0 : Math.min(255, v);
    }
}
