package com.project.scratch.analysis.DTOs;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Decoded RGB pixels stored row-major as packed {@code 0xRRGGBB} ints.
 */
public final class PixelGrid {
    private final int width;
    private final int height;
    private final int[] rgb;

    public PixelGrid(int width, int height, int[] rgb) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + width + "x" + height);
        }
        if (rgb.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " pixels, got " + rgb.length);
        }
        this.width = width;
        this.height = height;
        this.rgb = rgb;
    }

    public static PixelGrid fromImage(BufferedImage image) {
        int w = image.getWidth(), h = image.getHeight();
        int[] argb = new int[w * h];
        image.getRGB(0, 0, w, h, argb, 0, w);
        for (int i = 0; i < argb.length; i++) {
            argb[i] &= 0xFFFFFF;
        }
        return new PixelGrid(w, h, argb);
    }

    /** A grid where every pixel has the same color. */
    public static PixelGrid filled(int width, int height, int r, int g, int b) {
        int[] rgb = new int[width * height];
        Arrays.fill(rgb, pack(r, g, b));
        return new PixelGrid(width, height, rgb);
    }

    public static int pack(int r, int g, int b) {
        return ((r & 0xFF) << 16) | ((g & 0xFF) << 8) | (b & 0xFF);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int pixelCount() {
        return rgb.length;
    }

    public int rgb(int x, int y) {
        return rgb[y * width + x];
    }

    public int rgbAt(int index) {
        return rgb[index];
    }

    public static int red(int packed) {
        return (packed >> 16) & 0xFF;
    }

    public static int green(int packed) {
        return (packed >> 8) & 0xFF;
    }

    public static int blue(int packed) {
        return packed & 0xFF;
    }
}
