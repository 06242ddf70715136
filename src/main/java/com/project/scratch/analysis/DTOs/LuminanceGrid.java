package com.project.scratch.analysis.DTOs;

/**
 * Single channel brightness values (0..255), row-major.
 */
public final class LuminanceGrid {
    private final int width;
    private final int height;
    private final int[] values;

    public LuminanceGrid(int width, int height, int[] values) {
        if (values.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " values, got " + values.length);
        }
        this.width = width;
        this.height = height;
        this.values = values;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int size() {
        return values.length;
    }

    public int valueAt(int index) {
        return values[index];
    }

    public int value(int x, int y) {
        return values[y * width + x];
    }
}
