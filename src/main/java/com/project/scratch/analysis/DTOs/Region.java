package com.project.scratch.analysis.DTOs;

/**
 * Rectangular region of interest in pixel coordinates. The same region is applied
 * to every image of an experiment.
 */
public record Region(int x, int y, int width, int height) {

    public int right() {
        return x + width;
    }

    public int bottom() {
        return y + height;
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ", " + width + ", " + height + ")";
    }
}
