package com.project.scratch.analysis.service;

/**
 * Importance of a gray level when comparing histograms. Brighter levels are closer to the
 * reflective undamaged film surface and should weigh more.
 */
@FunctionalInterface
public interface BrightnessWeighting {

    /**
     * @param level gray level 0..255
     * @return non-negative weight, at most 1
     */
    double weight(int level);
}
