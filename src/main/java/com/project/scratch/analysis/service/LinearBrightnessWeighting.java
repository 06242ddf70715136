package com.project.scratch.analysis.service;

/** Default weighting {@code w(q) = q / 255}. */
public class LinearBrightnessWeighting implements BrightnessWeighting {

    @Override
    public double weight(int level) {
        return level / 255.0;
    }
}
