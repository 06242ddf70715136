package com.project.scratch.analysis.DTOs;

import java.util.UUID;

public record ImageQuickStats(
        UUID imageId,
        int passes,
        long totalPixels,
        int dominantBrightness,
        double weightedAverageBrightness
) {}
