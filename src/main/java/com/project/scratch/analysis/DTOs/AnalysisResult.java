package com.project.scratch.analysis.DTOs;

import java.util.UUID;

/**
 * Scratch index of one image relative to its experiment's reference image.
 */
public record AnalysisResult(UUID imageId, int passes, double scratchIndex) {}
