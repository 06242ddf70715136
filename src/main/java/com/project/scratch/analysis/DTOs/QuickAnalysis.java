package com.project.scratch.analysis.DTOs;

import java.util.List;
import java.util.UUID;

public record QuickAnalysis(UUID experimentId, List<ImageQuickStats> images, int count) {}
