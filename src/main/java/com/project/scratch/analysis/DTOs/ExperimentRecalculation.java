package com.project.scratch.analysis.DTOs;

import java.util.List;
import java.util.UUID;

public record ExperimentRecalculation(
        UUID experimentId,
        List<AnalysisResult> scratchResults,
        RecalculationSummary summary
) {}
