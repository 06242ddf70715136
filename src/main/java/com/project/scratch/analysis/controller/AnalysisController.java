package com.project.scratch.analysis.controller;

import com.project.scratch.analysis.DTOs.AnalysisResult;
import com.project.scratch.analysis.DTOs.ExperimentRecalculation;
import com.project.scratch.analysis.DTOs.HistogramPayload;
import com.project.scratch.analysis.DTOs.QuickAnalysis;
import com.project.scratch.analysis.service.ImageAnalysisService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Scratch analysis endpoints. Thin: every call delegates to {@link ImageAnalysisService}.
 */
@RestController
@RequestMapping("/analysis")
@Validated
public class AnalysisController {
    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final ImageAnalysisService analysisService;

    public AnalysisController(ImageAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/image/{imageId}")
    public AnalysisResult analyzeSingleImage(@PathVariable UUID imageId) {
        log.debug("Incremental analysis requested for image {}", imageId);
        return analysisService.analyzeSingleImage(imageId);
    }

    @PostMapping("/experiment/{experimentId}/recalculate")
    public ExperimentRecalculation recalculateExperiment(@PathVariable UUID experimentId) {
        log.debug("Full recalculation requested for experiment {}", experimentId);
        return analysisService.recalculateExperiment(experimentId);
    }

    @GetMapping("/histogram/{imageId}")
    public HistogramPayload getImageHistogram(@PathVariable UUID imageId) {
        return analysisService.getImageHistogram(imageId);
    }

    @GetMapping("/experiment/{experimentId}/quick-analysis")
    public QuickAnalysis quickAnalysis(
            @PathVariable UUID experimentId,
            @RequestParam(name = "skip", defaultValue = "0") @Min(0) int skip,
            @RequestParam(name = "limit", defaultValue = "100") @Min(1) @Max(1000) int limit
    ) {
        return analysisService.quickAnalysis(experimentId, skip, limit);
    }
}
