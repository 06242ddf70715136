package com.project.scratch.analysis.controller;

import com.project.scratch.analysis.DTOs.AnalysisResult;
import com.project.scratch.analysis.DTOs.ExperimentRecalculation;
import com.project.scratch.analysis.DTOs.Region;
import com.project.scratch.analysis.service.ExperimentImageService;
import com.project.scratch.analysis.service.ImageAnalysisService;
import com.project.scratch.analysis.store.ExperimentStore;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Experiment side of the API: registering experiments, uploading and deleting images,
 * and setting the analysis region.
 */
@RestController
@Validated
public class ExperimentController {
    private static final Logger log = LoggerFactory.getLogger(ExperimentController.class);

    private static final List<String> SUPPORTED_FORMATS = Arrays.asList(
            "image/jpeg", "image/jpg", "image/png", "image/gif", "image/bmp", "image/webp"
    );
    private static final long MAX_UPLOAD_SIZE = 10 * 1024 * 1024;

    private final ExperimentStore experimentStore;
    private final ExperimentImageService imageService;
    private final ImageAnalysisService analysisService;

    public ExperimentController(ExperimentStore experimentStore,
                                ExperimentImageService imageService,
                                ImageAnalysisService analysisService) {
        this.experimentStore = experimentStore;
        this.imageService = imageService;
        this.analysisService = analysisService;
    }

    @PostMapping("/experiments")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, UUID> createExperiment() {
        return Map.of("experiment_id", experimentStore.create());
    }

    @GetMapping("/experiments/{experimentId}/results")
    public List<AnalysisResult> getResults(@PathVariable UUID experimentId) {
        return analysisService.getResults(experimentId);
    }

    @PutMapping(value = "/experiments/{experimentId}/region", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ExperimentRecalculation updateRegion(@PathVariable UUID experimentId, @RequestBody Region region) {
        log.info("Region update for experiment {}: {}", experimentId, region);
        return analysisService.updateRegion(experimentId, region);
    }

    @DeleteMapping("/experiments/{experimentId}/region")
    public ExperimentRecalculation clearRegion(@PathVariable UUID experimentId) {
        log.info("Region cleared for experiment {}", experimentId);
        return analysisService.updateRegion(experimentId, null);
    }

    @PostMapping(value = "/experiments/{experimentId}/images", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public AnalysisResult uploadImage(
            @PathVariable UUID experimentId,
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam("passes") @Min(value = 0, message = "Passes must be non-negative") int passes
    ) throws IOException {
        validateUploadedFile(file);
        log.info("Processing upload: {} ({}KB), passes: {}",
                file.getOriginalFilename(), file.getSize() / 1024, passes);
        return imageService.upload(experimentId, passes, file.getOriginalFilename(), file.getBytes());
    }

    @DeleteMapping("/images/{imageId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteImage(@PathVariable UUID imageId) {
        analysisService.removeImage(imageId);
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose a file to upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new IllegalArgumentException(
                    "Unsupported file format: " + contentType +
                            ". Supported formats: " + String.join(", ", SUPPORTED_FORMATS)
            );
        }
        // on top of the multipart limit in application.properties
        if (file.getSize() > MAX_UPLOAD_SIZE) {
            throw new IllegalArgumentException("File is too large. Maximum size: 10MB");
        }
    }
}
