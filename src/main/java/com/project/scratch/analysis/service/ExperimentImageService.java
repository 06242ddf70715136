package com.project.scratch.analysis.service;

import com.project.scratch.analysis.DTOs.AnalysisResult;
import com.project.scratch.analysis.DTOs.ImageRef;
import com.project.scratch.analysis.exceptions.ExperimentNotFoundException;
import com.project.scratch.analysis.store.ExperimentStore;
import com.project.scratch.analysis.store.ImageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Adds images to experiments and scores them right away.
 *
 * <p>The first image of an experiment must be the untouched reference (passes = 0) and there is
 * only ever one reference. An image that cannot be analyzed is not kept.
 */
@Service
public class ExperimentImageService {
    private static final Logger log = LoggerFactory.getLogger(ExperimentImageService.class);

    private final ImageStore imageStore;
    private final ExperimentStore experimentStore;
    private final ImageAnalysisService analysisService;
    private final ExperimentLockRegistry locks;

    public ExperimentImageService(ImageStore imageStore,
                                  ExperimentStore experimentStore,
                                  ImageAnalysisService analysisService,
                                  ExperimentLockRegistry locks) {
        this.imageStore = imageStore;
        this.experimentStore = experimentStore;
        this.analysisService = analysisService;
        this.locks = locks;
    }

    public AnalysisResult upload(UUID experimentId, int passes, String filename, byte[] content) {
        if (passes < 0) {
            throw new IllegalArgumentException("Passes must be non-negative, got " + passes);
        }
        if (!experimentStore.exists(experimentId)) {
            throw new ExperimentNotFoundException(experimentId);
        }
        return locks.withLock(experimentId, () -> {
            checkReferenceRule(experimentId, passes);
            ImageRef image = imageStore.save(experimentId, passes, filename, content);
            log.info("Image {} uploaded to experiment {} (passes={}, {}KB)",
                    image.id(), experimentId, passes, content.length / 1024);
            try {
                return analysisService.analyzeSingleImage(image.id());
            } catch (RuntimeException e) {
                log.warn("Analysis of uploaded image {} failed, discarding it: {}", image.id(), e.getMessage());
                imageStore.delete(image.id());
                throw e;
            }
        });
    }

    private void checkReferenceRule(UUID experimentId, int passes) {
        List<ImageRef> existing = imageStore.listByExperiment(experimentId);
        boolean hasReference = existing.stream().anyMatch(ImageRef::isReference);
        if (!hasReference && passes != 0) {
            throw new IllegalArgumentException(
                    "Experiment " + experimentId + " has no reference image yet; upload the passes=0 image first");
        }
        if (hasReference && passes == 0) {
            throw new IllegalArgumentException("Experiment " + experimentId + " already has a reference image");
        }
    }
}
