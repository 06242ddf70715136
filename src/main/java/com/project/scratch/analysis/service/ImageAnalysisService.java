package com.project.scratch.analysis.service;

import com.project.scratch.analysis.DTOs.AnalysisResult;
import com.project.scratch.analysis.DTOs.ExperimentRecalculation;
import com.project.scratch.analysis.DTOs.Histogram;
import com.project.scratch.analysis.DTOs.HistogramPayload;
import com.project.scratch.analysis.DTOs.ImageQuickStats;
import com.project.scratch.analysis.DTOs.ImageRef;
import com.project.scratch.analysis.DTOs.LuminanceGrid;
import com.project.scratch.analysis.DTOs.PixelGrid;
import com.project.scratch.analysis.DTOs.QuickAnalysis;
import com.project.scratch.analysis.DTOs.RecalculationSummary;
import com.project.scratch.analysis.DTOs.Region;
import com.project.scratch.analysis.exceptions.ExperimentNotFoundException;
import com.project.scratch.analysis.exceptions.MissingReferenceImageException;
import com.project.scratch.analysis.exceptions.RecomputeAbortedException;
import com.project.scratch.analysis.store.ExperimentStore;
import com.project.scratch.analysis.store.ImageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Computes and maintains the scratch results of experiments.
 *
 * <p>Two modes keep an experiment's result set up to date:
 * <ul>
 *     <li><b>incremental</b> ({@link #analyzeSingleImage}) scores one image against the reference
 *     and upserts its entry; other entries are not touched;</li>
 *     <li><b>full</b> ({@link #recalculateExperiment}) rescores every image in parallel and swaps
 *     in the whole set at once. Needed whenever the region changes.</li>
 * </ul>
 * All writes to one experiment are serialized through {@link ExperimentLockRegistry}.
 */
@Service
public class ImageAnalysisService {
    private static final Logger log = LoggerFactory.getLogger(ImageAnalysisService.class);

    static final int MAX_QUICK_ANALYSIS_LIMIT = 1000;

    private final ImageStore imageStore;
    private final ExperimentStore experimentStore;
    private final ImageDecoder decoder;
    private final RegionExtractor regionExtractor;
    private final GrayscaleConverter grayscaleConverter;
    private final HistogramBuilder histogramBuilder;
    private final ScratchIndexCalculator scratchIndexCalculator;
    private final ExperimentLockRegistry locks;
    private final ExecutorService analysisExecutor;
    private final Duration recalculateTimeout;

    public ImageAnalysisService(ImageStore imageStore,
                                ExperimentStore experimentStore,
                                ImageDecoder decoder,
                                RegionExtractor regionExtractor,
                                GrayscaleConverter grayscaleConverter,
                                HistogramBuilder histogramBuilder,
                                ScratchIndexCalculator scratchIndexCalculator,
                                ExperimentLockRegistry locks,
                                ExecutorService analysisExecutor,
                                @Value("${app.analysis.recalculate-timeout:120s}") Duration recalculateTimeout) {
        this.imageStore = imageStore;
        this.experimentStore = experimentStore;
        this.decoder = decoder;
        this.regionExtractor = regionExtractor;
        this.grayscaleConverter = grayscaleConverter;
        this.histogramBuilder = histogramBuilder;
        this.scratchIndexCalculator = scratchIndexCalculator;
        this.locks = locks;
        this.analysisExecutor = analysisExecutor;
        this.recalculateTimeout = recalculateTimeout;
    }

    /**
     * Decode, crop, convert and count one image. Pure: safe to run on any thread.
     */
    public Histogram computeHistogram(byte[] imageBytes, Region region) {
        PixelGrid grid = decoder.decode(imageBytes);
        PixelGrid cropped = regionExtractor.crop(grid, region);
        LuminanceGrid gray = grayscaleConverter.convert(cropped);
        return histogramBuilder.build(gray);
    }

    /**
     * Scores one image against its experiment's reference and stores the result, replacing any
     * previous entry of the same image. An experiment without a reference image promotes the
     * analyzed image to reference, which scores 0.
     */
    public AnalysisResult analyzeSingleImage(UUID imageId) {
        ImageRef image = imageStore.getImage(imageId);
        UUID experimentId = image.experimentId();
        requireExperiment(experimentId);

        return locks.withLock(experimentId, () -> {
            Region region = experimentStore.getRegion(experimentId).orElse(null);
            Histogram test = computeHistogram(imageStore.getBytes(imageId), region);

            Histogram reference;
            try {
                ImageRef referenceImage = findReference(experimentId, imageStore.listByExperiment(experimentId));
                reference = referenceImage.id().equals(imageId)
                        ? test
                        : computeHistogram(imageStore.getBytes(referenceImage.id()), region);
            } catch (MissingReferenceImageException e) {
                log.warn("{}; image {} (passes={}) becomes the reference", e.getMessage(), imageId, image.passes());
                reference = test;
            }

            double index = scratchIndexCalculator.scratchIndex(reference, test);
            AnalysisResult result = new AnalysisResult(imageId, image.passes(), index);
            experimentStore.upsertResult(experimentId, result);

            log.info("Image {} analyzed for experiment {}: passes={}, scratchIndex={}",
                    imageId, experimentId, image.passes(), index);
            return result;
        });
    }

    /**
     * Rescores every image of the experiment with its current region and replaces the stored
     * result set. On any failure the stored set stays as it was.
     *
     * @throws RecomputeAbortedException at the first image (in upload order) that fails
     * @throws MissingReferenceImageException if the experiment has images but none with passes 0
     */
    public ExperimentRecalculation recalculateExperiment(UUID experimentId) {
        requireExperiment(experimentId);
        return locks.withLock(experimentId, () -> {
            Region region = experimentStore.getRegion(experimentId).orElse(null);
            List<AnalysisResult> results = computeResults(experimentId, region);
            experimentStore.replaceResultSet(experimentId, results);
            log.info("Experiment {} recalculated: {} images", experimentId, results.size());
            return new ExperimentRecalculation(experimentId, results, RecalculationSummary.of(results));
        });
    }

    /**
     * Changes the experiment's region and rescores all images with it. The region is stored only
     * when every image could be scored, together with the new results.
     *
     * @param region new region, or {@code null} for whole images
     */
    public ExperimentRecalculation updateRegion(UUID experimentId, Region region) {
        requireExperiment(experimentId);
        if (region != null) {
            regionExtractor.validateShape(region);
        }
        return locks.withLock(experimentId, () -> {
            List<AnalysisResult> results = computeResults(experimentId, region);
            experimentStore.replaceRegionAndResults(experimentId, region, results);
            log.info("Region of experiment {} set to {}, {} images recalculated", experimentId, region, results.size());
            return new ExperimentRecalculation(experimentId, results, RecalculationSummary.of(results));
        });
    }

    /**
     * Deletes an image together with its scratch result.
     */
    public void removeImage(UUID imageId) {
        ImageRef image = imageStore.getImage(imageId);
        UUID experimentId = image.experimentId();
        locks.withLock(experimentId, () -> {
            imageStore.delete(imageId);
            if (experimentStore.exists(experimentId)) {
                experimentStore.removeResult(experimentId, imageId);
            }
            if (image.isReference()) {
                log.warn("Reference image {} of experiment {} deleted; remaining results have no baseline",
                        imageId, experimentId);
            } else {
                log.info("Image {} removed from experiment {}", imageId, experimentId);
            }
        });
    }

    /** Histogram of one image under its experiment's region. Nothing is stored. */
    public HistogramPayload getImageHistogram(UUID imageId) {
        ImageRef image = imageStore.getImage(imageId);
        Region region = experimentStore.exists(image.experimentId())
                ? experimentStore.getRegion(image.experimentId()).orElse(null)
                : null;
        Histogram histogram = computeHistogram(imageStore.getBytes(imageId), region);
        log.debug("Histogram of image {}: {}", imageId, histogram);
        return HistogramPayload.of(imageId, histogram);
    }

    /** Per-image brightness statistics for a page of the experiment's images. Nothing is stored. */
    public QuickAnalysis quickAnalysis(UUID experimentId, int skip, int limit) {
        if (skip < 0) {
            throw new IllegalArgumentException("skip must be non-negative");
        }
        if (limit < 1 || limit > MAX_QUICK_ANALYSIS_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_QUICK_ANALYSIS_LIMIT);
        }
        requireExperiment(experimentId);
        Region region = experimentStore.getRegion(experimentId).orElse(null);

        List<ImageQuickStats> stats = new ArrayList<>();
        for (ImageRef image : imageStore.listByExperiment(experimentId).stream().skip(skip).limit(limit).toList()) {
            Histogram h = computeHistogram(imageStore.getBytes(image.id()), region);
            stats.add(new ImageQuickStats(image.id(), image.passes(), h.totalPixels(),
                    h.dominantBrightness(), h.weightedAverageBrightness()));
        }
        return new QuickAnalysis(experimentId, stats, stats.size());
    }

    public List<AnalysisResult> getResults(UUID experimentId) {
        requireExperiment(experimentId);
        return experimentStore.getResultSet(experimentId);
    }

    private List<AnalysisResult> computeResults(UUID experimentId, Region region) {
        List<ImageRef> images = imageStore.listByExperiment(experimentId);
        if (images.isEmpty()) {
            return List.of();
        }
        ImageRef reference = findReference(experimentId, images);

        long deadline = System.nanoTime() + recalculateTimeout.toNanos();
        List<Future<Histogram>> futures = new ArrayList<>(images.size());
        for (ImageRef image : images) {
            futures.add(analysisExecutor.submit(() -> computeHistogram(imageStore.getBytes(image.id()), region)));
        }

        Histogram[] histograms = new Histogram[images.size()];
        try {
            for (int i = 0; i < images.size(); i++) {
                histograms[i] = await(futures.get(i), deadline, experimentId, images.get(i));
            }
        } catch (TimeoutException e) {
            throw timedOut(experimentId, images, futures, e);
        } finally {
            futures.forEach(f -> f.cancel(true));
        }

        Histogram referenceHistogram = histograms[images.indexOf(reference)];
        List<AnalysisResult> results = new ArrayList<>(images.size());
        for (int i = 0; i < images.size(); i++) {
            ImageRef image = images.get(i);
            double index = image.id().equals(reference.id())
                    ? 0.0
                    : scratchIndexCalculator.scratchIndex(referenceHistogram, histograms[i]);
            results.add(new AnalysisResult(image.id(), image.passes(), index));
        }
        // stable: images with equal passes keep upload order
        results.sort(Comparator.comparingInt(AnalysisResult::passes));
        return results;
    }

    private Histogram await(Future<Histogram> future, long deadline, UUID experimentId, ImageRef image)
            throws TimeoutException {
        try {
            return future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Image {} of experiment {} failed: {}", image.id(), experimentId, cause.getMessage());
            throw new RecomputeAbortedException(experimentId, image.id(), cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecomputeAbortedException(experimentId, image.id(), "interrupted", e);
        }
    }

    /**
     * The deadline is experiment wide; the reported image is the first one, in upload order, that
     * had not finished when it passed.
     */
    private RecomputeAbortedException timedOut(UUID experimentId, List<ImageRef> images,
                                               List<Future<Histogram>> futures, TimeoutException e) {
        UUID firstUnfinished = null;
        int unfinished = 0;
        for (int i = 0; i < images.size(); i++) {
            if (!futures.get(i).isDone()) {
                unfinished++;
                if (firstUnfinished == null) {
                    firstUnfinished = images.get(i).id();
                }
            }
        }
        String reason = "recalculation exceeded " + recalculateTimeout + " with " + unfinished
                + " of " + images.size() + " images unfinished";
        log.warn("Experiment {}: {}", experimentId, reason);
        return new RecomputeAbortedException(experimentId, firstUnfinished, reason, e);
    }

    private ImageRef findReference(UUID experimentId, List<ImageRef> images) {
        List<ImageRef> references = images.stream().filter(ImageRef::isReference).toList();
        if (references.isEmpty()) {
            throw new MissingReferenceImageException(experimentId);
        }
        if (references.size() > 1) {
            log.warn("Experiment {} has {} images with passes=0, using {} as reference",
                    experimentId, references.size(), references.get(0).id());
        }
        return references.get(0);
    }

    private void requireExperiment(UUID experimentId) {
        if (!experimentStore.exists(experimentId)) {
            throw new ExperimentNotFoundException(experimentId);
        }
    }
}
