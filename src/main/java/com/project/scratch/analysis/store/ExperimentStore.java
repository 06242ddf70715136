package com.project.scratch.analysis.store;

import com.project.scratch.analysis.DTOs.AnalysisResult;
import com.project.scratch.analysis.DTOs.Region;
import com.project.scratch.analysis.exceptions.ExperimentNotFoundException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Holds each experiment's analysis region and scratch result set. All methods taking an
 * experiment id throw {@link ExperimentNotFoundException} for unknown experiments, except
 * {@link #exists(UUID)}.
 */
public interface ExperimentStore {

    UUID create();

    boolean exists(UUID experimentId);

    Optional<Region> getRegion(UUID experimentId);

    List<AnalysisResult> getResultSet(UUID experimentId);

    /** Replaces the whole result set in one step; readers never observe a partial set. */
    void replaceResultSet(UUID experimentId, List<AnalysisResult> results);

    /**
     * Stores a new region and the result set computed under it in one step; readers see either
     * both old values or both new ones.
     *
     * @param region new region, or {@code null} to analyze whole images
     */
    void replaceRegionAndResults(UUID experimentId, Region region, List<AnalysisResult> results);

    /** Replaces the entry with the same image id in place, or appends. */
    void upsertResult(UUID experimentId, AnalysisResult result);

    /** @return false if the result set had no entry for the image */
    boolean removeResult(UUID experimentId, UUID imageId);
}
