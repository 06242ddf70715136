package com.project.scratch.analysis.exceptions;

import java.util.UUID;

public class MissingReferenceImageException extends AnalysisException {
    private final UUID experimentId;

    public MissingReferenceImageException(UUID experimentId) {
        super("Experiment " + experimentId + " has no reference image (passes = 0)");
        this.experimentId = experimentId;
    }

    public UUID getExperimentId() { return experimentId; }
}
