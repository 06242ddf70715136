package com.project.scratch.analysis.exceptions;

import java.util.UUID;

public class ExperimentNotFoundException extends AnalysisException {
    private final UUID experimentId;

    public ExperimentNotFoundException(UUID experimentId) {
        super("Experiment with id " + experimentId + " not found");
        this.experimentId = experimentId;
    }

    public UUID getExperimentId() { return experimentId; }
}
