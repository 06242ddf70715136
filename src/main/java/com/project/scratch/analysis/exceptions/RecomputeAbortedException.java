package com.project.scratch.analysis.exceptions;

import java.util.UUID;

/**
 * Full recalculation stopped at the first image that could not be analyzed, or ran out of time.
 * The previously stored results are left untouched. {@link #getImageId()} is {@code null} when a
 * timeout cannot be attributed to an unfinished image.
 */
public class RecomputeAbortedException extends AnalysisException {
    private final UUID experimentId;
    private final UUID imageId;
    private final String reason;

    public RecomputeAbortedException(UUID experimentId, UUID imageId, String reason, Throwable cause) {
        super("Recalculation of experiment " + experimentId + " aborted"
                + (imageId == null ? "" : " at image " + imageId) + ": " + reason, cause);
        this.experimentId = experimentId;
        this.imageId = imageId;
        this.reason = reason;
    }

    public UUID getExperimentId() { return experimentId; }
    public UUID getImageId() { return imageId; }
    public String getReason() { return reason; }
}
