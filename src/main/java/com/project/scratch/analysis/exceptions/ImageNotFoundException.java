package com.project.scratch.analysis.exceptions;

import java.util.UUID;

public class ImageNotFoundException extends AnalysisException {
    private final UUID imageId;

    public ImageNotFoundException(UUID imageId) {
        super("Image with id " + imageId + " not found");
        this.imageId = imageId;
    }

    public UUID getImageId() { return imageId; }
}
