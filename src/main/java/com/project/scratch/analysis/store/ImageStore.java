package com.project.scratch.analysis.store;

import com.project.scratch.analysis.DTOs.ImageRef;
import com.project.scratch.analysis.exceptions.ImageNotFoundException;

import java.util.List;
import java.util.UUID;

/**
 * Source of experiment images and their raw bytes.
 */
public interface ImageStore {

    /** @throws ImageNotFoundException if the id is unknown */
    ImageRef getImage(UUID imageId);

    /** @throws ImageNotFoundException if the id is unknown */
    byte[] getBytes(UUID imageId);

    /** Images of the experiment in upload order; empty if there are none. */
    List<ImageRef> listByExperiment(UUID experimentId);

    ImageRef save(UUID experimentId, int passes, String originalFilename, byte[] content);

    /** @return false if no image had this id */
    boolean delete(UUID imageId);
}
