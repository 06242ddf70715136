package com.project.scratch.analysis.service;

import com.project.scratch.analysis.DTOs.PixelGrid;
import com.project.scratch.analysis.DTOs.Region;
import com.project.scratch.analysis.exceptions.InvalidRegionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Crops decoded images to the experiment's region of interest.
 *
 * <p>Regions that do not fit are rejected rather than clamped: a silently shrunk area
 * would no longer be comparable with the other images of the experiment.
 */
@Component
public class RegionExtractor {
    private static final Logger log = LoggerFactory.getLogger(RegionExtractor.class);

    /**
     * @param region region to keep, or {@code null} for the whole image
     * @throws InvalidRegionException if the region has no area or is not fully inside the grid
     */
    public PixelGrid crop(PixelGrid grid, Region region) {
        if (region == null) {
            return grid;
        }
        validateShape(region);
        if (region.right() > grid.width() || region.bottom() > grid.height()) {
            throw new InvalidRegionException("Region " + region + " out of bounds for image "
                    + grid.width() + "x" + grid.height());
        }
        if (region.x() == 0 && region.y() == 0
                && region.width() == grid.width() && region.height() == grid.height()) {
            return grid;
        }

        int[] out = new int[region.width() * region.height()];
        for (int row = 0; row < region.height(); row++) {
            int sy = region.y() + row;
            for (int col = 0; col < region.width(); col++) {
                out[row * region.width() + col] = grid.rgb(region.x() + col, sy);
            }
        }
        log.debug("Cropped {}x{} image to region {}", grid.width(), grid.height(), region);
        return new PixelGrid(region.width(), region.height(), out);
    }

    /** Checks the part of the region contract that does not depend on an image. */
    public void validateShape(Region region) {
        if (region.width() <= 0 || region.height() <= 0) {
            throw new InvalidRegionException("Region " + region + " must have positive width and height");
        }
        if (region.x() < 0 || region.y() < 0) {
            throw new InvalidRegionException("Region " + region + " must have a non-negative origin");
        }
        // int overflow would wrap the bounds check in crop
        if ((long) region.x() + region.width() > Integer.MAX_VALUE
                || (long) region.y() + region.height() > Integer.MAX_VALUE) {
            throw new InvalidRegionException("Region " + region + " is too large");
        }
    }
}
