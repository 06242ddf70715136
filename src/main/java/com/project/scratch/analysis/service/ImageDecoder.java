package com.project.scratch.analysis.service;

import com.project.scratch.analysis.DTOs.PixelGrid;
import com.project.scratch.analysis.exceptions.DecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

/**
 * Turns stored image bytes into an RGB pixel grid. Any format readable by {@link ImageIO} is
 * accepted; alpha is dropped and palette/gray images are expanded to RGB.
 *
 * <p>Dimensions are read from the header before any pixel buffer is allocated, and images larger
 * than {@code app.analysis.max-image-dimension} on either side are rejected.
 */
@Component
public class ImageDecoder {
    private static final Logger log = LoggerFactory.getLogger(ImageDecoder.class);

    static final int DEFAULT_MAX_DIMENSION = 4000;

    private final int maxDimension;

    public ImageDecoder() {
        this(DEFAULT_MAX_DIMENSION);
    }

    @Autowired
    public ImageDecoder(@Value("${app.analysis.max-image-dimension:4000}") int maxDimension) {
        if (maxDimension < 1) {
            throw new IllegalArgumentException("Maximum image dimension must be positive, got " + maxDimension);
        }
        this.maxDimension = maxDimension;
    }

    public PixelGrid decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new DecodeException("Image is empty.");
        }
        BufferedImage image;
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            image = read(in);
        } catch (DecodeException e) {
            throw e;
        } catch (IOException e) {
            throw new DecodeException("Image could not be read: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // malformed headers surface from the readers as unchecked exceptions
            throw new DecodeException("Image could not be decoded: " + e, e);
        }
        if (image == null) {
            throw new DecodeException("Unsupported or corrupted image format.");
        }
        log.debug("Image decoded: {}x{}", image.getWidth(), image.getHeight());
        return PixelGrid.fromImage(image);
    }

    private BufferedImage read(ImageInputStream in) throws IOException {
        if (in == null) {
            return null;
        }
        Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
        if (!readers.hasNext()) {
            return null;
        }
        ImageReader reader = readers.next();
        try {
            reader.setInput(in, true, true);
            int width = reader.getWidth(0);
            int height = reader.getHeight(0);
            if (width <= 0 || height <= 0) {
                throw new DecodeException("Image has no pixels.");
            }
            if (width > maxDimension || height > maxDimension) {
                throw new DecodeException("Image is too large: " + width + "x" + height
                        + ", maximum is " + maxDimension + "x" + maxDimension);
            }
            return reader.read(0);
        } finally {
            reader.dispose();
        }
    }
}
