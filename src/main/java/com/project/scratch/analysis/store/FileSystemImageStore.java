package com.project.scratch.analysis.store;

import com.project.scratch.analysis.DTOs.ImageRef;
import com.project.scratch.analysis.exceptions.ImageNotFoundException;
import com.project.scratch.analysis.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps image bytes as files under {@code app.upload.dir}, one sub-directory per experiment.
 * Image metadata (experiment, passes, upload order) lives in memory.
 */
@Repository
public class FileSystemImageStore implements ImageStore {
    private static final Logger log = LoggerFactory.getLogger(FileSystemImageStore.class);

    private record StoredImage(ImageRef ref, Path path, long sequence) {}

    private final Path rootDir;
    private final ConcurrentMap<UUID, StoredImage> images = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public FileSystemImageStore(@Value("${app.upload.dir:uploads}") String root) {
        this.rootDir = Paths.get(root).toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.rootDir);
            log.info("Using upload directory: {}", this.rootDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create upload directory: " + rootDir, e);
        }
    }

    @Override
    public ImageRef getImage(UUID imageId) {
        return stored(imageId).ref();
    }

    @Override
    public byte[] getBytes(UUID imageId) {
        StoredImage image = stored(imageId);
        try {
            return Files.readAllBytes(image.path());
        } catch (NoSuchFileException e) {
            throw new ImageNotFoundException(imageId);
        } catch (IOException e) {
            throw new StorageException("Failed to read image " + imageId, e);
        }
    }

    @Override
    public List<ImageRef> listByExperiment(UUID experimentId) {
        return images.values().stream()
                .filter(s -> s.ref().experimentId().equals(experimentId))
                .sorted(Comparator.comparingLong(StoredImage::sequence))
                .map(StoredImage::ref)
                .toList();
    }

    @Override
    public ImageRef save(UUID experimentId, int passes, String originalFilename, byte[] content) {
        if (content == null || content.length == 0) {
            throw new StorageException("Empty upload");
        }
        if (passes < 0) {
            throw new IllegalArgumentException("Passes must be non-negative, got " + passes);
        }
        UUID imageId = UUID.randomUUID();
        String original = StringUtils.cleanPath(originalFilename == null ? "upload" : originalFilename);
        String extension = StringUtils.getFilenameExtension(original);
        String filename = imageId + (extension == null ? "" : "." + extension.replaceAll("[^a-zA-Z0-9]", ""));
        Path dir = rootDir.resolve(experimentId.toString());
        Path target = dir.resolve(filename);
        try {
            Files.createDirectories(dir);
            Files.write(target, content);
        } catch (IOException e) {
            throw new StorageException("Failed to store file", e);
        }
        ImageRef ref = new ImageRef(imageId, experimentId, passes);
        images.put(imageId, new StoredImage(ref, target, sequence.incrementAndGet()));
        log.debug("Stored image {} ({} bytes) for experiment {} as {}", imageId, content.length, experimentId, target);
        return ref;
    }

    @Override
    public boolean delete(UUID imageId) {
        StoredImage removed = images.remove(imageId);
        if (removed == null) {
            return false;
        }
        try {
            Files.deleteIfExists(removed.path());
        } catch (IOException e) {
            throw new StorageException("Failed to delete image file " + removed.path(), e);
        }
        return true;
    }

    private StoredImage stored(UUID imageId) {
        StoredImage image = images.get(imageId);
        if (image == null) {
            throw new ImageNotFoundException(imageId);
        }
        return image;
    }
}
