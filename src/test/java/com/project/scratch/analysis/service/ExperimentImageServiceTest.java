package com.project.scratch.analysis.service;

import com.project.scratch.analysis.DTOs.AnalysisResult;
import com.project.scratch.analysis.DTOs.PixelGrid;
import com.project.scratch.analysis.exceptions.DecodeException;
import com.project.scratch.analysis.exceptions.ExperimentNotFoundException;
import com.project.scratch.analysis.store.FileSystemImageStore;
import com.project.scratch.analysis.store.InMemoryExperimentStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.project.scratch.analysis.TestImages.pngHeaderOnly;
import static com.project.scratch.analysis.TestImages.solidPng;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExperimentImageServiceTest {

    @TempDir
    Path uploads;

    private FileSystemImageStore imageStore;
    private InMemoryExperimentStore experimentStore;
    private ExecutorService executor;
    private UUID experimentId;

    @BeforeEach
    void setup() {
        imageStore = new FileSystemImageStore(uploads.toString());
        experimentStore = new InMemoryExperimentStore();
        executor = Executors.newFixedThreadPool(2);
        experimentId = experimentStore.create();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ExperimentImageService uploadsWith(ImageDecoder decoder) {
        ExperimentLockRegistry locks = new ExperimentLockRegistry();
        ImageAnalysisService analysis = new ImageAnalysisService(imageStore, experimentStore, decoder,
                new RegionExtractor(), new GrayscaleConverter(), new HistogramBuilder(), new ScratchIndexCalculator(),
                locks, executor, Duration.ofSeconds(30));
        return new ExperimentImageService(imageStore, experimentStore, analysis, locks);
    }

    @Test
    void upload_scoresAgainstReference() {
        ExperimentImageService service = uploadsWith(new ImageDecoder());

        AnalysisResult reference = service.upload(experimentId, 0, "ref.png", solidPng(20, 20, Color.WHITE));
        AnalysisResult black = service.upload(experimentId, 10, "black.png", solidPng(20, 20, Color.BLACK));

        assertThat(reference.scratchIndex()).isEqualTo(0.0);
        assertThat(black.scratchIndex()).isEqualTo(1.0);
        assertThat(experimentStore.getResultSet(experimentId)).containsExactly(reference, black);
    }

    @Test
    void upload_enforcesSingleLeadingReference() {
        ExperimentImageService service = uploadsWith(new ImageDecoder());

        assertThatThrownBy(() -> service.upload(experimentId, 3, "a.png", solidPng(10, 10, Color.GRAY)))
                .isInstanceOf(IllegalArgumentException.class);
        service.upload(experimentId, 0, "ref.png", solidPng(10, 10, Color.WHITE));
        assertThatThrownBy(() -> service.upload(experimentId, 0, "ref2.png", solidPng(10, 10, Color.WHITE)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.upload(experimentId, -1, "neg.png", solidPng(10, 10, Color.WHITE)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.upload(UUID.randomUUID(), 0, "x.png", solidPng(10, 10, Color.WHITE)))
                .isInstanceOf(ExperimentNotFoundException.class);

        assertThat(imageStore.listByExperiment(experimentId)).hasSize(1);
    }

    @Test
    void undecodableReference_isDiscardedAndExperimentStaysUsable() {
        ExperimentImageService service = uploadsWith(new ImageDecoder());

        assertThatThrownBy(() -> service.upload(experimentId, 0, "huge.png", pngHeaderOnly(30_000, 30_000)))
                .isInstanceOf(DecodeException.class);
        assertThat(imageStore.listByExperiment(experimentId)).isEmpty();
        assertThat(experimentStore.getResultSet(experimentId)).isEmpty();

        AnalysisResult reference = service.upload(experimentId, 0, "ref.png", solidPng(20, 20, Color.WHITE));
        assertThat(reference.passes()).isZero();
        assertThat(imageStore.listByExperiment(experimentId)).hasSize(1);
    }

    @Test
    void uncheckedAnalysisFailure_alsoDiscardsUpload() {
        ImageDecoder failing = new ImageDecoder() {
            @Override
            public PixelGrid decode(byte[] bytes) {
                throw new IllegalStateException("reader crashed");
            }
        };
        ExperimentImageService service = uploadsWith(failing);

        assertThatThrownBy(() -> service.upload(experimentId, 0, "ref.png", solidPng(20, 20, Color.WHITE)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("reader crashed");
        assertThat(imageStore.listByExperiment(experimentId)).isEmpty();
        assertThat(experimentStore.getResultSet(experimentId)).isEmpty();
    }
}
