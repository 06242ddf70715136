package com.project.scratch.analysis.service;

import com.project.scratch.analysis.DTOs.PixelGrid;
import com.project.scratch.analysis.exceptions.DecodeException;
import org.junit.jupiter.api.Test;

import java.awt.Color;

import static com.project.scratch.analysis.TestImages.corrupt;
import static com.project.scratch.analysis.TestImages.pngHeaderOnly;
import static com.project.scratch.analysis.TestImages.solidPng;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageDecoderTest {
    private final ImageDecoder decoder = new ImageDecoder();

    @Test
    void decodesPngIntoRgbGrid() {
        PixelGrid grid = decoder.decode(solidPng(30, 20, new Color(10, 20, 30)));

        assertThat(grid.width()).isEqualTo(30);
        assertThat(grid.height()).isEqualTo(20);
        assertThat(grid.rgb(29, 19)).isEqualTo(PixelGrid.pack(10, 20, 30));
    }

    @Test
    void emptyOrUnreadableBytes_areDecodeErrors() {
        assertThatThrownBy(() -> decoder.decode(new byte[0])).isInstanceOf(DecodeException.class);
        assertThatThrownBy(() -> decoder.decode(null)).isInstanceOf(DecodeException.class);
        assertThatThrownBy(() -> decoder.decode(corrupt())).isInstanceOf(DecodeException.class);
        assertThatThrownBy(() -> decoder.decode("not an image".getBytes())).isInstanceOf(DecodeException.class);
    }

    @Test
    void oversizedHeader_isRejectedBeforePixelsAreAllocated() {
        assertThatThrownBy(() -> decoder.decode(pngHeaderOnly(30_000, 30_000)))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("too large")
                .hasMessageContaining("30000x30000");
    }

    @Test
    void sizeLimitIsConfigurable() {
        ImageDecoder small = new ImageDecoder(25);

        assertThat(small.decode(solidPng(25, 25, Color.WHITE)).width()).isEqualTo(25);
        assertThatThrownBy(() -> small.decode(solidPng(26, 10, Color.WHITE)))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("too large");
        assertThatThrownBy(() -> new ImageDecoder(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void uncheckedReaderFailures_becomeDecodeErrors() {
        // the header passes the size check, the reader then fails while laying out the raster
        ImageDecoder permissive = new ImageDecoder(100_000);

        assertThatThrownBy(() -> permissive.decode(pngHeaderOnly(30_000, 30_000)))
                .isInstanceOf(DecodeException.class)
                .hasCauseInstanceOf(RuntimeException.class);
    }
}
