package com.project.scratch.analysis.service;

import com.project.scratch.analysis.DTOs.LuminanceGrid;
import com.project.scratch.analysis.DTOs.PixelGrid;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GrayscaleConverterTest {
    private final GrayscaleConverter converter = new GrayscaleConverter();

    @Test
    void toGrayscale_knownValues() {
        assertThat(GrayscaleConverter.toGrayscale(0, 0, 0)).isEqualTo(0);
        assertThat(GrayscaleConverter.toGrayscale(255, 255, 255)).isEqualTo(255);
        assertThat(GrayscaleConverter.toGrayscale(128, 128, 128)).isEqualTo(128);
        assertThat(GrayscaleConverter.toGrayscale(0, 255, 0)).isEqualTo(150);   // 150.45
        assertThat(GrayscaleConverter.toGrayscale(0, 0, 255)).isEqualTo(28);    // 28.05
        assertThat(GrayscaleConverter.toGrayscale(10, 20, 30)).isEqualTo(18);   // 18.1
        assertThat(GrayscaleConverter.toGrayscale(40, 80, 120)).isEqualTo(72);  // 72.4
    }

    @Test
    void toGrayscale_matchesFormulaAndStaysInRange() {
        for (int r = 0; r <= 255; r += 5) {
            for (int g = 0; g <= 255; g += 5) {
                for (int b = 0; b <= 255; b += 5) {
                    int y = GrayscaleConverter.toGrayscale(r, g, b);
                    long expected = Math.max(0, Math.min(255, Math.round(0.3 * r + 0.59 * g + 0.11 * b)));
                    assertThat(y).isEqualTo((int) expected).isBetween(0, 255);
                    assertThat(GrayscaleConverter.toGrayscale(r, g, b)).isEqualTo(y);
                }
            }
        }
    }

    @Test
    void toGrayscale_packedMatchesChannels() {
        int packed = PixelGrid.pack(40, 80, 120);
        assertThat(GrayscaleConverter.toGrayscale(packed)).isEqualTo(GrayscaleConverter.toGrayscale(40, 80, 120));
    }

    @Test
    void convert_appliesPerPixel() {
        int[] rgb = {
                PixelGrid.pack(0, 0, 0), PixelGrid.pack(255, 255, 255),
                PixelGrid.pack(0, 255, 0), PixelGrid.pack(10, 20, 30)
        };
        LuminanceGrid gray = converter.convert(new PixelGrid(2, 2, rgb));

        assertThat(gray.width()).isEqualTo(2);
        assertThat(gray.height()).isEqualTo(2);
        assertThat(gray.value(0, 0)).isEqualTo(0);
        assertThat(gray.value(1, 0)).isEqualTo(255);
        assertThat(gray.value(0, 1)).isEqualTo(150);
        assertThat(gray.value(1, 1)).isEqualTo(18);
    }
}
