package com.project.image.bgremoval.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EdgeBlurrerTest {
    private final EdgeBlurrer blurrer = new EdgeBlurrer();

    @Test
    void radiusZero_returnsInputUnchanged() {
        PixelBuffer masked = TestImages.randomWithTransparentBorder(20, 20, 3, 1L);

        PixelBuffer out = blurrer.softenEdges(masked, 0);

        assertThat(out).isSameAs(masked);
        assertThat(blurrer.softenEdges(masked, -4)).isEqualTo(masked);
    }

    @Test
    void fullyOpaqueImage_isNotBlurred() {
        PixelBuffer opaque = TestImages.random(25, 15, 2L);

        assertThat(blurrer.softenEdges(opaque, 5)).isEqualTo(opaque);
    }

    @Test
    void pixelsFarFromBackground_areUntouched() {
        int size = 41, border = 3, radius = 2;
        int reach = (int) Math.ceil(3.0 * radius);
        PixelBuffer masked = TestImages.randomWithTransparentBorder(size, size, border, 3L);

        PixelBuffer out = blurrer.softenEdges(masked, radius);

        int from = border + reach, to = size - border - reach - 1;
        for (int y = from; y <= to; y++) {
            for (int x = from; x <= to; x++) {
                assertThat(out.argb(x, y)).as("pixel %d,%d", x, y).isEqualTo(masked.argb(x, y));
            }
        }
    }

    @Test
    void transparentPixelsNextToSubject_gainSoftAlpha() {
        int size = 30;
        int[] argb = new int[size * size];
        for (int y = 10; y < 20; y++) {
            for (int x = 10; x < 20; x++) {
                argb[y * size + x] = TestImages.opaque(200, 40, 40);
            }
        }
        PixelBuffer masked = PixelBuffer.fromArgb(size, size, argb);

        PixelBuffer out = blurrer.softenEdges(masked, 3);

        int halo = out.alpha(15 * size + 9);
        int farther = out.alpha(15 * size + 6);
        assertThat(halo).isGreaterThan(0).isLessThan(255);
        assertThat(farther).isLessThan(halo);
        assertThat(out.alpha(0)).isZero();
        // the subject itself stays opaque and keeps its color
        assertThat(out.argb(15 * size + 10)).isEqualTo(TestImages.opaque(200, 40, 40));
        assertThat(out.argb(15 * size + 15)).isEqualTo(TestImages.opaque(200, 40, 40));
    }

    @Test
    void radiusAboveRange_isClamped() {
        PixelBuffer masked = TestImages.randomWithTransparentBorder(30, 30, 4, 4L);

        assertThat(blurrer.softenEdges(masked, 25)).isEqualTo(blurrer.softenEdges(masked, 10));
    }

    @Test
    void dimensionsArePreserved() {
        PixelBuffer masked = TestImages.randomWithTransparentBorder(17, 9, 2, 5L);

        PixelBuffer out = blurrer.softenEdges(masked, 4);

        assertThat(out.width()).isEqualTo(17);
        assertThat(out.height()).isEqualTo(9);
    }

    @Test
    void gaussianKernel_isNormalisedAndSymmetric() {
        float[] kernel = EdgeBlurrer.gaussianKernel(2);

        assertThat(kernel).hasSize(13);
        float sum = 0;
        for (float k : kernel) sum += k;
        assertThat(sum).isCloseTo(1f, within(1e-5f));
        for (int i = 0; i < kernel.length / 2; i++) {
            assertThat(kernel[i]).isEqualTo(kernel[kernel.length - 1 - i]);
        }
        assertThat(kernel[6]).isGreaterThan(kernel[5]);
    }

    @Test
    void transitionBand_coversReachAroundTransparentPixels() {
        int w = 9, h = 9;
        int[] argb = TestImages.uniform(w, h, 1, 1, 1).toArgb();
        argb[4 * w + 4] = 0; // single transparent pixel in the middle
        byte[] rgba = PixelBuffer.fromArgb(w, h, argb).toRgbaArray();

        boolean[] band = EdgeBlurrer.transitionBand(rgba, w, h, 2);

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                boolean expected = Math.abs(x - 4) <= 2 && Math.abs(y - 4) <= 2;
                assertThat(band[y * w + x]).as("pixel %d,%d", x, y).isEqualTo(expected);
            }
        }
    }
}
