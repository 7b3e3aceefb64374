package com.project.image.bgremoval;

import com.project.image.bgremoval.core.PixelBuffer;
import com.project.image.bgremoval.exceptions.BackgroundRemovalException;
import com.project.image.bgremoval.service.ImageCodec;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.io.InputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageCodecTest {
    private final ImageCodec codec = new ImageCodec();

    @Test
    void fromImage_opaqueRgbImage_hasFullAlpha() {
        BufferedImage img = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
        img.setRGB(2, 1, 0x123456);

        PixelBuffer pixels = codec.fromImage(img);

        assertThat(pixels.argb(2, 1)).isEqualTo(0xFF123456);
        assertThat(pixels.alpha(0)).isEqualTo(255);
    }

    @Test
    void encodedPng_keepsTransparency() {
        PixelBuffer pixels = PixelBuffer.fromArgb(2, 1, new int[]{0x00FF0000, 0xFF00FF00});

        byte[] png = codec.encodePng(pixels);

        assertThat(png).isNotEmpty();
        PixelBuffer decoded = codec.decode(png);
        assertThat(decoded.alpha(0)).isZero();
        assertThat(decoded.argb(1)).isEqualTo(0xFF00FF00);
    }

    @Test
    void decode_rejectsGarbage() {
        assertThatThrownBy(() -> codec.decode(new byte[]{(byte) 0x89, 'P', 'N', 'G'}))
                .isInstanceOf(BackgroundRemovalException.class);
    }

    @Test
    void decode_readsLosslessWebp() throws Exception {
        PixelBuffer pixels;
        try (InputStream in = getClass().getResourceAsStream("/images/uniform-8x8.webp")) {
            assertThat(in).isNotNull();
            pixels = codec.decode(in);
        }

        assertThat(pixels.width()).isEqualTo(8);
        assertThat(pixels.height()).isEqualTo(8);
        for (int i = 0; i < 64; i++) {
            assertThat(pixels.argb(i)).as("pixel %d", i).isEqualTo(0xFF28C828);
        }
    }
}
