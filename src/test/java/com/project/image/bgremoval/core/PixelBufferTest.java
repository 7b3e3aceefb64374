package com.project.image.bgremoval.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PixelBufferTest {

    @Test
    void fromArgb_splitsChannels() {
        PixelBuffer pixels = PixelBuffer.fromArgb(2, 1, new int[]{0x80112233, 0xFFAABBCC});

        assertThat(pixels.red(0)).isEqualTo(0x11);
        assertThat(pixels.green(0)).isEqualTo(0x22);
        assertThat(pixels.blue(0)).isEqualTo(0x33);
        assertThat(pixels.alpha(0)).isEqualTo(0x80);
        assertThat(pixels.argb(1, 0)).isEqualTo(0xFFAABBCC);
        assertThat(pixels.toArgb()).containsExactly(0x80112233, 0xFFAABBCC);
    }

    @Test
    void of_copiesInput() {
        byte[] rgba = {1, 2, 3, 4};
        PixelBuffer pixels = PixelBuffer.of(1, 1, rgba);
        rgba[0] = 99;

        assertThat(pixels.red(0)).isEqualTo(1);
        pixels.toRgbaArray()[1] = 99;
        assertThat(pixels.green(0)).isEqualTo(2);
    }

    @Test
    void of_rejectsWrongLength() {
        assertThatThrownBy(() -> PixelBuffer.of(2, 2, new byte[15]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PixelBuffer.of(-1, 2, new byte[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void masks_compareByContent() {
        boolean[] bits = {true, false, true, false};
        Mask mask = Mask.of(2, 2, bits);
        bits[1] = true;

        assertThat(mask).isEqualTo(Mask.of(2, 2, new boolean[]{true, false, true, false}));
        assertThat(mask.backgroundCount()).isEqualTo(2);
        assertThat(mask.isSubsetOf(Mask.of(2, 2, new boolean[]{true, true, true, false}))).isTrue();
        assertThat(mask.isSubsetOf(Mask.of(2, 2, new boolean[]{true, true, false, false}))).isFalse();
    }

    @Test
    void maskToArray_returnsDetachedCopy() {
        Mask mask = Mask.of(2, 2, new boolean[]{true, false, false, true});

        boolean[] copy = mask.toArray();
        copy[1] = true;

        assertThat(copy).containsExactly(true, true, false, true);
        assertThat(mask.toArray()).containsExactly(true, false, false, true);
        assertThat(mask.isBackground(1, 0)).isFalse();
    }
}
