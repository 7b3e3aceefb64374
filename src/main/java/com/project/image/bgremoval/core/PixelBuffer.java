package com.project.image.bgremoval.core;

import java.util.Arrays;

/**
 * Immutable RGBA raster, row-major with a top-left origin. Every channel is an unsigned byte.
 * Pipeline stages never modify a buffer; they produce a new one.
 */
public final class PixelBuffer {
    public static final int CHANNELS = 4;

    private final int width;
    private final int height;
    private final byte[] rgba;

    // Takes ownership of the array; only used by stages that just allocated it.
    PixelBuffer(int width, int height, byte[] rgba) {
        this.width = width;
        this.height = height;
        this.rgba = rgba;
    }

    /**
     * Copies {@code rgba} into a new buffer.
     *
     * @throws IllegalArgumentException if the dimensions are negative or the array length is not
     *                                  {@code width * height * 4}
     */
    public static PixelBuffer of(int width, int height, byte[] rgba) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative dimensions: " + width + "x" + height);
        }
        if (rgba == null || rgba.length != (long) width * height * CHANNELS) {
            throw new IllegalArgumentException("Expected " + ((long) width * height * CHANNELS)
                    + " RGBA bytes for " + width + "x" + height + " but got "
                    + (rgba == null ? "null" : rgba.length));
        }
        return new PixelBuffer(width, height, Arrays.copyOf(rgba, rgba.length));
    }

    /** Builds a buffer from packed {@code 0xAARRGGBB} ints, as returned by {@code BufferedImage.getRGB}. */
    public static PixelBuffer fromArgb(int width, int height, int[] argb) {
        if (width < 0 || height < 0 || argb.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " pixels but got " + argb.length);
        }
        byte[] data = new byte[argb.length * CHANNELS];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            data[CHANNELS * i]     = (byte) (p >> 16);
            data[CHANNELS * i + 1] = (byte) (p >> 8);
            data[CHANNELS * i + 2] = (byte) p;
            data[CHANNELS * i + 3] = (byte) (p >>> 24);
        }
        return new PixelBuffer(width, height, data);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int pixelCount() {
        return width * height;
    }

    public int red(int index) {
        return rgba[CHANNELS * index] & 0xFF;
    }

    public int green(int index) {
        return rgba[CHANNELS * index + 1] & 0xFF;
    }

    public int blue(int index) {
        return rgba[CHANNELS * index + 2] & 0xFF;
    }

    public int alpha(int index) {
        return rgba[CHANNELS * index + 3] & 0xFF;
    }

    public int argb(int index) {
        return (alpha(index) << 24) | (red(index) << 16) | (green(index) << 8) | blue(index);
    }

    public int argb(int x, int y) {
        return argb(y * width + x);
    }

    /** Packed {@code 0xAARRGGBB} pixels, row-major. */
    public int[] toArgb() {
        int[] out = new int[pixelCount()];
        for (int i = 0; i < out.length; i++) {
            out[i] = argb(i);
        }
        return out;
    }

    /** A copy of the raw RGBA bytes. */
    public byte[] toRgbaArray() {
        return Arrays.copyOf(rgba, rgba.length);
    }

    // Direct access for the stages in this package. Callers must not write to it.
    byte[] data() {
        return rgba;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelBuffer other)) return false;
        return width == other.width && height == other.height && Arrays.equals(rgba, other.rgba);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(rgba);
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width + "x" + height + "]";
    }
}
