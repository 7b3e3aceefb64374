package com.project.image.bgremoval.core;

import java.util.Arrays;

/** Per-pixel background flags produced by {@link FloodFillMasker}. Read-only once built. */
public final class Mask {
    private final int width;
    private final int height;
    private final boolean[] background;

    Mask(int width, int height, boolean[] background) {
        this.width = width;
        this.height = height;
        this.background = background;
    }

    /** Copies {@code background} ({@code true} = background) into a new mask. */
    public static Mask of(int width, int height, boolean[] background) {
        if (width < 0 || height < 0 || background.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " mask entries for "
                    + width + "x" + height + " but got " + background.length);
        }
        return new Mask(width, height, Arrays.copyOf(background, background.length));
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int size() {
        return background.length;
    }

    public boolean isBackground(int index) {
        return background[index];
    }

    public boolean isBackground(int x, int y) {
        return background[y * width + x];
    }

    public int backgroundCount() {
        int count = 0;
        for (boolean b : background) {
            if (b) count++;
        }
        return count;
    }

    /** True if every background pixel of this mask is also background in {@code other}. */
    public boolean isSubsetOf(Mask other) {
        if (other.width != width || other.height != height) return false;
        for (int i = 0; i < background.length; i++) {
            if (background[i] && !other.background[i]) return false;
        }
        return true;
    }

    public boolean[] toArray() {
        return Arrays.copyOf(background, background.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Mask other)) return false;
        return width == other.width && height == other.height && Arrays.equals(background, other.background);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(background);
    }

    @Override
    public String toString() {
        return "Mask[" + width + "x" + height + ", background=" + backgroundCount() + "]";
    }
}
