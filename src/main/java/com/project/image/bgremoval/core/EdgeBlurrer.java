package com.project.image.bgremoval.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feathers the cut-out edge of an alpha-masked image.
 * <p>
 * The image is premultiplied by alpha and blurred with a separable Gaussian whose sigma equals the
 * radius. The blurred copy is then laid over the sharp image ("over" blending), but only in the band
 * of pixels lying within the kernel reach of a fully transparent pixel. Everything outside that band,
 * including the whole of a fully opaque image, is copied through untouched.
 */
public class EdgeBlurrer {
    private static final Logger log = LoggerFactory.getLogger(EdgeBlurrer.class);

    private static final int C = PixelBuffer.CHANNELS;

    public PixelBuffer softenEdges(PixelBuffer maskedPixels, int blurRadius) {
        return softenEdges(maskedPixels, blurRadius, CancellationToken.NONE);
    }

    public PixelBuffer softenEdges(PixelBuffer maskedPixels, int blurRadius, CancellationToken cancellation) {
        final int radius = RemovalSettings.clampBlurRadius(blurRadius);
        if (radius == 0 || maskedPixels.pixelCount() == 0) {
            return maskedPixels;
        }

        final int w = maskedPixels.width(), h = maskedPixels.height();
        final byte[] src = maskedPixels.data();
        final float[] kernel = gaussianKernel(radius);
        final int reach = kernel.length / 2;

        boolean[] band = transitionBand(src, w, h, reach);
        int bandSize = countTrue(band);
        if (bandSize == 0) {
            log.debug("No transparent pixels, skipping blur");
            return maskedPixels;
        }

        float[] premultiplied = premultiply(src, w * h);
        float[] horizontal = new float[premultiplied.length];
        float[] blurred = new float[premultiplied.length];
        convolveRows(premultiplied, horizontal, w, h, kernel, cancellation);
        convolveColumns(horizontal, blurred, w, h, kernel, cancellation);

        byte[] out = maskedPixels.toRgbaArray();
        for (int i = 0; i < band.length; i++) {
            if (band[i]) {
                compositeOver(blurred, src, out, i);
            }
        }

        log.debug("Softened {} edge pixels with radius {} (kernel reach {})", bandSize, radius, reach);
        return new PixelBuffer(w, h, out);
    }

    /** Normalised 1-D Gaussian with sigma = radius, truncated at three sigma. */
    static float[] gaussianKernel(int radius) {
        double sigma = radius;
        int reach = (int) Math.ceil(3 * sigma);
        float[] kernel = new float[2 * reach + 1];
        double sum = 0;
        for (int i = -reach; i <= reach; i++) {
            double v = Math.exp(-(i * i) / (2 * sigma * sigma));
            kernel[i + reach] = (float) v;
            sum += v;
        }
        for (int i = 0; i < kernel.length; i++) {
            kernel[i] /= (float) sum;
        }
        return kernel;
    }

    /**
     * Pixels within {@code reach} (Chebyshev distance) of a pixel whose alpha is zero. Computed as a
     * separable dilation: a horizontal pass followed by a vertical one.
     */
    static boolean[] transitionBand(byte[] rgba, int w, int h, int reach) {
        boolean[] rows = new boolean[w * h];
        for (int y = 0; y < h; y++) {
            int lastTransparent = Integer.MIN_VALUE / 2;
            int[] nextTransparent = new int[w];
            int next = Integer.MAX_VALUE / 2;
            for (int x = w - 1; x >= 0; x--) {
                if (rgba[(y * w + x) * C + 3] == 0) next = x;
                nextTransparent[x] = next;
            }
            for (int x = 0; x < w; x++) {
                if (rgba[(y * w + x) * C + 3] == 0) lastTransparent = x;
                rows[y * w + x] = x - lastTransparent <= reach || nextTransparent[x] - x <= reach;
            }
        }

        boolean[] band = new boolean[w * h];
        for (int x = 0; x < w; x++) {
            int last = Integer.MIN_VALUE / 2;
            int[] nextHit = new int[h];
            int next = Integer.MAX_VALUE / 2;
            for (int y = h - 1; y >= 0; y--) {
                if (rows[y * w + x]) next = y;
                nextHit[y] = next;
            }
            for (int y = 0; y < h; y++) {
                if (rows[y * w + x]) last = y;
                band[y * w + x] = y - last <= reach || nextHit[y] - y <= reach;
            }
        }
        return band;
    }

    private static float[] premultiply(byte[] rgba, int n) {
        float[] out = new float[n * C];
        for (int i = 0; i < n; i++) {
            int p = i * C;
            float a = (rgba[p + 3] & 0xFF) / 255f;
            out[p]     = (rgba[p] & 0xFF) * a;
            out[p + 1] = (rgba[p + 1] & 0xFF) * a;
            out[p + 2] = (rgba[p + 2] & 0xFF) * a;
            out[p + 3] = a;
        }
        return out;
    }

    // Samples outside the image are transparent black.
    private static void convolveRows(float[] src, float[] dst, int w, int h, float[] kernel, CancellationToken cancellation) {
        int reach = kernel.length / 2;
        for (int y = 0; y < h; y++) {
            cancellation.throwIfCancelled();
            int row = y * w;
            for (int x = 0; x < w; x++) {
                float r = 0, g = 0, b = 0, a = 0;
                int from = Math.max(0, x - reach), to = Math.min(w - 1, x + reach);
                for (int xx = from; xx <= to; xx++) {
                    float k = kernel[xx - x + reach];
                    int p = (row + xx) * C;
                    r += src[p] * k;
                    g += src[p + 1] * k;
                    b += src[p + 2] * k;
                    a += src[p + 3] * k;
                }
                int o = (row + x) * C;
                dst[o] = r; dst[o + 1] = g; dst[o + 2] = b; dst[o + 3] = a;
            }
        }
    }

    private static void convolveColumns(float[] src, float[] dst, int w, int h, float[] kernel, CancellationToken cancellation) {
        int reach = kernel.length / 2;
        for (int y = 0; y < h; y++) {
            cancellation.throwIfCancelled();
            int from = Math.max(0, y - reach), to = Math.min(h - 1, y + reach);
            for (int x = 0; x < w; x++) {
                float r = 0, g = 0, b = 0, a = 0;
                for (int yy = from; yy <= to; yy++) {
                    float k = kernel[yy - y + reach];
                    int p = (yy * w + x) * C;
                    r += src[p] * k;
                    g += src[p + 1] * k;
                    b += src[p + 2] * k;
                    a += src[p + 3] * k;
                }
                int o = (y * w + x) * C;
                dst[o] = r; dst[o + 1] = g; dst[o + 2] = b; dst[o + 3] = a;
            }
        }
    }

    /** Premultiplied "over": blurred on top of the sharp pixel, written back as straight RGBA. */
    private static void compositeOver(float[] blurred, byte[] sharp, byte[] out, int i) {
        int p = i * C;
        float topA = Math.min(1f, blurred[p + 3]);
        float bottomA = (sharp[p + 3] & 0xFF) / 255f;
        float keep = 1f - topA;

        float outA = topA + bottomA * keep;
        if (outA <= 0f) {
            out[p + 3] = 0;
            return;
        }
        float r = blurred[p]     + (sharp[p] & 0xFF) * bottomA * keep;
        float g = blurred[p + 1] + (sharp[p + 1] & 0xFF) * bottomA * keep;
        float b = blurred[p + 2] + (sharp[p + 2] & 0xFF) * bottomA * keep;

        out[p]     = (byte) toChannel(r / outA);
        out[p + 1] = (byte) toChannel(g / outA);
        out[p + 2] = (byte) toChannel(b / outA);
        out[p + 3] = (byte) toChannel(outA * 255f);
    }

    private static int toChannel(float v) {
        int c = Math.round(v);
        return (c < 0) ? 0 : Math.min(255, c);
    }

    private static int countTrue(boolean[] values) {
        int count = 0;
        for (boolean v : values) {
            if (v) count++;
        }
        return count;
    }
}
