package com.project.image.bgremoval.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Makes background pixels fully transparent. Color channels and foreground pixels are copied as-is. */
public class AlphaCompositor {
    private static final Logger log = LoggerFactory.getLogger(AlphaCompositor.class);

    public PixelBuffer applyMask(PixelBuffer pixels, Mask mask) {
        return applyMask(pixels, mask, ProgressSink.NONE, CancellationToken.NONE);
    }

    public PixelBuffer applyMask(PixelBuffer pixels, Mask mask, ProgressSink progress, CancellationToken cancellation) {
        final int w = pixels.width(), h = pixels.height();
        if (mask.width() != w || mask.height() != h) {
            throw new IllegalArgumentException("Mask " + mask.width() + "x" + mask.height()
                    + " does not match image " + w + "x" + h);
        }

        byte[] out = pixels.toRgbaArray();
        int cleared = 0;

        for (int y = 0; y < h; y++) {
            cancellation.throwIfCancelled();
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                if (mask.isBackground(idx)) {
                    out[idx * PixelBuffer.CHANNELS + 3] = 0;
                    cleared++;
                }
            }
            progress.report(FloodFillMasker.PROGRESS_SHARE + (y + 1) * (100.0 - FloodFillMasker.PROGRESS_SHARE) / h);
        }
        if (h == 0) {
            progress.report(100.0);
        }

        log.debug("Cleared alpha of {} of {} pixels", cleared, w * h);
        return new PixelBuffer(w, h, out);
    }
}
