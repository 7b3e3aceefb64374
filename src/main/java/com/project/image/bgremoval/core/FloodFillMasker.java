package com.project.image.bgremoval.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Marks background pixels with a breadth-first flood fill seeded from every border pixel at once.
 * The fill grows over the 8-connected neighbourhood, stepping from a pixel to a neighbour only when
 * their RGB distance is strictly below {@code threshold * 2.55}. Alpha is ignored. Pixels never
 * reached stay foreground, so an enclosed subject survives even if its own colors are uniform.
 */
public class FloodFillMasker {
    private static final Logger log = LoggerFactory.getLogger(FloodFillMasker.class);

    /** Maps the 1..100 sensitivity onto the 0..255 per-channel range. */
    public static final double THRESHOLD_SCALE = 2.55;

    /** Share of the overall progress that masking accounts for. */
    static final double PROGRESS_SHARE = 50.0;

    private static final int[] DX = {1, -1, 0, 0, 1, 1, -1, -1};
    private static final int[] DY = {0, 0, 1, -1, 1, -1, 1, -1};

    public Mask buildMask(PixelBuffer pixels, int threshold) {
        return buildMask(pixels, threshold, ProgressSink.NONE, CancellationToken.NONE);
    }

    public Mask buildMask(PixelBuffer pixels, int threshold, ProgressSink progress, CancellationToken cancellation) {
        return buildMask(pixels, threshold, progress, cancellation, new WorkQueue(pixels.width() * pixels.height()));
    }

    /** Runs the fill on a caller-supplied queue, which must be empty and hold {@code width * height} indices. */
    Mask buildMask(PixelBuffer pixels, int threshold, ProgressSink progress, CancellationToken cancellation,
                   WorkQueue queue) {
        final int w = pixels.width(), h = pixels.height(), n = w * h;
        final int clamped = RemovalSettings.clampThreshold(threshold);
        final double limit = clamped * THRESHOLD_SCALE;
        final double limitSquared = limit * limit;

        log.debug("Building mask for {}x{} image, threshold={} (distance limit {})", w, h, clamped, limit);

        boolean[] background = new boolean[n];
        if (n == 0) {
            progress.report(PROGRESS_SHARE);
            return new Mask(w, h, background);
        }

        boolean[] visited = new boolean[n];
        seedBorder(queue, visited, w, h);
        log.debug("Seeded {} border pixels", queue.size());

        byte[] data = pixels.data();
        int processed = 0;
        int lastPercent = -1;

        while (!queue.isEmpty()) {
            cancellation.throwIfCancelled();

            int idx = queue.remove();
            if (background[idx]) continue;
            background[idx] = true;
            processed++;

            int percent = (int) (processed * PROGRESS_SHARE / n);
            if (percent != lastPercent) {
                lastPercent = percent;
                progress.report(percent);
            }

            int px = idx % w, py = idx / w;
            int p = idx * PixelBuffer.CHANNELS;
            int pr = data[p] & 0xFF, pg = data[p + 1] & 0xFF, pb = data[p + 2] & 0xFF;

            for (int d = 0; d < DX.length; d++) {
                int nx = px + DX[d];
                int ny = py + DY[d];
                if (nx < 0 || nx >= w || ny < 0 || ny >= h) continue;

                int nIdx = ny * w + nx;
                if (visited[nIdx]) continue;

                int q = nIdx * PixelBuffer.CHANNELS;
                int dr = pr - (data[q] & 0xFF);
                int dg = pg - (data[q + 1] & 0xFF);
                int db = pb - (data[q + 2] & 0xFF);

                if (dr * dr + dg * dg + db * db < limitSquared) {
                    visited[nIdx] = true;
                    queue.add(nIdx);
                }
            }
        }

        progress.report(PROGRESS_SHARE);
        log.debug("Flood fill finished: {} of {} pixels enqueued, {} marked as background",
                queue.enqueuedCount(), n, processed);
        return new Mask(w, h, background);
    }

    private static void seedBorder(WorkQueue queue, boolean[] visited, int w, int h) {
        for (int x = 0; x < w; x++) {
            enqueue(queue, visited, x);
            enqueue(queue, visited, (h - 1) * w + x);
        }
        for (int y = 1; y < h - 1; y++) {
            enqueue(queue, visited, y * w);
            enqueue(queue, visited, y * w + (w - 1));
        }
    }

    private static void enqueue(WorkQueue queue, boolean[] visited, int idx) {
        if (!visited[idx]) {
            visited[idx] = true;
            queue.add(idx);
        }
    }
}
