package com.project.image.bgremoval.service;

import com.project.image.bgremoval.DTOs.RemovalResult;
import com.project.image.bgremoval.core.AlphaCompositor;
import com.project.image.bgremoval.core.CancellationToken;
import com.project.image.bgremoval.core.EdgeBlurrer;
import com.project.image.bgremoval.core.FloodFillMasker;
import com.project.image.bgremoval.core.Mask;
import com.project.image.bgremoval.core.PixelBuffer;
import com.project.image.bgremoval.core.ProgressSink;
import com.project.image.bgremoval.core.RemovalSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;

/**
 * Runs the removal pipeline: border flood fill mask, alpha clearing, then optional edge softening.
 * Each stage finishes before the next one starts.
 */
@Service
public class BackgroundRemovalService {
    private static final Logger log = LoggerFactory.getLogger(BackgroundRemovalService.class);

    private final ImageCodec imageCodec;
    private final FloodFillMasker masker = new FloodFillMasker();
    private final AlphaCompositor compositor = new AlphaCompositor();
    private final EdgeBlurrer blurrer = new EdgeBlurrer();

    public BackgroundRemovalService(ImageCodec imageCodec) {
        this.imageCodec = imageCodec;
    }

    public RemovalResult removeBackground(BufferedImage input, int threshold, int blurRadius) {
        return removeBackground(imageCodec.fromImage(input), threshold, blurRadius);
    }

    /** Removes the background and encodes the result as PNG. Out-of-range settings are clamped. */
    public RemovalResult removeBackground(PixelBuffer pixels, int threshold, int blurRadius) {
        RemovalSettings settings = new RemovalSettings(threshold, blurRadius);
        if (settings.threshold() != threshold || settings.blurRadius() != blurRadius) {
            log.warn("Clamped settings threshold={}, blurRadius={} to {}", threshold, blurRadius, settings);
        }

        log.info("Starting background removal for image {}x{}, threshold={}, blurRadius={}",
                pixels.width(), pixels.height(), settings.threshold(), settings.blurRadius());

        Mask mask = masker.buildMask(pixels, settings.threshold(),
                new LoggingProgressSink("Masking"), CancellationToken.NONE);

        PixelBuffer result = finish(pixels, mask, settings, new LoggingProgressSink("Compositing"), CancellationToken.NONE);

        int n = pixels.pixelCount();
        int backgroundPixels = mask.backgroundCount();
        double backgroundPercent = n == 0 ? 0.0 : 100.0 * backgroundPixels / n;

        log.info("Background removal completed: {} of {} pixels removed ({}%)",
                backgroundPixels, n, String.format("%.2f", backgroundPercent));

        return new RemovalResult(
                pixels.width(), pixels.height(),
                settings.threshold(), settings.blurRadius(),
                imageCodec.encodePng(result),
                backgroundPixels, backgroundPercent
        );
    }

    /**
     * Runs the whole pipeline on an already decoded buffer.
     *
     * @throws com.project.image.bgremoval.exceptions.RemovalCancelledException if {@code cancellation}
     *         is cancelled while a stage is running
     */
    public PixelBuffer removeBackground(PixelBuffer pixels, RemovalSettings settings,
                                        ProgressSink progress, CancellationToken cancellation) {
        Mask mask = masker.buildMask(pixels, settings.threshold(), progress, cancellation);
        return finish(pixels, mask, settings, progress, cancellation);
    }

    private PixelBuffer finish(PixelBuffer pixels, Mask mask, RemovalSettings settings,
                               ProgressSink progress, CancellationToken cancellation) {
        PixelBuffer masked = compositor.applyMask(pixels, mask, progress, cancellation);
        if (settings.blurRadius() == 0) {
            return masked;
        }
        log.debug("Softening edges with radius {}", settings.blurRadius());
        return blurrer.softenEdges(masked, settings.blurRadius(), cancellation);
    }
}
