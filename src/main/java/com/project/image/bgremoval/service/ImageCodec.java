package com.project.image.bgremoval.service;

import com.project.image.bgremoval.core.PixelBuffer;
import com.project.image.bgremoval.exceptions.BackgroundRemovalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import javax.imageio.ImageIO;

/**
 * Converts between encoded images / {@link BufferedImage} and {@link PixelBuffer}. This is the only
 * place where ImageIO is touched; the core works on decoded RGBA only.
 */
@Component
public class ImageCodec {
    private static final Logger log = LoggerFactory.getLogger(ImageCodec.class);

    public ImageCodec() {
        // Picks up reader plugins (WebP) that are not on the boot class path, e.g. inside the Spring Boot jar
        ImageIO.scanForPlugins();
        log.debug("Readable image types: {}", String.join(", ", ImageIO.getReaderMIMETypes()));
    }

    public PixelBuffer decode(byte[] encoded) {
        return decode(new ByteArrayInputStream(encoded));
    }

    public PixelBuffer decode(InputStream in) {
        BufferedImage image;
        try {
            image = ImageIO.read(in);
        } catch (IOException e) {
            throw new BackgroundRemovalException("Failed to read image", e);
        }
        if (image == null) {
            throw new BackgroundRemovalException("The file is not a valid image or is corrupted.");
        }
        log.debug("Decoded image {}x{} (type {})", image.getWidth(), image.getHeight(), image.getType());
        return fromImage(image);
    }

    public PixelBuffer fromImage(BufferedImage image) {
        int w = image.getWidth(), h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        return PixelBuffer.fromArgb(w, h, argb);
    }

    public BufferedImage toImage(PixelBuffer pixels) {
        int w = pixels.width(), h = pixels.height();
        BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(0, 0, w, h, pixels.toArgb(), 0, w);
        return image;
    }

    public byte[] encodePng(PixelBuffer pixels) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(toImage(pixels), "png", baos);
            return baos.toByteArray();
        } catch (Exception e) {
            throw new BackgroundRemovalException("Failed to encode image", e);
        }
    }
}
