package com.smartgallery.app.analyze;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Optional;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Pixel dimensions read from an image header without decoding the raster. */
public record PixelSize(int width, int height) {

    private static final Logger logger = LoggerFactory.getLogger(PixelSize.class);

    public String format() {
        return width + "x" + height;
    }

    public static Optional<PixelSize> read(Path file) {
        try (ImageInputStream in = ImageIO.createImageInputStream(file.toFile())) {
            if (in == null) return Optional.empty();
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) return Optional.empty();
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                return Optional.of(new PixelSize(reader.getWidth(0), reader.getHeight(0)));
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            logger.debug("No pixel size for {}: {}", file, e.toString());
            return Optional.empty();
        }
    }
}
