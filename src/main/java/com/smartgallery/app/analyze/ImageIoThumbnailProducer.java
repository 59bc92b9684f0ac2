package com.smartgallery.app.analyze;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a width-bounded JPEG of the first frame of still and animated images that
 * {@link ImageIO} can decode. Other types get no thumbnail.
 */
public final class ImageIoThumbnailProducer implements ThumbnailProducer {

    private static final Logger logger = LoggerFactory.getLogger(ImageIoThumbnailProducer.class);

    private final Path cacheDir;
    private final int maxWidth;

    public ImageIoThumbnailProducer(Path cacheDir, int maxWidth) {
        this.cacheDir = cacheDir;
        this.maxWidth = maxWidth;
    }

    @Override
    public Path produce(Path file, String contentHash, MediaType type) throws IOException {
        if (!type.isImage()) return null;

        Path existing = findCached(contentHash);
        if (existing != null) return existing;

        BufferedImage src = ImageIO.read(file.toFile());
        if (src == null) {
            logger.debug("No ImageIO decoder for {}", file);
            return null;
        }

        BufferedImage thumb = scale(src, maxWidth, maxWidth * 2);
        Files.createDirectories(cacheDir);
        Path target = cacheDir.resolve(contentHash + ".jpeg");
        Path tmp = cacheDir.resolve(contentHash + ".jpeg.tmp");
        if (!ImageIO.write(thumb, "jpeg", tmp.toFile())) {
            Files.deleteIfExists(tmp);
            return null;
        }
        Files.move(tmp, target, java.nio.file.StandardCopyOption.REPLACE_EXISTING);
        return target;
    }

    private Path findCached(String contentHash) throws IOException {
        if (!Files.isDirectory(cacheDir)) return null;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(cacheDir, contentHash + ".*")) {
            for (Path p : ds) {
                if (!p.getFileName().toString().endsWith(".tmp")) return p;
            }
        }
        return null;
    }

    static BufferedImage scale(BufferedImage src, int maxW, int maxH) {
        double ratio = Math.min(1.0, Math.min((double) maxW / src.getWidth(), (double) maxH / src.getHeight()));
        int w = Math.max(1, (int) Math.round(src.getWidth() * ratio));
        int h = Math.max(1, (int) Math.round(src.getHeight() * ratio));
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(src, 0, 0, w, h, java.awt.Color.WHITE, null);
        } finally {
            g.dispose();
        }
        return out;
    }
}
