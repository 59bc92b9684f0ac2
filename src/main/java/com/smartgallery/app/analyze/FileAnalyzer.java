package com.smartgallery.app.analyze;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies a file and reads its dimensions and duration from headers. Failures leave the
 * affected field empty; analysis itself never fails.
 */
public final class FileAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(FileAnalyzer.class);

    private final MediaExtensions extensions;

    public FileAnalyzer(MediaExtensions extensions) {
        this.extensions = extensions;
    }

    public MediaExtensions extensions() {
        return extensions;
    }

    public FileAnalysis analyze(Path file) {
        String ext = MediaExtensions.extensionOf(file);
        MediaType type = extensions.classify(ext);
        String dimensions = "";
        double durationSeconds = 0;

        try {
            if (".webp".equals(ext) && (type == MediaType.ANIMATED_IMAGE || type == MediaType.IMAGE)) {
                Optional<MediaProbe.WebpInfo> info = MediaProbe.webp(file);
                boolean animated = info.map(MediaProbe.WebpInfo::animated).orElse(false);
                type = animated ? MediaType.ANIMATED_IMAGE : MediaType.IMAGE;
                if (info.isPresent() && info.get().size() != null) {
                    dimensions = info.get().size().format();
                }
                if (animated) {
                    durationSeconds = info.get().durationMillis() / 1000.0;
                }
            } else if (type.isImage()) {
                dimensions = PixelSize.read(file).map(PixelSize::format).orElse("");
                if (type == MediaType.ANIMATED_IMAGE && ".gif".equals(ext)) {
                    durationSeconds = MediaProbe.gifDurationMillis(file) / 1000.0;
                }
            } else if (type == MediaType.VIDEO) {
                Optional<MediaProbe.VideoInfo> info = MediaProbe.isoMedia(file);
                if (info.isPresent()) {
                    durationSeconds = info.get().durationSeconds();
                    if (info.get().size() != null) dimensions = info.get().size().format();
                }
            }
        } catch (IOException | RuntimeException e) {
            logger.debug("Header probe failed for {}: {}", file, e.toString());
        }

        return new FileAnalysis(type, formatDuration(durationSeconds), dimensions);
    }

    /** {@code mm:ss}, or {@code h:mm:ss} from one hour up; empty for non-positive input. */
    public static String formatDuration(double seconds) {
        if (!(seconds > 0)) return "";
        long total = (long) seconds;
        long h = total / 3600;
        long m = (total % 3600) / 60;
        long s = total % 60;
        return h > 0 ? String.format("%d:%02d:%02d", h, m, s) : String.format("%02d:%02d", m, s);
    }
}
