package com.smartgallery.app.analyze;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import org.apache.commons.io.FilenameUtils;

/**
 * Extension lookup tables per media category. Entries are lower-case and dot-prefixed.
 * Image wins over animated for an extension present in both.
 */
public record MediaExtensions(Set<String> video, Set<String> image, Set<String> animated, Set<String> audio) {

    public MediaExtensions {
        video = Set.copyOf(video);
        image = Set.copyOf(image);
        animated = Set.copyOf(animated);
        audio = Set.copyOf(audio);
    }

    public static MediaExtensions defaults() {
        return new MediaExtensions(
                Set.of(".mp4", ".mkv", ".webm", ".mov", ".avi"),
                Set.of(".png", ".jpg", ".jpeg"),
                Set.of(".gif", ".webp"),
                Set.of(".mp3", ".wav", ".ogg", ".flac")
        );
    }

    public static String extensionOf(Path file) {
        String ext = FilenameUtils.getExtension(file.getFileName().toString());
        return ext.isEmpty() ? "" : "." + ext.toLowerCase(Locale.ROOT);
    }

    /** Category by extension alone; a {@code .webp} still needs {@link FileAnalyzer} to tell if it moves. */
    public MediaType classify(String ext) {
        if (image.contains(ext)) return MediaType.IMAGE;
        if (animated.contains(ext)) return MediaType.ANIMATED_IMAGE;
        if (video.contains(ext)) return MediaType.VIDEO;
        if (audio.contains(ext)) return MediaType.AUDIO;
        return MediaType.UNKNOWN;
    }

    public boolean isMedia(Path file) {
        return classify(extensionOf(file)) != MediaType.UNKNOWN;
    }

    public Set<String> all() {
        Set<String> all = new HashSet<>(video);
        all.addAll(image);
        all.addAll(animated);
        all.addAll(audio);
        return all;
    }
}
