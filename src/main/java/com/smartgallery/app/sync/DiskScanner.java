package com.smartgallery.app.sync;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartgallery.app.analyze.MediaExtensions;

/**
 * Lists files with their mtime in seconds. Unreadable entries are counted and skipped; a missing
 * folder is an empty listing.
 */
final class DiskScanner {

    private static final Logger logger = LoggerFactory.getLogger(DiskScanner.class);

    private final MediaExtensions extensions;
    private final Set<String> excludedDirNames;
    final LongAdder walkErrors = new LongAdder();
    final LongAdder dirsSkipped = new LongAdder();

    DiskScanner(MediaExtensions extensions, Set<String> excludedDirNames) {
        this.extensions = extensions;
        this.excludedDirNames = excludedDirNames;
    }

    /** Media files under {@code root}, recursively, minus excluded folders. */
    Map<String, Double> scanTree(Path root) throws IOException {
        Path rootAbs = root.toAbsolutePath().normalize();
        Map<String, Double> out = new HashMap<>();
        if (!Files.isDirectory(rootAbs)) {
            logger.warn("Output folder does not exist: {}", rootAbs);
            return out;
        }

        Files.walkFileTree(rootAbs, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE,
                new SimpleFileVisitor<>() {

                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                        if (dir.equals(rootAbs)) return FileVisitResult.CONTINUE;
                        if (excludedDirNames.contains(dir.getFileName().toString())) {
                            dirsSkipped.increment();
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (!attrs.isRegularFile() || !accepts(file)) return FileVisitResult.CONTINUE;
                        out.put(file.toString(), FileProcessor.mtimeSeconds(attrs));
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) {
                        walkErrors.increment();
                        logger.warn("Skipping unreadable entry {}: {}", file, exc.toString());
                        return FileVisitResult.CONTINUE;
                    }
                });
        return out;
    }

    /** Media files directly inside {@code folder}. */
    Map<String, Double> scanFolder(Path folder) {
        Path dir = folder.toAbsolutePath().normalize();
        Map<String, Double> out = new HashMap<>();
        if (!Files.isDirectory(dir)) return out;

        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path file : entries) {
                if (!accepts(file)) continue;
                try {
                    BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                    if (attrs.isRegularFile()) out.put(file.toString(), FileProcessor.mtimeSeconds(attrs));
                } catch (NoSuchFileException gone) {
                    logger.debug("File vanished during scan: {}", file);
                } catch (IOException e) {
                    walkErrors.increment();
                    logger.warn("Skipping unreadable file {}: {}", file, e.toString());
                }
            }
        } catch (IOException e) {
            walkErrors.increment();
            logger.warn("Could not list folder {}: {}", dir, e.toString());
        }
        return out;
    }

    // both scan modes must agree or a folder pass would delete what a full pass indexed
    private boolean accepts(Path file) {
        return extensions.isMedia(file);
    }
}
