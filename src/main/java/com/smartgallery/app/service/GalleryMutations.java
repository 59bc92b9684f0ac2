package com.smartgallery.app.service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartgallery.app.analyze.Hashes;
import com.smartgallery.app.database.FileRecord;
import com.smartgallery.app.database.IndexStore;
import com.smartgallery.app.service.MutationException.Reason;
import com.smartgallery.app.service.MutationResults.Deleted;
import com.smartgallery.app.service.MutationResults.Moved;
import com.smartgallery.app.service.MutationResults.Renamed;

/**
 * Favorite, rename, move and delete. The file system is always changed first and the index only
 * after that succeeded; a row's id is rewritten together with its path.
 */
public final class GalleryMutations {

    private static final Logger logger = LoggerFactory.getLogger(GalleryMutations.class);

    static final int MAX_NAME_LENGTH = 250;
    private static final Pattern INVALID_NAME_CHARS = Pattern.compile("[\\\\/:\"*?<>|]");

    private final IndexStore store;
    private final Path thumbnailDir;
    private final Runnable onChange;

    /** @param onChange run after every mutation that touched the index */
    public GalleryMutations(IndexStore store, Path thumbnailDir, Runnable onChange) {
        this.store = Objects.requireNonNull(store, "store");
        this.thumbnailDir = thumbnailDir;
        this.onChange = Objects.requireNonNull(onChange, "onChange");
    }

    public int markFavorite(Collection<String> ids, boolean favorite) {
        int n = store.setFavorite(ids, favorite);
        if (n > 0) changed();
        return n;
    }

    /** @return the new favorite state */
    public boolean toggleFavorite(String id) {
        if (!store.toggleFavorite(id)) {
            throw new MutationException(Reason.NOT_FOUND, "File not found in the index: " + id);
        }
        changed();
        return store.findFile(id).map(FileRecord::isFavorite).orElse(false);
    }

    /**
     * Renames a file inside its folder. Without an extension in {@code newName} the old one is kept.
     */
    public Renamed renamePath(String id, String newName) {
        String name = validateName(newName);
        FileRecord file = store.findFile(id)
                .orElseThrow(() -> new MutationException(Reason.NOT_FOUND, "File not found in the index: " + id));

        String finalName = FilenameUtils.getExtension(name).isEmpty()
                ? name + extensionWithDot(file.name())
                : name;
        if (finalName.equals(file.name())) {
            throw new MutationException(Reason.SAME_NAME, "The new name is the same as the old one.");
        }

        Path oldPath = Path.of(file.path());
        Path newPath = oldPath.resolveSibling(finalName);
        if (Files.exists(newPath)) {
            throw new MutationException(Reason.CONFLICT,
                    "A file named \"" + finalName + "\" already exists in this folder.");
        }

        try {
            Files.move(oldPath, newPath);
        } catch (IOException e) {
            logger.error("Rename of {} to {} failed", oldPath, finalName, e);
            throw new MutationException(Reason.IO_FAILURE, "Could not rename " + file.name(), e);
        }

        String newId = Hashes.fileId(newPath.toString());
        if (!store.updateLocation(id, newId, newPath.toString(), finalName)) {
            logger.warn("Renamed {} on disk but its index row was gone; the next sync will add it", oldPath);
        }
        changed();
        logger.info("Renamed {} to {}", oldPath, newPath);
        return new Renamed(id, newId, finalName, newPath.toString());
    }

    /**
     * Moves files into {@code destination}, choosing {@code name(n).ext} when a name is taken.
     * Rows whose file is already gone from disk are removed from the index.
     */
    public Moved movePath(Collection<String> ids, Path destination) {
        Path dest = destination.toAbsolutePath().normalize();
        if (!Files.isDirectory(dest)) {
            throw new MutationException(Reason.NOT_FOUND, "Destination folder does not exist: " + dest);
        }

        Map<String, String> newIds = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();
        int renamed = 0;
        boolean touched = false;

        for (String id : ids) {
            Optional<FileRecord> found = store.findFile(id);
            if (found.isEmpty()) {
                failed.add("ID " + id + " not found in index");
                continue;
            }
            FileRecord file = found.get();
            Path source = Path.of(file.path());
            if (!Files.exists(source)) {
                failed.add(file.name() + " (not found on disk)");
                store.deleteById(id);
                touched = true;
                continue;
            }

            Path target = uniqueTarget(dest, file.name());
            try {
                Files.move(source, target);
            } catch (IOException e) {
                logger.error("Failed to move {} to {}", source, dest, e);
                failed.add(file.name());
                continue;
            }

            String newName = target.getFileName().toString();
            if (!newName.equals(file.name())) renamed++;
            String newId = Hashes.fileId(target.toString());
            touched = true;
            if (!store.updateLocation(id, newId, target.toString(), newName)) {
                logger.warn("Moved {} on disk but its index row was gone; the next sync will add it", source);
                continue;
            }
            newIds.put(id, newId);
        }

        if (touched) changed();
        logger.info("Moved {} file(s) to {}, {} renamed, {} failed", newIds.size(), dest, renamed, failed.size());
        return new Moved(newIds, renamed, failed);
    }

    /** Deletes files and their thumbnails from disk, then their rows. A file already gone still loses its row. */
    public Deleted deletePath(Collection<String> ids) {
        List<String> removed = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (FileRecord file : store.findFiles(ids)) {
            Path path = Path.of(file.path());
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                logger.error("Could not delete {} from disk", path, e);
                failed.add(file.name());
                continue;
            }
            removeThumbnails(Hashes.thumbnailHash(file.path(), file.mtime()));
            removed.add(file.path());
        }

        int deleted = removed.isEmpty() ? 0 : store.deleteByPath(removed);
        if (deleted > 0) changed();
        return new Deleted(deleted, failed);
    }

    static String validateName(String newName) {
        String name = newName == null ? "" : newName.trim();
        if (name.isEmpty() || name.length() > MAX_NAME_LENGTH) {
            throw new MutationException(Reason.INVALID_NAME, "The provided filename is invalid or too long.");
        }
        if (INVALID_NAME_CHARS.matcher(name).find() || name.contains("..")) {
            throw new MutationException(Reason.INVALID_NAME, "Filename contains invalid characters.");
        }
        return name;
    }

    static Path uniqueTarget(Path folder, String fileName) {
        Path candidate = folder.resolve(fileName);
        String base = FilenameUtils.getBaseName(fileName);
        String ext = extensionWithDot(fileName);
        for (int n = 1; Files.exists(candidate); n++) {
            candidate = folder.resolve(base + "(" + n + ")" + ext);
        }
        return candidate;
    }

    private static String extensionWithDot(String fileName) {
        String ext = FilenameUtils.getExtension(fileName);
        return ext.isEmpty() ? "" : "." + ext;
    }

    private void removeThumbnails(String hash) {
        if (thumbnailDir == null || !Files.isDirectory(thumbnailDir)) return;
        try (DirectoryStream<Path> thumbs = Files.newDirectoryStream(thumbnailDir, hash + ".*")) {
            for (Path t : thumbs) {
                Files.deleteIfExists(t);
                logger.debug("Removed orphaned thumbnail {}", t.getFileName());
            }
        } catch (IOException e) {
            logger.warn("Could not remove thumbnail {}: {}", hash, e.toString());
        }
    }

    private void changed() {
        store.invalidateCaches();
        onChange.run();
    }
}
