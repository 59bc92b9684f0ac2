package com.smartgallery.app.cache;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Directory tree under the output root, keyed by a stable URL-safe folder key. Built lazily and
 * rebuilt on demand; cache folders are never listed.
 */
public final class FolderLayoutCache {

    private static final Logger logger = LoggerFactory.getLogger(FolderLayoutCache.class);

    public static final String ROOT_KEY = "_root_";

    public record FolderEntry(String key, Path path, String displayName, String parentKey, double mtime) {}

    private final Path root;
    private final Set<String> excludedNames;

    private Map<String, FolderEntry> folders;

    public FolderLayoutCache(Path root, Set<String> excludedNames) {
        this.root = root.toAbsolutePath().normalize();
        this.excludedNames = Set.copyOf(excludedNames);
    }

    public synchronized Map<String, FolderEntry> folders(boolean forceRefresh) {
        if (folders == null || forceRefresh) {
            folders = Collections.unmodifiableMap(scan());
        }
        return folders;
    }

    public Optional<FolderEntry> find(String key) {
        return Optional.ofNullable(folders(false).get(key));
    }

    public synchronized void invalidate() {
        folders = null;
    }

    public static String keyFor(Path root, Path folder) {
        Path rel = root.toAbsolutePath().normalize().relativize(folder.toAbsolutePath().normalize());
        String relNorm = rel.toString().replace('\\', '/');
        if (relNorm.isEmpty()) return ROOT_KEY;
        return Base64.getUrlEncoder().encodeToString(relNorm.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Folder for a client-supplied key. Only keys of folders found by the layout scan resolve; the
     * layout is rescanned once for a key it does not know yet.
     *
     * @throws UnknownFolderException for any other key
     */
    public Path resolve(String key) {
        if (key == null) throw new UnknownFolderException(null);
        FolderEntry entry = find(key).orElseGet(() -> folders(true).get(key));
        if (entry == null) throw new UnknownFolderException(key);
        return entry.path();
    }

    private Map<String, FolderEntry> scan() {
        Map<String, FolderEntry> out = new LinkedHashMap<>();
        if (!Files.isDirectory(root)) {
            logger.warn("Output folder does not exist: {}", root);
            return out;
        }
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && excludedNames.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    String key = keyFor(root, dir);
                    String parentKey = dir.equals(root) ? null : keyFor(root, dir.getParent());
                    String name = dir.equals(root) ? "Main" : dir.getFileName().toString();
                    out.put(key, new FolderEntry(key, dir, name, parentKey,
                            attrs.lastModifiedTime().toMillis() / 1000.0));
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    logger.warn("Skipping unreadable folder {}: {}", file, exc.toString());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            logger.warn("Folder layout scan of {} stopped early: {}", root, e.toString());
        }
        return out;
    }
}
