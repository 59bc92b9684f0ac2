package com.smartgallery.app.analyze;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Deterministic identifiers derived from a file's absolute path. */
public final class Hashes {

    private Hashes() {}

    /** Index id: MD5 hex of the absolute path. Changes whenever the path changes. */
    public static String fileId(String absolutePath) {
        return md5Hex(absolutePath);
    }

    /** Thumbnail correlation key: MD5 hex of path and mtime, so edits get a fresh thumbnail. */
    public static String thumbnailHash(String absolutePath, double mtime) {
        return md5Hex(absolutePath + mtime);
    }

    static String md5Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
