package com.smartgallery.app.analyze;

/** File category as stored in the {@code files.type} column. */
public enum MediaType {
    IMAGE("image"),
    ANIMATED_IMAGE("animated_image"),
    VIDEO("video"),
    AUDIO("audio"),
    UNKNOWN("unknown");

    private final String dbValue;

    MediaType(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public boolean isImage() {
        return this == IMAGE || this == ANIMATED_IMAGE;
    }
}
