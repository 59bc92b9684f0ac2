package com.smartgallery.app.sync;

/**
 * One progress event of a folder sync.
 *
 * @param status null while work is ongoing, otherwise {@code no_changes}, {@code reloading} or {@code error}
 */
public record SyncProgress(String message, int current, int total, String status, boolean error) {

    public static final String STATUS_NO_CHANGES = "no_changes";
    public static final String STATUS_RELOADING = "reloading";
    public static final String STATUS_ERROR = "error";

    static SyncProgress step(String message, int current, int total) {
        return new SyncProgress(message, current, total, null, false);
    }

    static SyncProgress done(String message, String status, int current, int total) {
        return new SyncProgress(message, current, total, status, false);
    }

    static SyncProgress failed(String message) {
        return new SyncProgress(message, 0, 0, STATUS_ERROR, true);
    }

    public boolean finished() {
        return status != null;
    }
}
