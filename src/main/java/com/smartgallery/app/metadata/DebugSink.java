package com.smartgallery.app.metadata;

import java.nio.file.Path;

/**
 * Receives intermediate artifacts of one metadata extraction. Callers check {@link #enabled()}
 * before building anything expensive.
 */
public interface DebugSink {

    DebugSink NONE = new DebugSink() {
        @Override
        public boolean enabled() {
            return false;
        }

        @Override
        public void stage(Path sourceFile, String stage, Object data, String formatInfo) {
            // disabled
        }
    };

    boolean enabled();

    void stage(Path sourceFile, String stage, Object data, String formatInfo);

    static DebugSink forDirectory(Path dir) {
        return dir == null ? NONE : new DirectoryDebugSink(dir);
    }
}
