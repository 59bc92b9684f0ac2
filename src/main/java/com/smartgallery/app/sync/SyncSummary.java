package com.smartgallery.app.sync;

/** Counters of one completed sync pass. */
public record SyncSummary(
        long processed,
        long failed,
        long withWorkflow,
        long workflowsExtracted,
        long workflowsNotExtracted,
        long metadataExtracted,
        long metadataFailed,
        long totalSamplers,
        long parseErrors,
        long withoutMetadata,
        long added,
        long updated,
        long deleted,
        long elapsedMillis
) {

    public boolean changedIndex() {
        return added + updated + deleted > 0;
    }
}
