package com.smartgallery.app.sync;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.LongAdder;

/** Live counters of a running pass, snapshotted into a {@link SyncSummary} at the end. */
final class SyncMetrics {

    static final int LOGGED_PARSE_ERRORS = 10;

    final LongAdder processed = new LongAdder();
    final LongAdder failed = new LongAdder();
    final LongAdder withWorkflow = new LongAdder();
    final LongAdder workflowsExtracted = new LongAdder();
    final LongAdder workflowsNotExtracted = new LongAdder();
    final LongAdder metadataExtracted = new LongAdder();
    final LongAdder metadataFailed = new LongAdder();
    final LongAdder totalSamplers = new LongAdder();
    final LongAdder parseErrors = new LongAdder();
    final LongAdder withoutMetadata = new LongAdder();
    final LongAdder added = new LongAdder();
    final LongAdder updated = new LongAdder();
    final LongAdder deleted = new LongAdder();

    final Instant start = Instant.now();

    void record(ProcessedFile result) {
        processed.increment();
        if (result.file().hasWorkflow()) withWorkflow.increment();
        switch (result.status()) {
            case EXTRACTED -> {
                workflowsExtracted.increment();
                metadataExtracted.increment();
                totalSamplers.add(result.samplers().size());
            }
            case NOT_EXTRACTED -> {
                workflowsNotExtracted.increment();
                withoutMetadata.increment();
            }
            case FAILED -> {
                metadataFailed.increment();
                withoutMetadata.increment();
            }
            case NO_WORKFLOW -> withoutMetadata.increment();
        }
    }

    /** @return true while the error should still be logged individually */
    boolean parseError() {
        parseErrors.increment();
        return parseErrors.sum() <= LOGGED_PARSE_ERRORS;
    }

    SyncSummary snapshot() {
        return new SyncSummary(
                processed.sum(), failed.sum(), withWorkflow.sum(),
                workflowsExtracted.sum(), workflowsNotExtracted.sum(),
                metadataExtracted.sum(), metadataFailed.sum(), totalSamplers.sum(),
                parseErrors.sum(), withoutMetadata.sum(),
                added.sum(), updated.sum(), deleted.sum(),
                Duration.between(start, Instant.now()).toMillis());
    }
}
