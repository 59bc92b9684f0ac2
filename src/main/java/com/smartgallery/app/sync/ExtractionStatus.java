package com.smartgallery.app.sync;

/** Outcome of the metadata step for one file. */
public enum ExtractionStatus {
    /** No embedded payload was found. */
    NO_WORKFLOW,
    /** A payload was found and yielded at least one sampler. */
    EXTRACTED,
    /** A payload was found but no sampler could be read from it. */
    NOT_EXTRACTED,
    /** Reading the payload failed. */
    FAILED
}
