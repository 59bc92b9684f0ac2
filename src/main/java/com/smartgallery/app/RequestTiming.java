package com.smartgallery.app;

import java.time.Instant;

/** Elapsed time of the last call of one named operation. */
public record RequestTiming(String operation, long elapsedMillis, Instant finishedAt) {}
