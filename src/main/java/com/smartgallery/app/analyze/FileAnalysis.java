package com.smartgallery.app.analyze;

/** Cheap, decode-free facts about one media file. Empty strings when unknown. */
public record FileAnalysis(MediaType type, String duration, String dimensions) {}
