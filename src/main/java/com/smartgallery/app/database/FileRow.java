package com.smartgallery.app.database;

/** A page row: the file plus how many samplers it carries. */
public record FileRow(FileRecord file, int samplerCount) {}
