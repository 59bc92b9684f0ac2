package com.smartgallery.app.database;

public record PathMtime(String path, double mtime) {}
