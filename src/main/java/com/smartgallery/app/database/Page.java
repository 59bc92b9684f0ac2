package com.smartgallery.app.database;

import java.util.List;

public record Page<T>(List<T> items, long total, int limit, int offset) {

    public boolean hasMore() {
        return offset + items.size() < total;
    }
}
