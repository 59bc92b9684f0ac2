package com.smartgallery.app.database;

/** Page ordering. Only indexed columns are sortable. */
public record SortOrder(Key key, boolean ascending) {

    public enum Key {
        NAME("f.name"),
        MTIME("f.mtime");

        private final String column;

        Key(String column) {
            this.column = column;
        }

        String column() {
            return column;
        }
    }

    public static final SortOrder NEWEST_FIRST = new SortOrder(Key.MTIME, false);

    public static SortOrder of(String key, String direction) {
        Key k = "name".equalsIgnoreCase(key) ? Key.NAME : Key.MTIME;
        boolean asc = "asc".equalsIgnoreCase(direction);
        return new SortOrder(k, asc);
    }

    String sql() {
        return key.column() + (ascending ? " ASC" : " DESC");
    }
}
