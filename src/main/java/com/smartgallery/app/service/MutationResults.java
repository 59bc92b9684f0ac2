package com.smartgallery.app.service;

import java.util.List;
import java.util.Map;

/** Outcomes of the mutation calls. */
public final class MutationResults {

    private MutationResults() {}

    public record Renamed(String oldId, String newId, String newName, String newPath) {}

    /**
     * @param newIds   old id to new id for every moved file
     * @param renamed  files that got a {@code name(n).ext} name because the target existed
     * @param failed   human-readable names of files that were not moved
     */
    public record Moved(Map<String, String> newIds, int renamed, List<String> failed) {

        public Moved {
            newIds = Map.copyOf(newIds);
            failed = List.copyOf(failed);
        }

        public int moved() {
            return newIds.size();
        }

        public boolean partial() {
            return !failed.isEmpty();
        }
    }

    public record Deleted(int deleted, List<String> failed) {

        public Deleted {
            failed = List.copyOf(failed);
        }

        public boolean partial() {
            return !failed.isEmpty();
        }
    }
}
