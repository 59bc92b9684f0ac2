package com.smartgallery.app.sync;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Three-way comparison of paths on disk against paths in the index.
 * A path counts as updated when its whole-second mtime on disk is newer than the indexed one.
 */
public record SyncDiff(Set<String> toAdd, Set<String> toUpdate, Set<String> toDelete, int unchanged) {

    public SyncDiff {
        toAdd = Set.copyOf(toAdd);
        toUpdate = Set.copyOf(toUpdate);
        toDelete = Set.copyOf(toDelete);
    }

    public static SyncDiff compute(Map<String, Double> disk, Map<String, Double> indexed) {
        Set<String> add = new HashSet<>();
        Set<String> update = new HashSet<>();
        int unchanged = 0;
        for (Map.Entry<String, Double> e : disk.entrySet()) {
            Double known = indexed.get(e.getKey());
            if (known == null) {
                add.add(e.getKey());
            } else if ((long) e.getValue().doubleValue() > (long) known.doubleValue()) {
                update.add(e.getKey());
            } else {
                unchanged++;
            }
        }
        Set<String> delete = new HashSet<>(indexed.keySet());
        delete.removeAll(disk.keySet());
        return new SyncDiff(add, update, delete, unchanged);
    }

    public boolean isEmpty() {
        return toAdd.isEmpty() && toUpdate.isEmpty() && toDelete.isEmpty();
    }

    public List<String> filesToProcess() {
        List<String> out = new ArrayList<>(toAdd.size() + toUpdate.size());
        out.addAll(toAdd);
        out.addAll(toUpdate);
        return out;
    }
}
