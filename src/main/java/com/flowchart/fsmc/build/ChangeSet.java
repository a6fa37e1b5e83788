package com.flowchart.fsmc.build;

import java.util.ArrayList;
import java.util.List;

/**
 * Source changes relative to the manifest.
 *
 * @param added    sources without a record
 * @param modified sources whose hash differs or that were touched after their record
 * @param deleted  tracked sources that are gone or no longer listed
 */
public record ChangeSet(List<String> added, List<String> modified, List<String> deleted) {

    public ChangeSet {
        added = List.copyOf(added);
        modified = List.copyOf(modified);
        deleted = List.copyOf(deleted);
    }

    public boolean hasChanges() {
        return !added.isEmpty() || !modified.isEmpty() || !deleted.isEmpty();
    }

    /** Added and modified sources, which need regeneration. */
    public List<String> changed() {
        List<String> out = new ArrayList<>(added);
        out.addAll(modified);
        return out;
    }
}
