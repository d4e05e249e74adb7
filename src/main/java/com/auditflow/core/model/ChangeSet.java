package com.auditflow.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Partition of the union of the current and previously indexed file sets.
 * The four lists are sorted and pairwise disjoint.
 */
public record ChangeSet(
    List<String> added,
    List<String> modified,
    List<String> removed,
    List<String> unchanged
) implements Serializable {

    public ChangeSet {
        added = List.copyOf(added);
        modified = List.copyOf(modified);
        removed = List.copyOf(removed);
        unchanged = List.copyOf(unchanged);
    }

    public static ChangeSet empty() {
        return new ChangeSet(List.of(), List.of(), List.of(), List.of());
    }

    /** Files that need re-analysis: added followed by modified. */
    public List<String> changedFiles() {
        var changed = new ArrayList<String>(added.size() + modified.size());
        changed.addAll(added);
        changed.addAll(modified);
        return changed;
    }

    public boolean hasChanges() {
        return !added.isEmpty() || !modified.isEmpty() || !removed.isEmpty();
    }

    public int totalChanged() {
        return added.size() + modified.size() + removed.size();
    }

    public String summary() {
        var parts = new ArrayList<String>();
        if (!added.isEmpty()) parts.add(added.size() + " new");
        if (!modified.isEmpty()) parts.add(modified.size() + " modified");
        if (!removed.isEmpty()) parts.add(removed.size() + " deleted");
        if (parts.isEmpty()) {
            return "No changes detected";
        }
        return String.join(", ", parts) + " (" + unchanged.size() + " unchanged)";
    }

    public ChangeSetSummary toSummary() {
        return new ChangeSetSummary(added.size(), modified.size(), removed.size(), unchanged.size(), summary());
    }
}
