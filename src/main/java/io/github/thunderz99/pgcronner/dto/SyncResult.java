package io.github.thunderz99.pgcronner.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Job names per kind of change applied by a sync.
 */
public class SyncResult {

    /**
     * Names scheduled that were not scheduled before
     */
    public List<String> created = new ArrayList<>();

    /**
     * Names unscheduled and scheduled again with a new definition
     */
    public List<String> updated = new ArrayList<>();

    /**
     * Names unscheduled
     */
    public List<String> removed = new ArrayList<>();

    /**
     * Names left alone because both sides already match
     */
    public List<String> unchanged = new ArrayList<>();

    public int getCreatedCount() {
        return created.size();
    }

    public int getUpdatedCount() {
        return updated.size();
    }

    public int getRemovedCount() {
        return removed.size();
    }

    public int getUnchangedCount() {
        return unchanged.size();
    }

    /**
     * @return true if nothing was created, updated or removed
     */
    public boolean isNoop() {
        return created.isEmpty() && updated.isEmpty() && removed.isEmpty();
    }

    @Override
    public String toString() {
        return "{created:%d, updated:%d, removed:%d, unchanged:%d}".formatted(created.size(), updated.size(), removed.size(), unchanged.size());
    }
}
