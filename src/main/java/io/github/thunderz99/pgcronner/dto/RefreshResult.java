package io.github.thunderz99.pgcronner.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * The result of a refresh: names now in the registry, and the remote rows that could not be taken over.
 */
public class RefreshResult {

    /**
     * A remote row skipped by refresh
     */
    public static class Skipped {

        public long jobId;

        public String name;

        public String reason;

        public Skipped(long jobId, String name, String reason) {
            this.jobId = jobId;
            this.name = name;
            this.reason = reason;
        }

        @Override
        public String toString() {
            return "%s(jobId=%d): %s".formatted(name, jobId, reason);
        }
    }

    /**
     * Names loaded into the registry, in remote order
     */
    public List<String> loaded = new ArrayList<>();

    /**
     * Malformed or duplicated remote rows
     */
    public List<Skipped> skipped = new ArrayList<>();

    @Override
    public String toString() {
        return "{loaded:%d, skipped:%d}".formatted(loaded.size(), skipped.size());
    }
}
