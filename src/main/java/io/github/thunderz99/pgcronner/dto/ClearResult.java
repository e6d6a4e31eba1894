package io.github.thunderz99.pgcronner.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * The result of a clear.
 */
public class ClearResult {

    /**
     * Names unscheduled from pg_cron
     */
    public List<String> unscheduled = new ArrayList<>();

    /**
     * Names dropped from the registry
     */
    public List<String> dropped = new ArrayList<>();

    @Override
    public String toString() {
        return "{unscheduled:%d, dropped:%d}".formatted(unscheduled.size(), dropped.size());
    }
}
