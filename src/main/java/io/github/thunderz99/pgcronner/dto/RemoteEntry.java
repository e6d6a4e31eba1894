package io.github.thunderz99.pgcronner.dto;

import java.time.Instant;

/**
 * DTO class representing a job in pg_cron's job table, joined with the ownership tag this tool stores for it.
 */
public class RemoteEntry {

    /**
     * The id of the job in cron.job.
     */
    public long jobId;

    /**
     * The name of the job.
     */
    public String name;

    /**
     * The schedule of the job.
     */
    public String schedule;

    /**
     * The SQL command the job will execute.
     */
    public String command;

    /**
     * The ownership tag.
     */
    public String source;

    /**
     * Whether pg_cron will run the job.
     */
    public boolean active = true;

    /**
     * Start time of the latest run. null if the job never ran.
     */
    public Instant lastRun;

    public RemoteEntry() {
    }

    public RemoteEntry(long jobId, String name, String schedule, String command, String source) {
        this.jobId = jobId;
        this.name = name;
        this.schedule = schedule;
        this.command = command;
        this.source = source;
    }

    @Override
    public String toString() {
        return "RemoteEntry(%d, %s, %s, %s, %s, active=%s)".formatted(jobId, name, schedule, command, source, active);
    }
}
