package io.github.thunderz99.pgcronner.job;

import java.time.Instant;
import java.util.Objects;

/**
 * A validated, named recurring task: a cron schedule, the SQL command pg_cron runs, and the source tag that marks the
 * job as owned by this registry.
 *
 * <p>
 * Instances are immutable and can only be created through {@link JobBuilder}, so every Job in the system has passed
 * schedule and command validation.
 * </p>
 */
public final class Job {

    private final String name;

    private final String schedule;

    private final String command;

    private final String source;

    private final boolean active;

    /**
     * start time of the latest run. written by pg_cron only, null if never run or not read from remote.
     */
    private final Instant lastRun;

    Job(String name, String schedule, String command, String source, boolean active, Instant lastRun) {
        this.name = name;
        this.schedule = schedule;
        this.command = command;
        this.source = source;
        this.active = active;
        this.lastRun = lastRun;
    }

    public String getName() {
        return name;
    }

    public String getSchedule() {
        return schedule;
    }

    public String getCommand() {
        return command;
    }

    public String getSource() {
        return source;
    }

    public boolean isActive() {
        return active;
    }

    public Instant getLastRun() {
        return lastRun;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Job)) {
            return false;
        }
        var other = (Job) o;
        return active == other.active
                && name.equals(other.name)
                && schedule.equals(other.schedule)
                && command.equals(other.command)
                && source.equals(other.source)
                && Objects.equals(lastRun, other.lastRun);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, schedule, command, source, active, lastRun);
    }

    @Override
    public String toString() {
        return "Job(%s, %s, %s, %s)".formatted(name, schedule, command, source);
    }
}
