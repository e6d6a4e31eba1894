package io.github.thunderz99.pgcronner.job;

import java.time.Instant;
import java.util.regex.Pattern;

import io.github.thunderz99.pgcronner.JobValidationException;
import io.github.thunderz99.pgcronner.dto.JobDefinition;
import io.github.thunderz99.pgcronner.dto.RemoteEntry;
import io.github.thunderz99.pgcronner.util.CronUtil;
import org.apache.commons.lang3.StringUtils;

/**
 * Validates raw input and builds a {@link Job}. The only way a Job is created, both for local edits and for rows read
 * back from pg_cron.
 *
 * <pre>
 * var job = JobBuilder.build("vacuum_logs", "0 3 * * *", "CALL vacuum_logs();", "billing");
 *
 * var inactive = new JobBuilder()
 *         .withName("report")
 *         .withSchedule("*&#47;5 * * * *")
 *         .withCommand("SELECT 1;")
 *         .withActive(false)
 *         .build();
 * </pre>
 */
public class JobBuilder {

    /**
     * the upper case CALL keyword as a whole word. "call" in other case, e.g. inside a string literal, is plain text
     */
    static final Pattern CALL_TOKEN = Pattern.compile("\\bCALL\\b");

    /**
     * a complete procedure call: CALL proc_name(args);
     */
    static final Pattern CALL_STATEMENT = Pattern.compile("\\bCALL\\s+[A-Za-z_\"][\\w$.\"]*\\s*\\([^;]*\\)\\s*;");

    String name;

    String schedule;

    String command;

    String source = "";

    boolean active = true;

    Instant lastRun;

    public JobBuilder withName(String name) {
        this.name = name;
        return this;
    }

    public JobBuilder withSchedule(String schedule) {
        this.schedule = schedule;
        return this;
    }

    public JobBuilder withCommand(String command) {
        this.command = command;
        return this;
    }

    /**
     * Specify the ownership tag. May be empty but not null.
     *
     * @param source ownership tag
     * @return this
     */
    public JobBuilder withSource(String source) {
        this.source = source;
        return this;
    }

    public JobBuilder withActive(boolean active) {
        this.active = active;
        return this;
    }

    public JobBuilder withLastRun(Instant lastRun) {
        this.lastRun = lastRun;
        return this;
    }

    /**
     * Validate the collected fields and build the job.
     *
     * @return a valid job
     * @throws JobValidationException if name, schedule, command or source is malformed
     */
    public Job build() throws JobValidationException {

        if (StringUtils.isBlank(name)) {
            throw new JobValidationException(name, "job name should be non-blank");
        }

        var scheduleError = CronUtil.describeError(schedule);
        if (scheduleError != null) {
            throw new JobValidationException(name, "job '%s': %s".formatted(name, scheduleError));
        }

        var commandError = describeCommandError(command);
        if (commandError != null) {
            throw new JobValidationException(name, "job '%s': %s".formatted(name, commandError));
        }

        if (source == null) {
            throw new JobValidationException(name, "job '%s': source should not be null".formatted(name));
        }

        return new Job(name, schedule, command, source, active, lastRun);
    }

    /**
     * Build a job from the four declarative fields.
     *
     * @param name     unique job name
     * @param schedule 5-field cron expression
     * @param command  SQL statement or "CALL proc();"
     * @param source   ownership tag
     * @return a valid job
     * @throws JobValidationException if any field is malformed
     */
    public static Job build(String name, String schedule, String command, String source) throws JobValidationException {
        return new JobBuilder()
                .withName(name)
                .withSchedule(schedule)
                .withCommand(command)
                .withSource(source)
                .build();
    }

    /**
     * Re-validate a row read from pg_cron.
     *
     * @param entry remote entry
     * @return a valid job carrying the remote active flag and last run
     * @throws JobValidationException if the row is malformed
     */
    public static Job fromRemote(RemoteEntry entry) throws JobValidationException {
        return new JobBuilder()
                .withName(entry.name)
                .withSchedule(entry.schedule)
                .withCommand(entry.command)
                .withSource(entry.source)
                .withActive(entry.active)
                .withLastRun(entry.lastRun)
                .build();
    }

    /**
     * Build a job from a manifest entry.
     *
     * @param definition manifest entry
     * @return a valid job
     * @throws JobValidationException if the entry is malformed
     */
    public static Job fromDefinition(JobDefinition definition) throws JobValidationException {
        return build(definition.name, definition.schedule, definition.command, definition.source);
    }

    /**
     * Check a command. Every CALL in the command should be a complete call ending with "();" (arguments allowed).
     *
     * @param command SQL command
     * @return null if valid, otherwise the reason
     */
    static String describeCommandError(String command) {
        if (StringUtils.isBlank(command)) {
            return "command should be non-blank";
        }

        var calls = CALL_TOKEN.matcher(command).results().count();
        if (calls == 0) {
            return null;
        }

        var completeCalls = CALL_STATEMENT.matcher(command).results().count();
        if (completeCalls != calls) {
            return "command uses CALL without a complete procedure call like 'CALL my_proc();': " + command;
        }
        return null;
    }
}
