package io.github.thunderz99.pgcronner.dto;

/**
 * One entry of a declarative job manifest, used to seed the registry at startup.
 *
 * <pre>
 * {
 *   "myjob": {"name": "testjob", "schedule": "*&#47;5 * * * *", "command": "SELECT 1;", "source": "source"}
 * }
 * </pre>
 */
public class JobDefinition {

    public String name;

    public String schedule;

    public String command;

    public String source;

    public JobDefinition() {
    }

    public JobDefinition(String name, String schedule, String command, String source) {
        this.name = name;
        this.schedule = schedule;
        this.command = command;
        this.source = source;
    }
}
