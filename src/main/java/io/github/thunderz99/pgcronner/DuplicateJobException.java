package io.github.thunderz99.pgcronner;

/**
 * Thrown by {@code add} when the registry already holds a job with the same name.
 */
public class DuplicateJobException extends PgCronnerException {

    static final long serialVersionUID = 1L;

    final String jobName;

    public DuplicateJobException(String jobName) {
        super(409, "Conflict", "job already exists: " + jobName);
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}
