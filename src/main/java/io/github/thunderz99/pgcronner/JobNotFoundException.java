package io.github.thunderz99.pgcronner;

/**
 * Thrown by {@code one} / {@code remove} when the registry holds no job with the given name.
 */
public class JobNotFoundException extends PgCronnerException {

    static final long serialVersionUID = 1L;

    final String jobName;

    public JobNotFoundException(String jobName) {
        super(404, "NotFound", "job not found: " + jobName);
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}
