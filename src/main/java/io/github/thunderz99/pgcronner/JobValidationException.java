package io.github.thunderz99.pgcronner;

/**
 * Thrown when a job has a blank name, a malformed schedule or a malformed command. Such a job never reaches the
 * registry or the database.
 */
public class JobValidationException extends PgCronnerException {

    static final long serialVersionUID = 1L;

    final String jobName;

    public JobValidationException(String jobName, String message) {
        super(400, "ValidationFailed", message);
        this.jobName = jobName;
    }

    /**
     * @return name of the rejected job, may be null or blank when the name itself is the problem
     */
    public String getJobName() {
        return jobName;
    }
}
