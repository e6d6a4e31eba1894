package io.github.thunderz99.pgcronner;

import io.github.thunderz99.pgcronner.dto.SyncResult;

/**
 * Thrown when a sync or a clear failed partway. Wraps the {@link GatewayException} of the failed step and tells which
 * names were already applied and which were not.
 *
 * <p>
 * Partially applied remote state is recoverable: running sync again recomputes the diff from the live pg_cron table.
 * </p>
 */
public class SyncException extends PgCronnerException {

    static final long serialVersionUID = 1L;

    /**
     * "sync" or "clear"
     */
    final String operation;

    /**
     * names applied before the failure
     */
    final SyncResult completed;

    /**
     * names not applied, including the one whose step failed
     */
    final SyncResult pending;

    public SyncException(String operation, GatewayException cause, SyncResult completed, SyncResult pending) {
        super(cause.getStatusCode(), cause.getCode(),
                "%s failed: %s. completed: %s, pending: %s".formatted(operation, cause.getMessage(), completed, pending), cause);
        this.operation = operation;
        this.completed = completed;
        this.pending = pending;
    }

    public String getOperation() {
        return operation;
    }

    public SyncResult getCompleted() {
        return completed;
    }

    public SyncResult getPending() {
        return pending;
    }

    @Override
    public synchronized GatewayException getCause() {
        return (GatewayException) super.getCause();
    }
}
