package io.github.thunderz99.pgcronner.job;

/**
 * Where a job name stands between the registry and pg_cron.
 *
 * <pre>
 * ABSENT -> PENDING_CREATE -> SCHEDULED -> PENDING_REMOVAL -> ABSENT
 *                             SCHEDULED -> PENDING_UPDATE  -> SCHEDULED
 * </pre>
 *
 * Only a sync moves a name out of a PENDING_* state.
 */
public enum JobState {

    /**
     * neither in the registry nor scheduled under a known source tag
     */
    ABSENT,

    /**
     * added locally, not yet scheduled
     */
    PENDING_CREATE,

    /**
     * in the registry and scheduled with the same definition
     */
    SCHEDULED,

    /**
     * in the registry and scheduled, but schedule or command differ
     */
    PENDING_UPDATE,

    /**
     * removed locally, still scheduled
     */
    PENDING_REMOVAL
}
