package io.github.thunderz99.pgcronner.reconcile;

import java.time.Duration;

import io.github.thunderz99.pgcronner.GatewayException;

/**
 * Claims the exclusive right to change the remote job table for the duration of one sync or clear.
 *
 * <p>
 * Callers may be separate processes, so implementations should be scoped to the database (e.g. a postgres advisory
 * lock) rather than to the JVM.
 * </p>
 */
public interface SyncLock {

    /**
     * A held lock. Closing it releases the lock.
     */
    interface Held extends AutoCloseable {

        @Override
        void close();
    }

    /**
     * Acquire the lock, waiting at most the given timeout.
     *
     * @param timeout max time to wait
     * @return the held lock
     * @throws GatewayException if the lock could not be acquired in time, or the database failed
     */
    Held acquire(Duration timeout) throws GatewayException;
}
