package io.github.thunderz99.pgcronner.gateway;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import javax.sql.DataSource;

import com.zaxxer.hikari.HikariDataSource;
import io.github.thunderz99.pgcronner.GatewayException;
import io.github.thunderz99.pgcronner.reconcile.SyncLock;
import io.github.thunderz99.pgcronner.util.Checker;
import io.github.thunderz99.pgcronner.util.HashUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SyncLock} backed by a session-scoped postgres advisory lock. Every process using the same database and the
 * same side table computes the same key, so their syncs run one at a time.
 *
 * <p>
 * The lock lives as long as the session, so the connection is held until the lock is released. Callers in the same
 * process first queue on a local lock without a connection, so waiters do not drain the pool the holder needs for its
 * own gateway calls.
 * </p>
 */
public class PgAdvisorySyncLock implements SyncLock {

    private static final Logger log = LoggerFactory.getLogger(PgAdvisorySyncLock.class);

    final DataSource dataSource;

    final long key;

    final ReentrantLock localLock = new ReentrantLock();

    /**
     * @param dataSource datasource of the database where pg_cron is installed
     * @param scope      name the key is derived from, normally the side table name
     */
    public PgAdvisorySyncLock(DataSource dataSource, String scope) {
        this.dataSource = Checker.checkNotNull(dataSource, "dataSource");
        Checker.checkNotBlank(scope, "scope");
        this.key = HashUtil.toLongKey("pgcronner:" + scope);
    }

    /**
     * Take the local lock, a connection and the advisory lock, all within the given timeout.
     */
    @Override
    public Held acquire(Duration timeout) {
        Checker.checkPositive(timeout, "timeout");
        var endNanos = System.nanoTime() + timeout.toNanos();

        try {
            if (!localLock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                throw GatewayException.timeout("advisory lock %d is held by another caller in this process, not acquired within %s".formatted(key, timeout));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw GatewayException.timeout("interrupted while waiting for advisory lock " + key);
        }

        Connection conn = null;
        try {
            conn = ConnectionCheckout.getConnection(dataSource, remaining(endNanos));
            try (var stmt = conn.prepareStatement("SELECT pg_advisory_lock(?)")) {
                PgCronGateway.applyTimeout(stmt, remaining(endNanos));
                stmt.setLong(1, key);
                stmt.execute();
            }
            log.debug("advisory lock {} acquired", key);
            return new AdvisoryHeld(conn);
        } catch (SQLException e) {
            closeQuietly(conn, e);
            localLock.unlock();
            throw new GatewayException("could not acquire advisory lock " + key, e);
        } catch (RuntimeException e) {
            closeQuietly(conn, e);
            localLock.unlock();
            throw e;
        }
    }

    Duration remaining(long endNanos) {
        var left = endNanos - System.nanoTime();
        if (left <= 0) {
            throw GatewayException.timeout("timeout exceeded while acquiring advisory lock " + key);
        }
        return Duration.ofNanos(left);
    }

    class AdvisoryHeld implements Held {

        final Connection conn;

        AdvisoryHeld(Connection conn) {
            this.conn = conn;
        }

        @Override
        public void close() {
            try (var stmt = conn.prepareStatement("SELECT pg_advisory_unlock(?)")) {
                stmt.setLong(1, key);
                stmt.execute();
                log.debug("advisory lock {} released", key);
            } catch (SQLException e) {
                // a pooled connection would keep the session and the lock alive, so drop it from the pool
                log.warn("could not release advisory lock {}. evicting the connection. message:{}", key, e.getMessage());
                if (dataSource instanceof HikariDataSource) {
                    ((HikariDataSource) dataSource).evictConnection(conn);
                }
            } finally {
                closeQuietly(conn, null);
                localLock.unlock();
            }
        }
    }

    static void closeQuietly(Connection conn, Exception primary) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            if (primary != null) {
                primary.addSuppressed(e);
            } else {
                log.warn("could not close connection. message:{}", e.getMessage());
            }
        }
    }

    public long getKey() {
        return key;
    }
}
