package io.github.thunderz99.pgcronner.dto;

import com.zaxxer.hikari.HikariConfig;
import io.github.thunderz99.pgcronner.util.Checker;

/**
 * Optional HikariCP settings for the postgres connections used by the gateway and the sync lock.
 *
 * <p>
 * A sync holds one connection for the advisory lock and uses another for each gateway call, so the pool should have
 * at least 2 connections per concurrent sync.
 * </p>
 */
public class PostgresHikariOptions {

    /**
     * Max number of connections in the pool.
     */
    public Integer maximumPoolSize;

    /**
     * Minimum number of idle connections to keep in the pool.
     */
    public Integer minimumIdle;

    /**
     * Maximum milliseconds to wait for a connection from the pool.
     */
    public Long connectionTimeoutMs;

    /**
     * Optional pool name for diagnostics.
     */
    public String poolName;

    /**
     * Set maximum pool size.
     *
     * @param maximumPoolSize max number of connections in the pool
     * @return current option instance
     */
    public PostgresHikariOptions withMaximumPoolSize(int maximumPoolSize) {
        Checker.check(maximumPoolSize > 1, "maximumPoolSize should be > 1");
        this.maximumPoolSize = maximumPoolSize;
        return this;
    }

    /**
     * Set minimum number of idle connections in the pool.
     *
     * @param minimumIdle minimum idle connections
     * @return current option instance
     */
    public PostgresHikariOptions withMinimumIdle(int minimumIdle) {
        Checker.check(minimumIdle >= 0, "minimumIdle should be >= 0");
        this.minimumIdle = minimumIdle;
        return this;
    }

    /**
     * Set connection timeout in milliseconds.
     *
     * @param connectionTimeoutMs connection timeout in milliseconds
     * @return current option instance
     */
    public PostgresHikariOptions withConnectionTimeoutMs(long connectionTimeoutMs) {
        Checker.check(connectionTimeoutMs > 0, "connectionTimeoutMs should be > 0");
        this.connectionTimeoutMs = connectionTimeoutMs;
        return this;
    }

    /**
     * Set pool name.
     *
     * @param poolName pool name for diagnostics
     * @return current option instance
     */
    public PostgresHikariOptions withPoolName(String poolName) {
        Checker.checkNotBlank(poolName, "poolName");
        this.poolName = poolName;
        return this;
    }

    /**
     * Apply options to a HikariConfig.
     *
     * @param config Hikari config to mutate
     */
    public void applyTo(HikariConfig config) {
        Checker.checkNotNull(config, "config");

        if (maximumPoolSize != null) {
            config.setMaximumPoolSize(maximumPoolSize);
        }

        if (minimumIdle != null) {
            config.setMinimumIdle(minimumIdle);
        }

        if (connectionTimeoutMs != null) {
            config.setConnectionTimeout(connectionTimeoutMs);
        }

        if (poolName != null) {
            config.setPoolName(poolName);
        }
    }
}
