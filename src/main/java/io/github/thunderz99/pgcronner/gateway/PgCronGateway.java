package io.github.thunderz99.pgcronner.gateway;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import javax.sql.DataSource;

import io.github.thunderz99.pgcronner.GatewayException;
import io.github.thunderz99.pgcronner.dto.RemoteEntry;
import io.github.thunderz99.pgcronner.job.Job;
import io.github.thunderz99.pgcronner.util.Checker;
import io.github.thunderz99.pgcronner.util.SqlIdentifierUtil;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SchedulerGateway} for the pg_cron plugin. Schedules / un-schedules jobs through cron.schedule / cron.unschedule.
 *
 * <p>
 * pg_cron's job table has no room for an owner, so the source tag of every job scheduled here is kept in a side table
 * (default "pgcronner_jobs") keyed by job name. Listing joins cron.job with the side table, so jobs scheduled by other
 * tools never show up.
 * </p>
 */
public class PgCronGateway implements SchedulerGateway {

    private static final Logger log = LoggerFactory.getLogger(PgCronGateway.class);

    public static final String DEFAULT_TABLE_NAME = "pgcronner_jobs";

    final DataSource dataSource;

    final String tableName;

    /**
     * Create the gateway and the side table if it does not exist.
     *
     * @param dataSource datasource of the database where pg_cron is installed
     * @param tableName  side table for the source tags
     * @param timeout    max time for creating the side table
     * @throws GatewayException if the side table can not be created
     */
    public PgCronGateway(DataSource dataSource, String tableName, Duration timeout) {
        this.dataSource = Checker.checkNotNull(dataSource, "dataSource");
        this.tableName = SqlIdentifierUtil.checkAndNormalizeTableName(tableName);
        Checker.checkPositive(timeout, "timeout");
        initSchema(timeout);
    }

    void initSchema(Duration timeout) {
        var sql = """
                CREATE TABLE IF NOT EXISTS %s (
                    name TEXT NOT NULL PRIMARY KEY,
                    source TEXT NOT NULL,
                    created TIMESTAMPTZ NOT NULL DEFAULT CURRENT_TIMESTAMP
                )
                """.formatted(tableName);

        try (var conn = ConnectionCheckout.getConnection(dataSource, timeout);
             var stmt = conn.createStatement()) {
            applyTimeout(stmt, timeout);
            stmt.executeUpdate(sql);
            log.info("Table '{}' for job sources is ready.", tableName);
        } catch (SQLException e) {
            throw new GatewayException("could not create table " + tableName, e);
        }
    }

    @Override
    public List<RemoteEntry> list(Set<String> sources, Duration timeout) {
        Checker.checkNotNull(sources, "sources");
        Checker.checkPositive(timeout, "timeout");

        var ret = new ArrayList<RemoteEntry>();
        if (sources.isEmpty()) {
            return ret;
        }

        var sql = """
                SELECT j.jobid, j.jobname, j.schedule, j.command, j.active, o.source,
                       (SELECT max(d.start_time) FROM cron.job_run_details d WHERE d.jobid = j.jobid) AS last_run
                FROM cron.job j
                JOIN %s o ON o.name = j.jobname
                WHERE j.username = current_user AND o.source = ANY(?)
                ORDER BY j.jobid
                """.formatted(tableName);

        try (var conn = ConnectionCheckout.getConnection(dataSource, timeout);
             var stmt = conn.prepareStatement(sql)) {
            applyTimeout(stmt, timeout);
            stmt.setArray(1, conn.createArrayOf("text", sources.toArray()));
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    var entry = new RemoteEntry(rs.getLong("jobid"), rs.getString("jobname"), rs.getString("schedule"),
                            rs.getString("command"), rs.getString("source"));
                    entry.active = rs.getBoolean("active");
                    var lastRun = rs.getTimestamp("last_run");
                    entry.lastRun = lastRun == null ? null : lastRun.toInstant();
                    ret.add(entry);
                }
            }
        } catch (SQLException e) {
            throw new GatewayException("could not list jobs for sources " + sources, e);
        }
        return ret;
    }

    /**
     * Schedule the job and record its source tag in one transaction. A name already in cron.job is only replaced when
     * this tool recorded it under the same source tag.
     */
    @Override
    public RemoteEntry schedule(Job job, Duration timeout) {
        Checker.checkNotNull(job, "job");
        Checker.checkPositive(timeout, "timeout");

        try (var conn = ConnectionCheckout.getConnection(dataSource, timeout)) {
            conn.setAutoCommit(false);
            try {
                checkNotForeign(conn, job, timeout);

                long jobId;
                try (var stmt = conn.prepareStatement("SELECT cron.schedule(?, ?, ?);")) {
                    applyTimeout(stmt, timeout);
                    stmt.setString(1, job.getName());
                    stmt.setString(2, job.getSchedule());
                    stmt.setString(3, job.getCommand());
                    try (var rs = stmt.executeQuery()) {
                        rs.next();
                        jobId = rs.getLong(1);
                    }
                }

                if (!job.isActive()) {
                    try (var stmt = conn.prepareStatement("SELECT cron.alter_job(job_id := ?, active := false);")) {
                        applyTimeout(stmt, timeout);
                        stmt.setLong(1, jobId);
                        stmt.execute();
                    }
                }

                var upsert = """
                        INSERT INTO %s (name, source) VALUES (?, ?)
                        ON CONFLICT (name) DO UPDATE SET source = EXCLUDED.source
                        """.formatted(tableName);
                try (var stmt = conn.prepareStatement(upsert)) {
                    applyTimeout(stmt, timeout);
                    stmt.setString(1, job.getName());
                    stmt.setString(2, job.getSource());
                    stmt.executeUpdate();
                }

                conn.commit();

                if (log.isInfoEnabled()) {
                    log.info("scheduled job '{}' successfully. jobId: {}, schedule: {}, source: {}", job.getName(), jobId, job.getSchedule(), job.getSource());
                }

                var ret = new RemoteEntry(jobId, job.getName(), job.getSchedule(), job.getCommand(), job.getSource());
                ret.active = job.isActive();
                return ret;

            } catch (SQLException | GatewayException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new GatewayException("could not schedule job " + job.getName(), e);
        }
    }

    /**
     * @throws GatewayException(409) if the name is in cron.job but not recorded by this tool under the job's source
     */
    void checkNotForeign(Connection conn, Job job, Duration timeout) throws SQLException {
        var sql = """
                SELECT o.source FROM cron.job j
                LEFT JOIN %s o ON o.name = j.jobname
                WHERE j.jobname = ? AND j.username = current_user
                """.formatted(tableName);

        try (var stmt = conn.prepareStatement(sql)) {
            applyTimeout(stmt, timeout);
            stmt.setString(1, job.getName());
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    var owner = rs.getString(1);
                    if (!job.getSource().equals(owner)) {
                        throw new GatewayException(409, "Conflict",
                                "job '%s' is already scheduled by another owner(source: %s)".formatted(job.getName(), owner));
                    }
                }
            }
        }
    }

    @Override
    public boolean unschedule(String name, Duration timeout) {
        Checker.checkNotBlank(name, "name");
        Checker.checkPositive(timeout, "timeout");

        try (var conn = ConnectionCheckout.getConnection(dataSource, timeout)) {
            conn.setAutoCommit(false);
            try {
                var unscheduled = jobExists(conn, name, timeout) && unscheduleIfPresent(conn, name, timeout);

                try (var stmt = conn.prepareStatement("DELETE FROM %s WHERE name = ?".formatted(tableName))) {
                    applyTimeout(stmt, timeout);
                    stmt.setString(1, name);
                    stmt.executeUpdate();
                }

                conn.commit();

                if (log.isInfoEnabled()) {
                    log.info("unscheduled job '{}'. found: {}", name, unscheduled);
                }
                return unscheduled;

            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new GatewayException("could not unschedule job " + name, e);
        }
    }

    /**
     * pg_cron job names are unique per database user, and cron.schedule / cron.unschedule act on the current user's
     * job only. Jobs of other users are never looked at.
     */
    static final String JOB_EXISTS_SQL = "SELECT 1 FROM cron.job WHERE jobname = ? AND username = current_user";

    static boolean jobExists(Connection conn, String name, Duration timeout) throws SQLException {
        try (var stmt = conn.prepareStatement(JOB_EXISTS_SQL)) {
            applyTimeout(stmt, timeout);
            stmt.setString(1, name);
            try (var rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Unschedule a job found by {@link #jobExists}. A job removed in between makes pg_cron raise
     * "could not find valid entry for job", which counts as not scheduled. The savepoint keeps the transaction usable
     * for the side table update in that case.
     */
    static boolean unscheduleIfPresent(Connection conn, String name, Duration timeout) throws SQLException {
        var savepoint = conn.setSavepoint();
        try (var stmt = conn.prepareStatement("SELECT cron.unschedule(?);")) {
            applyTimeout(stmt, timeout);
            stmt.setString(1, name);
            try (var rs = stmt.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        } catch (SQLException e) {
            if (StringUtils.contains(e.getMessage(), "could not find valid entry for job")) {
                conn.rollback(savepoint);
                return false;
            }
            throw e;
        }
    }

    /**
     * JDBC query timeouts are in whole seconds. Round up, at least 1 second.
     */
    static void applyTimeout(Statement stmt, Duration timeout) throws SQLException {
        stmt.setQueryTimeout(toTimeoutSeconds(timeout));
    }

    static int toTimeoutSeconds(Duration timeout) {
        var seconds = (timeout.toMillis() + 999) / 1000;
        return (int) Math.max(1, Math.min(seconds, Integer.MAX_VALUE));
    }

    public String getTableName() {
        return tableName;
    }
}
