package io.github.thunderz99.pgcronner;

import java.sql.SQLException;

import org.apache.commons.lang3.StringUtils;

/**
 * Thrown when a call against the remote scheduler failed: connectivity, permission, timeout or a rejection by pg_cron.
 */
public class GatewayException extends PgCronnerException {

    static final long serialVersionUID = 1L;

    /**
     * SQLState of the underlying SQLException. null if the failure did not come from the driver.
     */
    final String sqlState;

    public GatewayException(int statusCode, String code, String message) {
        super(statusCode, code, message);
        this.sqlState = null;
    }

    public GatewayException(String message, SQLException cause) {
        super(convertStatusCode(cause), StringUtils.defaultString(cause.getSQLState()), message + ": " + cause.getMessage(), cause);
        this.sqlState = cause.getSQLState();
    }

    /**
     * A remote step that did not finish within the caller supplied timeout.
     *
     * @param message detail message
     * @return exception with status 408
     */
    public static GatewayException timeout(String message) {
        return new GatewayException(408, "Timeout", message);
    }

    public String getSqlState() {
        return sqlState;
    }

    /**
     * Convert postgres exception's SQLState to a http-like status code
     *
     * @param e
     * @return
     */
    static int convertStatusCode(SQLException e) {

        var state = StringUtils.defaultString(e.getSQLState());
        var message = StringUtils.defaultString(e.getMessage());

        /**
         * 23505	unique_violation
         * https://www.postgresql.org/docs/current/errcodes-appendix.html
         */
        if ("23505".equals(state) || message.contains("duplicate key")) {
            return 409;
        }

        /**
         * 57014	query_canceled (raised when the statement timeout / query timeout is exceeded)
         * 55P03	lock_not_available
         */
        if (StringUtils.equalsAny(state, "57014", "55P03")) {
            return 408;
        }

        if (state.startsWith("08")) {
            // Class 08: Connection Exception
            return 429;
        }

        return StringUtils.startsWithAny(state, "22", "23", "42") ? 400 : 500;
    }
}
