package io.github.thunderz99.pgcronner;

import java.sql.SQLException;

import io.github.thunderz99.pgcronner.dto.SyncResult;
import org.junit.jupiter.api.Test;
import org.postgresql.util.PSQLException;
import org.postgresql.util.PSQLState;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayExceptionTest {

    @Test
    void convertStatusCode_should_work_for_postgres() {
        // 409
        assertThat(GatewayException.convertStatusCode(new PSQLException("msg", PSQLState.UNIQUE_VIOLATION))).isEqualTo(409);
        assertThat(GatewayException.convertStatusCode(new SQLException("ERROR: duplicate key value violates unique constraint", (String) null))).isEqualTo(409);

        // 408
        assertThat(GatewayException.convertStatusCode(new SQLException("canceling statement due to user request", "57014"))).isEqualTo(408);
        assertThat(GatewayException.convertStatusCode(new SQLException("could not obtain lock", "55P03"))).isEqualTo(408);

        // 429
        assertThat(GatewayException.convertStatusCode(new PSQLException("msg", PSQLState.CONNECTION_UNABLE_TO_CONNECT))).isEqualTo(429);
        assertThat(GatewayException.convertStatusCode(new PSQLException("msg", PSQLState.CONNECTION_FAILURE))).isEqualTo(429);
        assertThat(GatewayException.convertStatusCode(new PSQLException("msg", PSQLState.CONNECTION_FAILURE_DURING_TRANSACTION))).isEqualTo(429);

        // 400
        assertThat(GatewayException.convertStatusCode(new PSQLException("msg", PSQLState.BAD_DATETIME_FORMAT))).isEqualTo(400);
        assertThat(GatewayException.convertStatusCode(new PSQLException("msg", PSQLState.NOT_NULL_VIOLATION))).isEqualTo(400);
        assertThat(GatewayException.convertStatusCode(new SQLException("function cron.schedule does not exist", "42883"))).isEqualTo(400);

        // 500
        assertThat(GatewayException.convertStatusCode(new PSQLException("msg", PSQLState.OBJECT_IN_USE))).isEqualTo(500);
        assertThat(GatewayException.convertStatusCode(new PSQLException("msg", PSQLState.SYSTEM_ERROR))).isEqualTo(500);
    }

    @Test
    void constructor_should_keep_sqlState() {
        var e = new GatewayException("could not schedule job testjob", new PSQLException("boom", PSQLState.CONNECTION_FAILURE));
        assertThat(e.getStatusCode()).isEqualTo(429);
        assertThat(e.getSqlState()).isEqualTo("08006");
        assertThat(e.getCode()).isEqualTo("08006");
        assertThat(e.getMessage()).contains("could not schedule job testjob", "boom");

        var timeout = GatewayException.timeout("timeout exceeded before listing remote jobs");
        assertThat(timeout.getStatusCode()).isEqualTo(408);
        assertThat(timeout.getSqlState()).isNull();
    }

    @Test
    void syncException_should_take_status_of_cause() {
        var cause = new GatewayException(500, "XX000", "pg_cron rejected testjob");
        var e = new SyncException("sync", cause, new SyncResult(), new SyncResult());
        assertThat(e.getStatusCode()).isEqualTo(500);
        assertThat(e.getCode()).isEqualTo("XX000");
        assertThat(e.getCause()).isSameAs(cause);
        assertThat(e.getMessage()).startsWith("sync failed: pg_cron rejected testjob");
    }
}
