package io.github.thunderz99.pgcronner.gateway;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import javax.sql.DataSource;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.thunderz99.pgcronner.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Takes a connection from a pool within a given time.
 *
 * <p>
 * A pool blocks a checkout for its own connection timeout (HikariCP: 30 seconds by default), which can be far longer
 * than what the caller has left. The checkout runs on a helper thread and the caller waits at most the given timeout.
 * A connection handed out after the caller gave up is closed right away, returning it to the pool.
 * </p>
 */
final class ConnectionCheckout {

    private static final Logger log = LoggerFactory.getLogger(ConnectionCheckout.class);

    static final ExecutorService executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
            .setNameFormat("pgcronner-checkout-%d")
            .setDaemon(true)
            .build());

    private ConnectionCheckout() {
    }

    /**
     * @param dataSource pool to take the connection from
     * @param timeout    max time to wait
     * @return a connection. the caller closes it
     * @throws GatewayException 408 if no connection was handed out in time, otherwise the status of the driver error
     */
    static Connection getConnection(DataSource dataSource, Duration timeout) throws GatewayException {
        var future = CompletableFuture.supplyAsync(() -> {
            try {
                return dataSource.getConnection();
            } catch (SQLException e) {
                throw new CompletionException(e);
            }
        }, executor);

        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.thenAccept(ConnectionCheckout::closeLate);
            throw GatewayException.timeout("no connection available within " + timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.thenAccept(ConnectionCheckout::closeLate);
            throw GatewayException.timeout("interrupted while waiting for a connection");
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof SQLException) {
                throw new GatewayException("could not get a connection", (SQLException) cause);
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new GatewayException(500, "InternalError", "could not get a connection: " + cause);
        }
    }

    static void closeLate(Connection conn) {
        try {
            conn.close();
            log.debug("closed a connection handed out after its caller timed out");
        } catch (SQLException e) {
            log.warn("could not close a late connection. message:{}", e.getMessage());
        }
    }
}
