package io.github.thunderz99.pgcronner.gateway;

import java.sql.SQLException;
import java.time.Duration;

import javax.sql.DataSource;

import io.github.thunderz99.pgcronner.GatewayException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConnectionCheckoutTest {

    @Test
    void getConnection_should_return_connection_of_pool() throws Exception {
        var fake = new FakeDataSource();
        try (var conn = ConnectionCheckout.getConnection(fake.get(), Duration.ofSeconds(5))) {
            assertThat(conn).isNotNull();
        }
        assertThat(fake.checkouts.get()).isEqualTo(1);
        assertThat(fake.closes.get()).isEqualTo(1);
    }

    @Test
    void getConnection_should_close_a_connection_handed_out_late() throws Exception {
        var fake = new FakeDataSource().withCheckoutDelay(500);

        assertThatThrownBy(() -> ConnectionCheckout.getConnection(fake.get(), Duration.ofMillis(100)))
                .isInstanceOfSatisfying(GatewayException.class, e -> assertThat(e.getStatusCode()).isEqualTo(408));

        // wait for the slow checkout to finish
        var end = System.currentTimeMillis() + 5000;
        while (fake.closes.get() == 0 && System.currentTimeMillis() < end) {
            Thread.sleep(20);
        }
        assertThat(fake.checkouts.get()).isEqualTo(1);
        assertThat(fake.closes.get()).isEqualTo(1);
    }

    @Test
    void getConnection_should_convert_driver_error() {
        var failing = FakeDataSource.proxy(DataSource.class, (proxy, method, args) -> {
            if (method.getName().equals("getConnection")) {
                throw new SQLException("Connection refused", "08001");
            }
            return FakeDataSource.defaultValue(proxy, method, args);
        });

        assertThatThrownBy(() -> ConnectionCheckout.getConnection(failing, Duration.ofSeconds(5)))
                .isInstanceOfSatisfying(GatewayException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(429);
                    assertThat(e.getSqlState()).isEqualTo("08001");
                });
    }
}
