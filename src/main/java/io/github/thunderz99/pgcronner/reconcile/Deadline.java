package io.github.thunderz99.pgcronner.reconcile;

import java.time.Duration;

import io.github.thunderz99.pgcronner.GatewayException;

/**
 * Splits one caller supplied timeout across the remote steps of a single operation.
 */
class Deadline {

    private final long endNanos;

    private Deadline(long endNanos) {
        this.endNanos = endNanos;
    }

    static Deadline after(Duration timeout) {
        return new Deadline(System.nanoTime() + timeout.toNanos());
    }

    /**
     * @param step description of the next remote step, used in the error message
     * @return time left for the step
     * @throws GatewayException with status 408 if no time is left
     */
    Duration remaining(String step) throws GatewayException {
        var left = endNanos - System.nanoTime();
        if (left <= 0) {
            throw GatewayException.timeout("timeout exceeded before " + step);
        }
        return Duration.ofNanos(left);
    }
}
