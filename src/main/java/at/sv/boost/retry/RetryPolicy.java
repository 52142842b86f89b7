package at.sv.boost.retry;

import java.time.Duration;

/**
 * @param maxAttempts the number of attempts before giving up, at least 1
 * @param delay       the delay between two attempts
 */
public record RetryPolicy(int maxAttempts, Duration delay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
    }
}
