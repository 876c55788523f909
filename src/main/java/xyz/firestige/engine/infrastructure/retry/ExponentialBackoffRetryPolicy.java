package xyz.firestige.engine.infrastructure.retry;

import java.time.Duration;

/**
 * 指数退避重试策略
 * <p>
 * 延迟 = initialDelay * multiplier^(attempt-1)，不超过 maxDelay。
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {

    private final int maxAttempts;
    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;

    public ExponentialBackoffRetryPolicy(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay;
    }

    @Override
    public Duration nextDelay(int attempt, Throwable lastError) {
        if (attempt >= maxAttempts) {
            return null;
        }
        double delayMillis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        long cappedMillis = (long) Math.min(delayMillis, maxDelay.toMillis());
        return Duration.ofMillis(cappedMillis);
    }
}
