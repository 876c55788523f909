package xyz.firestige.engine.infrastructure.retry;

import java.time.Duration;

/**
 * 固定延迟重试策略
 * <p>
 * maxAttempts 次尝试之间共 maxAttempts - 1 次等待。
 */
public class FixedDelayRetryPolicy implements RetryPolicy {

    private final int maxAttempts;
    private final Duration delay;

    public FixedDelayRetryPolicy(int maxAttempts, Duration delay) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be positive");
        }
        this.maxAttempts = maxAttempts;
        this.delay = delay;
    }

    @Override
    public Duration nextDelay(int attempt, Throwable lastError) {
        if (attempt >= maxAttempts) {
            return null; // 停止重试
        }
        return delay;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getDelay() {
        return delay;
    }

    @Override
    public String toString() {
        return "FixedDelay{" + maxAttempts + " x " + delay + "}";
    }
}
