package xyz.firestige.engine.infrastructure.retry;

import java.util.Optional;

/**
 * 轮询结果：满足条件，或预算耗尽
 */
public final class RetryOutcome<T> {

    private final boolean satisfied;
    private final T value;
    private final int attempts;
    private final Throwable lastError;

    private RetryOutcome(boolean satisfied, T value, int attempts, Throwable lastError) {
        this.satisfied = satisfied;
        this.value = value;
        this.attempts = attempts;
        this.lastError = lastError;
    }

    static <T> RetryOutcome<T> satisfied(T value, int attempts) {
        return new RetryOutcome<>(true, value, attempts, null);
    }

    static <T> RetryOutcome<T> exhausted(T lastValue, int attempts, Throwable lastError) {
        return new RetryOutcome<>(false, lastValue, attempts, lastError);
    }

    public boolean isSatisfied() {
        return satisfied;
    }

    public boolean isExhausted() {
        return !satisfied;
    }

    /**
     * 满足条件时为结果值；耗尽时为最后一次成功探测的结果（可能为空）
     */
    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public int getAttempts() {
        return attempts;
    }

    public Optional<Throwable> getLastError() {
        return Optional.ofNullable(lastError);
    }

    @Override
    public String toString() {
        return "RetryOutcome{satisfied=" + satisfied + ", attempts=" + attempts + ", value=" + value + "}";
    }
}
