package xyz.firestige.engine.infrastructure.retry;

import java.time.Duration;
import java.util.List;

/**
 * 自定义延迟序列重试策略
 * <p>
 * 第 n 次失败后等待 delays[n-1]；序列用完后若设置了 capAttempts，则以最后一个延迟继续，直到总尝试次数达到上限。
 */
public class ScheduledDelayRetryPolicy implements RetryPolicy {

    private final List<Duration> delays;
    private final int capAttempts;

    /**
     * @param delays 延迟序列，尝试次数为 delays.size() + 1
     */
    public static ScheduledDelayRetryPolicy finite(List<Duration> delays) {
        return new ScheduledDelayRetryPolicy(delays, delays.size() + 1);
    }

    /**
     * @param delays 延迟序列，用完后重复最后一个延迟
     * @param capAttempts 总尝试次数上限
     */
    public static ScheduledDelayRetryPolicy capped(List<Duration> delays, int capAttempts) {
        return new ScheduledDelayRetryPolicy(delays, capAttempts);
    }

    private ScheduledDelayRetryPolicy(List<Duration> delays, int capAttempts) {
        if (delays == null || delays.isEmpty()) {
            throw new IllegalArgumentException("delays must not be empty");
        }
        if (delays.stream().anyMatch(d -> d == null || d.isNegative())) {
            throw new IllegalArgumentException("delays must be positive");
        }
        if (capAttempts <= 0) {
            throw new IllegalArgumentException("capAttempts must be > 0");
        }
        this.delays = List.copyOf(delays);
        this.capAttempts = capAttempts;
    }

    @Override
    public Duration nextDelay(int attempt, Throwable lastError) {
        if (attempt >= capAttempts) {
            return null;
        }
        int index = Math.min(attempt - 1, delays.size() - 1);
        return delays.get(index);
    }
}
