package xyz.firestige.engine.infrastructure.retry;

import java.time.Duration;

/**
 * 重试策略接口
 * <p>
 * 决定一次失败尝试之后是否继续以及等待多久。
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * 决定下次重试的延迟时间
     *
     * @param attempt 已完成的尝试次数（从 1 开始）
     * @param lastError 上次错误（可能为 null，表示探测成功但结果不满足条件）
     * @return 延迟时间，null 表示停止重试
     */
    Duration nextDelay(int attempt, Throwable lastError);
}
