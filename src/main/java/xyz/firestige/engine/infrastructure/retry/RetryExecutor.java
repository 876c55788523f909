package xyz.firestige.engine.infrastructure.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * 通用轮询执行器
 * <p>
 * 反复执行探测，直到结果满足判定条件或重试策略返回 null。
 * 探测抛出的异常计为一次失败尝试，不会中断轮询。
 * 尝试是串行的，每次尝试从资源池取下一个资源。
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final Sleeper sleeper;

    public RetryExecutor() {
        this(Sleeper.THREAD);
    }

    public RetryExecutor(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public <T> RetryOutcome<T> poll(RetryPolicy policy, Callable<T> probe, Predicate<? super T> condition) {
        Objects.requireNonNull(probe, "probe");
        return poll(policy, RotatingPool.of(List.of(Boolean.TRUE)), (resource, attempt) -> probe.call(), condition);
    }

    public <R, T> RetryOutcome<T> poll(RetryPolicy policy,
                                       RotatingPool<R> pool,
                                       Probe<? super R, T> probe,
                                       Predicate<? super T> condition) {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(pool, "pool");
        Objects.requireNonNull(probe, "probe");
        Objects.requireNonNull(condition, "condition");

        int attempt = 0;
        T lastValue = null;
        Throwable lastError = null;
        while (true) {
            attempt++;
            R resource = pool.next();
            try {
                T value = probe.probe(resource, attempt);
                if (condition.test(value)) {
                    log.debug("轮询成功: attempt={}, resource={}", attempt, resource);
                    return RetryOutcome.satisfied(value, attempt);
                }
                lastValue = value;
                lastError = null;
                log.debug("轮询未满足条件: attempt={}, resource={}, value={}", attempt, resource, value);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RetryOutcome.exhausted(lastValue, attempt, e);
            } catch (Exception e) {
                lastError = e;
                log.debug("轮询探测异常: attempt={}, resource={}, error={}", attempt, resource, e.getMessage());
            }

            Duration delay = policy.nextDelay(attempt, lastError);
            if (delay == null) {
                log.debug("轮询预算耗尽: attempts={}", attempt);
                return RetryOutcome.exhausted(lastValue, attempt, lastError);
            }
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("轮询等待被中断: attempt={}", attempt);
                return RetryOutcome.exhausted(lastValue, attempt, e);
            }
        }
    }
}
