package xyz.firestige.engine.infrastructure.retry;

/**
 * 带副作用的探测动作，与判定条件分离
 *
 * @param <R> 本次尝试使用的资源（例如 DNS 解析器）
 * @param <T> 探测结果
 */
@FunctionalInterface
public interface Probe<R, T> {

    /**
     * @param resource 本次尝试分配到的资源
     * @param attempt 尝试序号（从 1 开始）
     */
    T probe(R resource, int attempt) throws Exception;
}
