package xyz.firestige.engine.infrastructure.retry;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 轮询资源池
 * <p>
 * 每次 {@link #next()} 返回下一个资源，第 i 次调用（从 0 开始）返回 {@code items[i % size]}。
 * 每个轮询过程应使用独立的实例。
 */
public class RotatingPool<T> {

    private final List<T> items;
    private final AtomicInteger counter = new AtomicInteger(0);

    private RotatingPool(List<T> items) {
        this.items = items;
    }

    public static <T> RotatingPool<T> of(List<T> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("pool must not be empty");
        }
        return new RotatingPool<>(List.copyOf(items));
    }

    public T next() {
        int index = Math.floorMod(counter.getAndIncrement(), items.size());
        return items.get(index);
    }

    public int size() {
        return items.size();
    }

    public List<T> items() {
        return items;
    }
}
