package xyz.firestige.engine.infrastructure.retry;

import java.time.Duration;

/**
 * 等待抽象，测试中替换为假时钟
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
