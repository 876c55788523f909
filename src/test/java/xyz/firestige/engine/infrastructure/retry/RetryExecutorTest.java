package xyz.firestige.engine.infrastructure.retry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import xyz.firestige.engine.testutil.FakeSleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RetryExecutorTest {

    private final FakeSleeper sleeper = new FakeSleeper();
    private final RetryExecutor executor = new RetryExecutor(sleeper);

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void satisfiedOnFirstAttempt_doesNotSleep() {
        RetryOutcome<String> outcome = executor.poll(new FixedDelayRetryPolicy(5, Duration.ofSeconds(1)),
                () -> "ready", "ready"::equals);

        assertThat(outcome.isSatisfied()).isTrue();
        assertThat(outcome.getAttempts()).isEqualTo(1);
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void exhaustion_sleepsBetweenAttemptsOnly() {
        AtomicInteger calls = new AtomicInteger();

        RetryOutcome<Integer> outcome = executor.poll(new FixedDelayRetryPolicy(4, Duration.ofSeconds(2)),
                calls::incrementAndGet, value -> false);

        assertThat(outcome.isExhausted()).isTrue();
        assertThat(outcome.getAttempts()).isEqualTo(4);
        assertThat(outcome.getValue()).contains(4);
        assertThat(calls.get()).isEqualTo(4);
        assertThat(sleeper.sleeps()).hasSize(3).containsOnly(Duration.ofSeconds(2));
    }

    @Test
    void exceptionCountsAsFailedAttempt() {
        AtomicInteger calls = new AtomicInteger();

        RetryOutcome<String> outcome = executor.poll(new FixedDelayRetryPolicy(3, Duration.ofMillis(10)), () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
            return "ok";
        }, "ok"::equals);

        assertThat(outcome.isSatisfied()).isTrue();
        assertThat(outcome.getAttempts()).isEqualTo(3);
        assertThat(outcome.getLastError()).isEmpty();
        assertThat(sleeper.sleeps()).hasSize(2);
    }

    @Test
    void exhaustion_keepsLastError() {
        RetryOutcome<String> outcome = executor.poll(new FixedDelayRetryPolicy(2, Duration.ZERO), () -> {
            throw new IllegalStateException("down");
        }, value -> true);

        assertThat(outcome.isExhausted()).isTrue();
        assertThat(outcome.getLastError()).get().extracting(Throwable::getMessage).isEqualTo("down");
    }

    @Test
    void poolRotatesAcrossAttempts() {
        List<String> used = Collections.synchronizedList(new ArrayList<>());

        executor.poll(new FixedDelayRetryPolicy(5, Duration.ZERO), RotatingPool.of(List.of("a", "b", "c")),
                (resource, attempt) -> {
                    used.add(resource + attempt);
                    return resource;
                }, value -> false);

        assertThat(used).containsExactly("a1", "b2", "c3", "a4", "b5");
    }

    @Test
    void interruptedSleep_stopsPolling() {
        RetryExecutor interrupting = new RetryExecutor(duration -> {
            throw new InterruptedException("stop");
        });
        AtomicInteger calls = new AtomicInteger();

        RetryOutcome<Integer> outcome = interrupting.poll(new FixedDelayRetryPolicy(10, Duration.ofSeconds(1)),
                calls::incrementAndGet, value -> false);

        assertThat(outcome.isExhausted()).isTrue();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(outcome.getLastError()).get().isInstanceOf(InterruptedException.class);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }
}
