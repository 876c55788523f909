package xyz.firestige.engine.infrastructure.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void fixedDelay_stopsAtMaxAttempts() {
        FixedDelayRetryPolicy policy = new FixedDelayRetryPolicy(3, Duration.ofSeconds(5));

        assertThat(policy.nextDelay(1, null)).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.nextDelay(2, null)).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.nextDelay(3, null)).isNull();
    }

    @Test
    void fixedDelay_rejectsInvalidArguments() {
        assertThatThrownBy(() -> new FixedDelayRetryPolicy(0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FixedDelayRetryPolicy(1, Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void exponential_growsAndCaps() {
        ExponentialBackoffRetryPolicy policy =
                new ExponentialBackoffRetryPolicy(6, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5));

        assertThat(policy.nextDelay(1, null)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.nextDelay(2, null)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.nextDelay(3, null)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.nextDelay(4, null)).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.nextDelay(6, null)).isNull();
    }

    @Test
    void exponential_rejectsMaxBelowInitial() {
        assertThatThrownBy(() -> new ExponentialBackoffRetryPolicy(3, Duration.ofSeconds(10), 2.0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void scheduled_finiteUsesEachDelayOnce() {
        ScheduledDelayRetryPolicy policy = ScheduledDelayRetryPolicy.finite(
                List.of(Duration.ofSeconds(1), Duration.ofSeconds(3), Duration.ofSeconds(10)));

        assertThat(policy.nextDelay(1, null)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.nextDelay(2, null)).isEqualTo(Duration.ofSeconds(3));
        assertThat(policy.nextDelay(3, null)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.nextDelay(4, null)).isNull();
    }

    @Test
    void scheduled_cappedRepeatsLastDelay() {
        ScheduledDelayRetryPolicy policy = ScheduledDelayRetryPolicy.capped(
                List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), 5);

        assertThat(policy.nextDelay(3, null)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.nextDelay(4, null)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.nextDelay(5, null)).isNull();
    }

    @Test
    void scheduled_rejectsEmptySequence() {
        assertThatThrownBy(() -> ScheduledDelayRetryPolicy.finite(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
