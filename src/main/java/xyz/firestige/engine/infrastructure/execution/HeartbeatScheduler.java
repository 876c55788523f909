package xyz.firestige.engine.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.engine.domain.progress.ProgressEvent;
import xyz.firestige.engine.domain.progress.ProgressListeners;
import xyz.firestige.engine.domain.progress.ProgressScope;
import xyz.firestige.engine.domain.progress.ProgressStep;
import xyz.firestige.engine.domain.shared.vo.ExecutionId;
import xyz.firestige.engine.infrastructure.event.ProgressNotifier;
import xyz.firestige.engine.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.engine.infrastructure.metrics.NoopMetricsRegistry;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 心跳调度器：长任务阻塞期间定期发布 IN_PROGRESS 进度事件
 */
public class HeartbeatScheduler {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatScheduler.class);

    private final ScheduledExecutorService scheduler;
    private final ProgressNotifier notifier;
    private final Duration interval;
    private final MetricsRegistry metrics;

    public HeartbeatScheduler(ScheduledExecutorService scheduler, ProgressNotifier notifier, Duration interval, MetricsRegistry metrics) {
        this.scheduler = scheduler;
        this.notifier = notifier;
        this.interval = interval;
        this.metrics = metrics != null ? metrics : new NoopMetricsRegistry();
    }

    /**
     * 不发送心跳的调度器
     */
    public static HeartbeatScheduler disabled(ProgressNotifier notifier) {
        return new HeartbeatScheduler(null, notifier, Duration.ZERO, null);
    }

    public Heartbeat start(ProgressScope scope, String action, ExecutionId executionId, ProgressListeners listeners) {
        if (scheduler == null || interval.isZero() || interval.isNegative()) {
            return Heartbeat.NONE;
        }
        long startedAt = System.nanoTime();
        AtomicLong beats = new AtomicLong();
        long millis = interval.toMillis();
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> {
            try {
                long elapsed = TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - startedAt);
                notifier.notify(ProgressEvent.info(scope, action, ProgressStep.IN_PROGRESS, executionId,
                        action + " still in progress (" + elapsed + "s elapsed)"), listeners);
                metrics.setGauge("long_task_elapsed_seconds", elapsed);
                beats.incrementAndGet();
            } catch (RuntimeException e) {
                // 心跳失败不影响主流程
                log.debug("心跳发送失败: scope={}, error={}", scope, e.getMessage());
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
        return new Heartbeat(future, beats);
    }

    public static final class Heartbeat implements AutoCloseable {

        static final Heartbeat NONE = new Heartbeat(null, new AtomicLong());

        private final ScheduledFuture<?> future;
        private final AtomicLong beats;

        private Heartbeat(ScheduledFuture<?> future, AtomicLong beats) {
            this.future = future;
            this.beats = beats;
        }

        public long beats() {
            return beats.get();
        }

        @Override
        public void close() {
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
