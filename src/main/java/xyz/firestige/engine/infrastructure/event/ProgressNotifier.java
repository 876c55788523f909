package xyz.firestige.engine.infrastructure.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.engine.domain.progress.ProgressEvent;
import xyz.firestige.engine.domain.progress.ProgressListener;
import xyz.firestige.engine.domain.progress.ProgressListeners;
import xyz.firestige.engine.domain.shared.event.DomainEventPublisher;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 进度通知通道
 * <p>
 * 事件同时投递到领域事件总线和服务上注册的监听器。投递通过 executor 异步完成，
 * 订阅者变慢或抛出异常都不会影响编排结果。
 */
public class ProgressNotifier {

    private static final Logger log = LoggerFactory.getLogger(ProgressNotifier.class);

    private final DomainEventPublisher eventPublisher;
    private final Executor executor;

    public ProgressNotifier(DomainEventPublisher eventPublisher, Executor executor) {
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public void notify(ProgressEvent event) {
        notify(event, null);
    }

    public void notify(ProgressEvent event, ProgressListeners listeners) {
        switch (event.getLevel()) {
            case INFO -> log.info("[{}] {} {}: {}", event.getScope(), event.getAction(), event.getStep(), event.getMessage());
            case WARN -> log.warn("[{}] {} {}: {}", event.getScope(), event.getAction(), event.getStep(), event.getMessage());
            case ERROR -> log.error("[{}] {} {}: {}", event.getScope(), event.getAction(), event.getStep(), event.getMessage());
        }
        dispatch(event, "eventPublisher", () -> eventPublisher.publish(event));
        if (listeners == null) {
            return;
        }
        for (ProgressListener listener : listeners.snapshot()) {
            dispatch(event, listener.getClass().getSimpleName(), () -> listener.onProgress(event));
        }
    }

    private void dispatch(ProgressEvent event, String subscriber, Runnable delivery) {
        try {
            executor.execute(() -> {
                try {
                    delivery.run();
                } catch (RuntimeException e) {
                    log.warn("进度事件投递失败: subscriber={}, scope={}, error={}", subscriber, event.getScope(), e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("进度事件被拒绝: subscriber={}, scope={}", subscriber, event.getScope());
        }
    }
}
