package xyz.firestige.engine.domain.shared.event;

import java.util.List;

/**
 * 领域事件发布端口
 * <p>
 * 发布是通知行为，实现不得把订阅者的异常抛回调用方。
 */
public interface DomainEventPublisher {

    void publish(Object event);

    default void publishAll(List<?> events) {
        if (events != null) {
            events.forEach(this::publish);
        }
    }
}
