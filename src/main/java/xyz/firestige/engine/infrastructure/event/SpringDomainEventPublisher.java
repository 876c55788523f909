package xyz.firestige.engine.infrastructure.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import xyz.firestige.engine.domain.shared.event.DomainEventPublisher;

/**
 * Spring 本地事件总线实现
 * <p>
 * 订阅者（@EventListener）抛出的异常在这里吸收并记录，不影响发布方。
 */
public class SpringDomainEventPublisher implements DomainEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(SpringDomainEventPublisher.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(Object event) {
        if (event == null) {
            return;
        }
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("事件订阅者处理失败: event={}, error={}", event.getClass().getSimpleName(), e.getMessage(), e);
        }
    }
}
