package xyz.firestige.engine.testutil;

import xyz.firestige.engine.domain.shared.event.DomainEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 记录发布的领域事件
 */
public class RecordingEventPublisher implements DomainEventPublisher {

    private final List<Object> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(Object event) {
        events.add(event);
    }

    public List<Object> getEvents() {
        return List.copyOf(events);
    }

    @SuppressWarnings("unchecked")
    public <T> List<T> getEventsOfType(Class<T> type) {
        return events.stream()
                .filter(type::isInstance)
                .map(e -> (T) e)
                .collect(Collectors.toList());
    }

    public void clear() {
        events.clear();
    }
}
