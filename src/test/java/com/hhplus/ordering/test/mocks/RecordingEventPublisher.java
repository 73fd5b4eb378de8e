package com.hhplus.ordering.test.mocks;

import com.hhplus.ordering.domain.event.DomainEvent;
import com.hhplus.ordering.domain.event.DomainEventType;
import com.hhplus.ordering.domain.event.publisher.EventPublisher;

import java.util.ArrayList;
import java.util.List;

/**
 * 발행된 도메인 이벤트를 기록만 하는 EventPublisher
 */
public class RecordingEventPublisher implements EventPublisher {

    private final List<DomainEvent> published = new ArrayList<>();

    @Override
    public synchronized <T extends DomainEvent> void publish(T event) {
        published.add(event);
    }

    public synchronized List<DomainEvent> getPublished() {
        return List.copyOf(published);
    }

    public synchronized long count(DomainEventType type) {
        return published.stream().filter(event -> event.type() == type).count();
    }
}
