package com.hhplus.ordering.domain.event.publisher;

import com.hhplus.ordering.domain.event.DomainEvent;

import java.util.List;

/**
 * 이벤트 발행 인터페이스
 *
 * 애그리거트 저장이 끝난 뒤 호출합니다. 구현체는 도메인 이벤트를 통합 메시지로 바꿔
 * 메시지 버스에 올립니다.
 */
public interface EventPublisher {

    /**
     * 도메인 이벤트를 발행합니다.
     *
     * @param event 발행할 도메인 이벤트
     * @param <T> 도메인 이벤트 타입
     */
    <T extends DomainEvent> void publish(T event);

    default void publishAll(List<? extends DomainEvent> events) {
        events.forEach(this::publish);
    }
}
