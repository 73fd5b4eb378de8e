package com.hhplus.ordering.domain.event;

import com.hhplus.ordering.domain.vo.OrderId;

import java.time.LocalDateTime;

/**
 * 도메인 이벤트 공통 인터페이스
 *
 * 애그리거트가 상태를 바꿀 때 내부적으로 쌓아 두며, 저장이 끝난 뒤
 * {@link com.hhplus.ordering.domain.event.publisher.EventPublisher}가 통합 메시지로 변환해 발행합니다.
 */
public interface DomainEvent {

    DomainEventType type();

    String eventId();

    OrderId orderId();

    LocalDateTime occurredAt();
}
