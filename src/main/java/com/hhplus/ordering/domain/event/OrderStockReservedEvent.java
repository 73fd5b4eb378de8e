package com.hhplus.ordering.domain.event;

import com.hhplus.ordering.domain.vo.OrderId;

import java.time.LocalDateTime;

/**
 * 재고 예약 완료 이벤트
 *
 * 주문 컨텍스트 내부용이며 외부로 발행되는 토픽이 없습니다.
 */
public record OrderStockReservedEvent(
    String eventId,
    OrderId orderId,
    String reservationId,
    LocalDateTime occurredAt
) implements DomainEvent {

    @Override
    public DomainEventType type() {
        return DomainEventType.ORDER_STOCK_RESERVED;
    }
}
