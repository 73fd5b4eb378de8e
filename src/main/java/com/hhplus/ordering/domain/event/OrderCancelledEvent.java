package com.hhplus.ordering.domain.event;

import com.hhplus.ordering.domain.enums.OrderStatus;
import com.hhplus.ordering.domain.vo.OrderId;

import java.time.LocalDateTime;

/**
 * 주문 취소 이벤트
 *
 * 취소 직전 상태(previousStatus)를 함께 실어 보내므로, 결제/재고 컨텍스트는
 * 주문을 다시 조회하지 않고도 환불이나 재고 해제가 필요한지 판단할 수 있습니다.
 */
public record OrderCancelledEvent(
    String eventId,
    OrderId orderId,
    String reason,
    OrderStatus previousStatus,
    LocalDateTime occurredAt
) implements DomainEvent {

    @Override
    public DomainEventType type() {
        return DomainEventType.ORDER_CANCELLED;
    }
}
