package com.hhplus.ordering.domain.event;

import com.hhplus.ordering.domain.vo.Money;
import com.hhplus.ordering.domain.vo.OrderId;

import java.time.LocalDateTime;

/**
 * 결제 완료 이벤트
 */
public record OrderPaidEvent(
    String eventId,
    OrderId orderId,
    String paymentId,
    Money amount,
    LocalDateTime occurredAt
) implements DomainEvent {

    @Override
    public DomainEventType type() {
        return DomainEventType.ORDER_PAID;
    }
}
