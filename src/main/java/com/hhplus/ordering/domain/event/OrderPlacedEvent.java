package com.hhplus.ordering.domain.event;

import com.hhplus.ordering.domain.entity.OrderItem;
import com.hhplus.ordering.domain.vo.CartId;
import com.hhplus.ordering.domain.vo.CustomerId;
import com.hhplus.ordering.domain.vo.Money;
import com.hhplus.ordering.domain.vo.OrderId;
import com.hhplus.ordering.domain.vo.ShippingAddress;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 생성 이벤트
 *
 * 결제 컨텍스트가 이 이벤트(order.placed)를 받아 결제를 진행합니다.
 */
public record OrderPlacedEvent(
    String eventId,
    OrderId orderId,
    CustomerId customerId,
    CartId cartId,
    List<OrderItem> items,
    Money totalAmount,
    ShippingAddress shippingAddress,
    LocalDateTime occurredAt
) implements DomainEvent {

    public OrderPlacedEvent {
        items = List.copyOf(items);
    }

    @Override
    public DomainEventType type() {
        return DomainEventType.ORDER_PLACED;
    }
}
