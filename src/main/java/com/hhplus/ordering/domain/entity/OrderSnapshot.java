package com.hhplus.ordering.domain.entity;

import com.hhplus.ordering.domain.enums.OrderStatus;
import com.hhplus.ordering.domain.vo.CartId;
import com.hhplus.ordering.domain.vo.CustomerId;
import com.hhplus.ordering.domain.vo.Money;
import com.hhplus.ordering.domain.vo.OrderId;
import com.hhplus.ordering.domain.vo.ShippingAddress;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/**
 * 주문 저장용 스냅샷
 *
 * 멱등성 처리 이력(processedPaymentIds, processedReservationIds)도 함께 저장하므로
 * 다시 불러온 주문은 이전에 반영한 결제/예약을 기억합니다.
 */
public record OrderSnapshot(
    OrderId id,
    CartId cartId,
    CustomerId customerId,
    List<OrderItem> items,
    ShippingAddress shippingAddress,
    Money orderLevelDiscount,
    Money totalAmount,
    OrderStatus status,
    String paymentId,
    String cancellationReason,
    Set<String> processedPaymentIds,
    Set<String> processedReservationIds,
    LocalDateTime createdAt
) {
    public OrderSnapshot {
        items = List.copyOf(items);
        processedPaymentIds = Set.copyOf(processedPaymentIds);
        processedReservationIds = Set.copyOf(processedReservationIds);
    }
}
