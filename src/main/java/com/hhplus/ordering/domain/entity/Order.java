package com.hhplus.ordering.domain.entity;

import com.hhplus.ordering.domain.enums.OrderStatus;
import com.hhplus.ordering.domain.event.DomainEvent;
import com.hhplus.ordering.domain.event.OrderCancelledEvent;
import com.hhplus.ordering.domain.event.OrderPaidEvent;
import com.hhplus.ordering.domain.event.OrderPlacedEvent;
import com.hhplus.ordering.domain.event.OrderStockReservedEvent;
import com.hhplus.ordering.domain.exception.EmptyOrderException;
import com.hhplus.ordering.domain.exception.InvalidOrderStateTransitionException;
import com.hhplus.ordering.domain.vo.CartId;
import com.hhplus.ordering.domain.vo.CustomerId;
import com.hhplus.ordering.domain.vo.Money;
import com.hhplus.ordering.domain.vo.OrderId;
import com.hhplus.ordering.domain.vo.ShippingAddress;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * 주문 애그리거트 루트
 *
 * 상태 전이: AWAITING_PAYMENT → PAID → STOCK_RESERVED, 그리고 어느 상태에서든 CANCELLED
 *
 * 결제 승인/재고 예약 메시지는 중복되거나 순서가 뒤바뀌어 도착할 수 있습니다.
 * 중복 여부는 핸들러가 아니라 이 애그리거트가 직접 판단합니다.
 * - processedPaymentIds: 이미 반영한 결제 ID (추가만 가능)
 * - processedReservationIds: 이미 반영한 재고 예약 ID (추가만 가능)
 * 같은 ID로 다시 들어온 명령은 아무 것도 하지 않고 성공으로 끝나며, 이벤트도 다시 발생하지 않습니다.
 */
@Slf4j
@Getter
public class Order {

    private final OrderId id;
    private final CartId cartId;
    private final CustomerId customerId;
    private final List<OrderItem> items;
    private final ShippingAddress shippingAddress;
    private final Money orderLevelDiscount;
    private final Money totalAmount;
    private final LocalDateTime createdAt;

    private OrderStatus status;
    private String paymentId;
    private String cancellationReason;

    @Getter(AccessLevel.NONE)
    private final Set<String> processedPaymentIds;

    @Getter(AccessLevel.NONE)
    private final Set<String> processedReservationIds;

    @Getter(AccessLevel.NONE)
    private final List<DomainEvent> domainEvents = new ArrayList<>();

    private Order(OrderId id, CartId cartId, CustomerId customerId, List<OrderItem> items,
                  ShippingAddress shippingAddress, Money orderLevelDiscount, Money totalAmount,
                  OrderStatus status, String paymentId, String cancellationReason,
                  Set<String> processedPaymentIds, Set<String> processedReservationIds,
                  LocalDateTime createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.cartId = Objects.requireNonNull(cartId, "cartId");
        this.customerId = Objects.requireNonNull(customerId, "customerId");
        this.shippingAddress = Objects.requireNonNull(shippingAddress, "shippingAddress");
        this.orderLevelDiscount = Objects.requireNonNull(orderLevelDiscount, "orderLevelDiscount");
        this.totalAmount = Objects.requireNonNull(totalAmount, "totalAmount");
        this.status = Objects.requireNonNull(status, "status");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        if (items == null || items.isEmpty()) {
            throw new EmptyOrderException();
        }
        this.items = List.copyOf(items);
        this.paymentId = paymentId;
        this.cancellationReason = cancellationReason;
        this.processedPaymentIds = new LinkedHashSet<>(processedPaymentIds);
        this.processedReservationIds = new LinkedHashSet<>(processedReservationIds);

        validateCurrency();
        validatePaymentState();
    }

    /**
     * 새 주문 생성 (AWAITING_PAYMENT)
     *
     * @throws EmptyOrderException 주문 항목이 비어 있는 경우
     */
    public static Order create(OrderId id, CartId cartId, CustomerId customerId, List<OrderItem> items,
                               ShippingAddress shippingAddress, Money orderLevelDiscount, Money totalAmount) {
        Order order = new Order(id, cartId, customerId, items, shippingAddress, orderLevelDiscount, totalAmount,
                OrderStatus.AWAITING_PAYMENT, null, null, Set.of(), Set.of(), LocalDateTime.now());

        order.domainEvents.add(new OrderPlacedEvent(
                newEventId(),
                order.id,
                order.customerId,
                order.cartId,
                order.items,
                order.totalAmount,
                order.shippingAddress,
                order.createdAt
        ));
        return order;
    }

    /**
     * 저장된 스냅샷으로부터 주문 복원 (이벤트는 발생하지 않음)
     */
    public static Order reconstitute(OrderSnapshot snapshot) {
        return new Order(snapshot.id(), snapshot.cartId(), snapshot.customerId(), snapshot.items(),
                snapshot.shippingAddress(), snapshot.orderLevelDiscount(), snapshot.totalAmount(),
                snapshot.status(), snapshot.paymentId(), snapshot.cancellationReason(),
                snapshot.processedPaymentIds(), snapshot.processedReservationIds(), snapshot.createdAt());
    }

    public OrderSnapshot toSnapshot() {
        return new OrderSnapshot(id, cartId, customerId, items, shippingAddress, orderLevelDiscount,
                totalAmount, status, paymentId, cancellationReason,
                processedPaymentIds, processedReservationIds, createdAt);
    }

    /**
     * 결제 완료 처리
     *
     * - 이미 반영한 paymentId: 아무 것도 하지 않음
     * - AWAITING_PAYMENT: PAID로 전이, OrderPaidEvent 발생
     * - 그 외(취소됨, 다른 결제로 이미 결제됨): 예외
     *
     * @throws InvalidOrderStateTransitionException 결제를 받을 수 없는 상태인 경우
     */
    public void markAsPaid(String paymentId) {
        requireText(paymentId, "결제 ID");

        if (processedPaymentIds.contains(paymentId)) {
            log.debug("[주문] 이미 처리된 결제 무시: orderId={}, paymentId={}", id, paymentId);
            return;
        }

        if (status == OrderStatus.CANCELLED) {
            throw new InvalidOrderStateTransitionException(status,
                    "취소된 주문은 결제 완료 처리할 수 없습니다: orderId=" + id + ", paymentId=" + paymentId);
        }
        if (status != OrderStatus.AWAITING_PAYMENT) {
            throw new InvalidOrderStateTransitionException(status,
                    "이미 다른 결제로 처리된 주문입니다: orderId=" + id
                            + ", 기존 paymentId=" + this.paymentId + ", 요청 paymentId=" + paymentId);
        }

        this.status = OrderStatus.PAID;
        this.paymentId = paymentId;
        this.processedPaymentIds.add(paymentId);

        domainEvents.add(new OrderPaidEvent(newEventId(), id, paymentId, totalAmount, LocalDateTime.now()));
    }

    /**
     * 재고 예약 완료 처리
     *
     * 결제가 끝난(PAID) 주문에서만 가능합니다. 이미 반영한 reservationId는 무시합니다.
     *
     * @throws InvalidOrderStateTransitionException 결제 전이거나 취소되었거나 다른 예약으로 처리된 경우
     */
    public void reserveStock(String reservationId) {
        requireText(reservationId, "재고 예약 ID");

        if (processedReservationIds.contains(reservationId)) {
            log.debug("[주문] 이미 처리된 재고 예약 무시: orderId={}, reservationId={}", id, reservationId);
            return;
        }

        switch (status) {
            case PAID -> {
                this.status = OrderStatus.STOCK_RESERVED;
                this.processedReservationIds.add(reservationId);
                domainEvents.add(new OrderStockReservedEvent(newEventId(), id, reservationId, LocalDateTime.now()));
            }
            case AWAITING_PAYMENT -> throw new InvalidOrderStateTransitionException(status,
                    "결제 전 주문은 재고를 예약할 수 없습니다: orderId=" + id);
            case CANCELLED -> throw new InvalidOrderStateTransitionException(status,
                    "취소된 주문은 재고를 예약할 수 없습니다: orderId=" + id);
            case STOCK_RESERVED -> throw new InvalidOrderStateTransitionException(status,
                    "이미 다른 예약으로 재고가 확보된 주문입니다: orderId=" + id + ", reservationId=" + reservationId);
        }
    }

    /**
     * 주문 취소
     *
     * 이미 취소된 주문이면 아무 것도 하지 않습니다.
     * 발생하는 OrderCancelledEvent에는 취소 직전 상태가 담깁니다.
     */
    public void cancel(String reason) {
        requireText(reason, "취소 사유");

        if (status == OrderStatus.CANCELLED) {
            log.debug("[주문] 이미 취소된 주문: orderId={}", id);
            return;
        }

        OrderStatus previousStatus = this.status;
        this.status = OrderStatus.CANCELLED;
        this.cancellationReason = reason;

        domainEvents.add(new OrderCancelledEvent(newEventId(), id, reason, previousStatus, LocalDateTime.now()));
    }

    public boolean hasProcessedPayment(String paymentId) {
        return processedPaymentIds.contains(paymentId);
    }

    public boolean hasProcessedReservation(String reservationId) {
        return processedReservationIds.contains(reservationId);
    }

    public Set<String> getProcessedPaymentIds() {
        return Collections.unmodifiableSet(processedPaymentIds);
    }

    public Set<String> getProcessedReservationIds() {
        return Collections.unmodifiableSet(processedReservationIds);
    }

    public String getCurrency() {
        return totalAmount.getCurrency();
    }

    /**
     * 쌓인 도메인 이벤트를 꺼내고 비웁니다. 저장이 끝난 뒤 발행용으로 호출합니다.
     */
    public List<DomainEvent> pullDomainEvents() {
        List<DomainEvent> events = List.copyOf(domainEvents);
        domainEvents.clear();
        return events;
    }

    public List<DomainEvent> peekDomainEvents() {
        return List.copyOf(domainEvents);
    }

    private void validateCurrency() {
        String currency = totalAmount.getCurrency();
        boolean itemsMatch = items.stream().allMatch(item ->
                item.getUnitPrice().getCurrency().equals(currency)
                        && item.getItemDiscount().getCurrency().equals(currency));
        if (!itemsMatch) {
            throw new IllegalArgumentException("모든 주문 항목은 주문 총액과 같은 통화여야 합니다: " + currency);
        }
        if (!orderLevelDiscount.getCurrency().equals(currency)) {
            throw new IllegalArgumentException("주문 할인 금액은 주문 총액과 같은 통화여야 합니다: " + currency);
        }
    }

    // paymentId는 PAID 이후 단계(또는 결제 후 취소)에서만 존재
    private void validatePaymentState() {
        if (status.isPaidOrLater() && paymentId == null) {
            throw new IllegalStateException("결제 완료 이후 상태의 주문에는 결제 ID가 있어야 합니다: orderId=" + id);
        }
        if (status == OrderStatus.AWAITING_PAYMENT && paymentId != null) {
            throw new IllegalStateException("결제 대기 주문에는 결제 ID가 있을 수 없습니다: orderId=" + id);
        }
        if (paymentId != null && !processedPaymentIds.contains(paymentId)) {
            throw new IllegalStateException("결제 ID가 처리 이력에 없습니다: orderId=" + id + ", paymentId=" + paymentId);
        }
    }

    private static void requireText(String value, String label) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(label + "은(는) 비어 있을 수 없습니다.");
        }
    }

    private static String newEventId() {
        return UUID.randomUUID().toString();
    }
}
