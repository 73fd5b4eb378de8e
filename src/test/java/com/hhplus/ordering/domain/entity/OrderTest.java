package com.hhplus.ordering.domain.entity;

import com.hhplus.ordering.domain.enums.OrderStatus;
import com.hhplus.ordering.domain.event.DomainEvent;
import com.hhplus.ordering.domain.event.DomainEventType;
import com.hhplus.ordering.domain.event.OrderCancelledEvent;
import com.hhplus.ordering.domain.event.OrderPaidEvent;
import com.hhplus.ordering.domain.event.OrderPlacedEvent;
import com.hhplus.ordering.domain.exception.EmptyOrderException;
import com.hhplus.ordering.domain.exception.InvalidOrderStateTransitionException;
import com.hhplus.ordering.domain.vo.CartId;
import com.hhplus.ordering.domain.vo.CustomerId;
import com.hhplus.ordering.domain.vo.Money;
import com.hhplus.ordering.domain.vo.OrderId;
import com.hhplus.ordering.test.fixtures.OrderFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderTest {

    @Test
    @DisplayName("새 주문은 AWAITING_PAYMENT 상태이고 OrderPlacedEvent가 쌓인다")
    void create_AwaitingPaymentWithPlacedEvent() {
        // given
        OrderId orderId = OrderId.generate();
        CartId cartId = CartId.generate();

        // when
        Order order = Order.create(orderId, cartId, CustomerId.of("customer-1"),
                List.of(OrderFixtures.coffeeItem(2)), OrderFixtures.shippingAddress(),
                Money.zero("USD"), Money.of("49.98", "USD"));

        // then
        assertThat(order.getStatus()).isEqualTo(OrderStatus.AWAITING_PAYMENT);
        assertThat(order.getPaymentId()).isNull();
        assertThat(order.getProcessedPaymentIds()).isEmpty();
        assertThat(order.getProcessedReservationIds()).isEmpty();

        List<DomainEvent> events = order.pullDomainEvents();
        assertThat(events).hasSize(1);
        OrderPlacedEvent placed = (OrderPlacedEvent) events.get(0);
        assertThat(placed.type()).isEqualTo(DomainEventType.ORDER_PLACED);
        assertThat(placed.orderId()).isEqualTo(orderId);
        assertThat(placed.cartId()).isEqualTo(cartId);
        assertThat(placed.totalAmount()).isEqualTo(Money.of("49.98", "USD"));
        assertThat(placed.items()).hasSize(1);
    }

    @Test
    @DisplayName("주문 항목이 비어 있으면 생성할 수 없다")
    void create_EmptyItems_Throws() {
        assertThatThrownBy(() -> Order.create(OrderId.generate(), CartId.generate(), CustomerId.of("customer-1"),
                List.of(), OrderFixtures.shippingAddress(), Money.zero("USD"), Money.zero("USD")))
                .isInstanceOf(EmptyOrderException.class);
    }

    @Test
    @DisplayName("주문 총액과 항목의 통화가 다르면 생성할 수 없다")
    void create_CurrencyMismatch_Throws() {
        assertThatThrownBy(() -> Order.create(OrderId.generate(), CartId.generate(), CustomerId.of("customer-1"),
                List.of(OrderFixtures.coffeeItem(1)), OrderFixtures.shippingAddress(),
                Money.zero("EUR"), Money.of("24.99", "EUR")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("pullDomainEvents는 이벤트를 꺼낸 뒤 비운다")
    void pullDomainEvents_ClearsEvents() {
        Order order = Order.create(OrderId.generate(), CartId.generate(), CustomerId.of("customer-1"),
                List.of(OrderFixtures.coffeeItem(1)), OrderFixtures.shippingAddress(),
                Money.zero("USD"), Money.of("24.99", "USD"));

        assertThat(order.pullDomainEvents()).hasSize(1);
        assertThat(order.pullDomainEvents()).isEmpty();
    }

    @Test
    @DisplayName("결제 대기 주문은 PAID로 전이되고 OrderPaidEvent가 발생한다")
    void markAsPaid_FromAwaitingPayment() {
        // given
        Order order = OrderFixtures.awaitingPaymentOrder();

        // when
        order.markAsPaid("payment-1");

        // then
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PAID);
        assertThat(order.getPaymentId()).isEqualTo("payment-1");
        assertThat(order.hasProcessedPayment("payment-1")).isTrue();

        List<DomainEvent> events = order.pullDomainEvents();
        assertThat(events).hasSize(1);
        OrderPaidEvent paid = (OrderPaidEvent) events.get(0);
        assertThat(paid.paymentId()).isEqualTo("payment-1");
        assertThat(paid.amount()).isEqualTo(order.getTotalAmount());
    }

    @Test
    @DisplayName("같은 paymentId로 다시 처리하면 아무 일도 일어나지 않는다")
    void markAsPaid_SamePaymentTwice_NoOp() {
        // given
        Order order = OrderFixtures.paidOrder("payment-1");

        // when
        order.markAsPaid("payment-1");

        // then
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PAID);
        assertThat(order.getProcessedPaymentIds()).containsExactly("payment-1");
        assertThat(order.pullDomainEvents()).isEmpty();
    }

    @Test
    @DisplayName("재고 예약 이후에 같은 결제가 다시 들어와도 상태가 되돌아가지 않는다")
    void markAsPaid_ReplayAfterStockReserved_NoOp() {
        // given
        Order order = OrderFixtures.paidOrder("payment-1");
        order.reserveStock("reservation-1");
        order.pullDomainEvents();

        // when
        order.markAsPaid("payment-1");

        // then
        assertThat(order.getStatus()).isEqualTo(OrderStatus.STOCK_RESERVED);
        assertThat(order.pullDomainEvents()).isEmpty();
    }

    @Test
    @DisplayName("다른 paymentId로 이미 결제된 주문은 예외가 발생하고 상태는 그대로다")
    void markAsPaid_DifferentPayment_Throws() {
        // given
        Order order = OrderFixtures.paidOrder("payment-1");

        // when & then
        assertThatThrownBy(() -> order.markAsPaid("payment-2"))
                .isInstanceOf(InvalidOrderStateTransitionException.class)
                .satisfies(e -> assertThat(((InvalidOrderStateTransitionException) e).getCurrentStatus())
                        .isEqualTo(OrderStatus.PAID));

        assertThat(order.getPaymentId()).isEqualTo("payment-1");
        assertThat(order.hasProcessedPayment("payment-2")).isFalse();
    }

    @Test
    @DisplayName("취소된 주문은 결제 완료 처리할 수 없다")
    void markAsPaid_Cancelled_Throws() {
        // given
        Order order = OrderFixtures.awaitingPaymentOrder();
        order.cancel("고객 요청");

        // when & then
        assertThatThrownBy(() -> order.markAsPaid("payment-1"))
                .isInstanceOf(InvalidOrderStateTransitionException.class);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(order.getPaymentId()).isNull();
    }

    @Test
    @DisplayName("빈 paymentId는 허용되지 않는다")
    void markAsPaid_Blank_Throws() {
        Order order = OrderFixtures.awaitingPaymentOrder();

        assertThatThrownBy(() -> order.markAsPaid(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.AWAITING_PAYMENT);
    }

    @Test
    @DisplayName("결제 완료 주문은 STOCK_RESERVED로 전이된다")
    void reserveStock_FromPaid() {
        // given
        Order order = OrderFixtures.paidOrder("payment-1");

        // when
        order.reserveStock("reservation-1");

        // then
        assertThat(order.getStatus()).isEqualTo(OrderStatus.STOCK_RESERVED);
        assertThat(order.hasProcessedReservation("reservation-1")).isTrue();
        assertThat(order.pullDomainEvents())
                .extracting(DomainEvent::type)
                .containsExactly(DomainEventType.ORDER_STOCK_RESERVED);
    }

    @Test
    @DisplayName("결제 전 주문은 재고를 예약할 수 없고, 이력도 남지 않는다")
    void reserveStock_BeforePayment_Throws() {
        // given
        Order order = OrderFixtures.awaitingPaymentOrder();

        // when & then
        assertThatThrownBy(() -> order.reserveStock("reservation-1"))
                .isInstanceOf(InvalidOrderStateTransitionException.class);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.AWAITING_PAYMENT);
        assertThat(order.getProcessedReservationIds()).isEmpty();
    }

    @Test
    @DisplayName("같은 reservationId로 다시 처리하면 아무 일도 일어나지 않는다")
    void reserveStock_SameReservationTwice_NoOp() {
        // given
        Order order = OrderFixtures.paidOrder("payment-1");
        order.reserveStock("reservation-1");
        order.pullDomainEvents();

        // when
        order.reserveStock("reservation-1");

        // then
        assertThat(order.getStatus()).isEqualTo(OrderStatus.STOCK_RESERVED);
        assertThat(order.getProcessedReservationIds()).containsExactly("reservation-1");
        assertThat(order.pullDomainEvents()).isEmpty();
    }

    @Test
    @DisplayName("다른 reservationId로 이미 예약된 주문은 예외가 발생한다")
    void reserveStock_DifferentReservation_Throws() {
        Order order = OrderFixtures.paidOrder("payment-1");
        order.reserveStock("reservation-1");

        assertThatThrownBy(() -> order.reserveStock("reservation-2"))
                .isInstanceOf(InvalidOrderStateTransitionException.class);
        assertThat(order.getProcessedReservationIds()).containsExactly("reservation-1");
    }

    @Test
    @DisplayName("취소된 주문은 재고를 예약할 수 없다")
    void reserveStock_Cancelled_Throws() {
        Order order = OrderFixtures.paidOrder("payment-1");
        order.cancel("고객 요청");

        assertThatThrownBy(() -> order.reserveStock("reservation-1"))
                .isInstanceOf(InvalidOrderStateTransitionException.class);
    }

    @Test
    @DisplayName("결제 전 취소: CANCELLED, paymentId 없음, 이벤트에 이전 상태가 담긴다")
    void cancel_BeforePayment() {
        // given
        Order order = OrderFixtures.awaitingPaymentOrder();

        // when
        order.cancel("고객 요청");

        // then
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(order.getPaymentId()).isNull();
        assertThat(order.getCancellationReason()).isEqualTo("고객 요청");

        OrderCancelledEvent cancelled = (OrderCancelledEvent) order.pullDomainEvents().get(0);
        assertThat(cancelled.previousStatus()).isEqualTo(OrderStatus.AWAITING_PAYMENT);
        assertThat(cancelled.reason()).isEqualTo("고객 요청");
    }

    @Test
    @DisplayName("재고 예약 후 취소: 이전 상태 STOCK_RESERVED, 결제/예약 이력은 유지된다")
    void cancel_AfterStockReserved() {
        // given
        Order order = OrderFixtures.paidOrder("payment-1");
        order.reserveStock("reservation-1");
        order.pullDomainEvents();

        // when
        order.cancel("배송 불가 지역");

        // then
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(order.getPaymentId()).isEqualTo("payment-1");
        assertThat(order.getProcessedReservationIds()).containsExactly("reservation-1");

        OrderCancelledEvent cancelled = (OrderCancelledEvent) order.pullDomainEvents().get(0);
        assertThat(cancelled.previousStatus()).isEqualTo(OrderStatus.STOCK_RESERVED);
    }

    @Test
    @DisplayName("이미 취소된 주문을 다시 취소하면 아무 일도 일어나지 않는다")
    void cancel_Twice_NoOp() {
        Order order = OrderFixtures.awaitingPaymentOrder();
        order.cancel("고객 요청");
        order.pullDomainEvents();

        order.cancel("다른 사유");

        assertThat(order.getCancellationReason()).isEqualTo("고객 요청");
        assertThat(order.pullDomainEvents()).isEmpty();
    }

    @Test
    @DisplayName("취소 사유가 비어 있으면 상태 확인 전에 거부된다")
    void cancel_BlankReason_Throws() {
        Order order = OrderFixtures.awaitingPaymentOrder();

        assertThatThrownBy(() -> order.cancel(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.AWAITING_PAYMENT);
    }

    @Test
    @DisplayName("스냅샷으로 복원한 주문은 멱등성 이력을 유지하고 이벤트는 없다")
    void reconstitute_KeepsLedgers() {
        // given
        Order order = OrderFixtures.paidOrder("payment-1");
        order.reserveStock("reservation-1");

        // when
        Order restored = Order.reconstitute(order.toSnapshot());

        // then
        assertThat(restored.getStatus()).isEqualTo(OrderStatus.STOCK_RESERVED);
        assertThat(restored.getPaymentId()).isEqualTo("payment-1");
        assertThat(restored.getProcessedPaymentIds()).containsExactly("payment-1");
        assertThat(restored.getProcessedReservationIds()).containsExactly("reservation-1");
        assertThat(restored.peekDomainEvents()).isEmpty();

        // 복원한 주문도 같은 결제 재전달을 무시한다
        restored.markAsPaid("payment-1");
        assertThat(restored.pullDomainEvents()).isEmpty();
    }
}
