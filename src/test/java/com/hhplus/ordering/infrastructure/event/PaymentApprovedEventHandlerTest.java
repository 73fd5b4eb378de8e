package com.hhplus.ordering.infrastructure.event;

import com.hhplus.ordering.application.integration.IntegrationMessage;
import com.hhplus.ordering.application.integration.IntegrationTopics;
import com.hhplus.ordering.application.integration.payload.PaymentApprovedPayload;
import com.hhplus.ordering.domain.entity.Order;
import com.hhplus.ordering.domain.enums.OrderStatus;
import com.hhplus.ordering.domain.event.DomainEventType;
import com.hhplus.ordering.domain.exception.InvalidOrderStateTransitionException;
import com.hhplus.ordering.domain.vo.OrderId;
import com.hhplus.ordering.infrastructure.memory.InMemoryOrderRepository;
import com.hhplus.ordering.test.fixtures.OrderFixtures;
import com.hhplus.ordering.test.mocks.RecordingEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaymentApprovedEventHandlerTest {

    private InMemoryOrderRepository orderRepository;
    private RecordingEventPublisher eventPublisher;
    private PaymentApprovedEventHandler handler;

    @BeforeEach
    void setUp() {
        orderRepository = new InMemoryOrderRepository();
        eventPublisher = new RecordingEventPublisher();
        handler = new PaymentApprovedEventHandler(orderRepository, eventPublisher);
    }

    private IntegrationMessage<PaymentApprovedPayload> message(OrderId orderId, String paymentId) {
        return new IntegrationMessage<>(UUID.randomUUID().toString(), IntegrationTopics.PAYMENT_APPROVED,
                LocalDateTime.now(),
                new PaymentApprovedPayload(orderId.getValue(), paymentId, new BigDecimal("49.98"), "USD", null),
                orderId.getValue());
    }

    @Test
    @DisplayName("결제 승인을 받으면 주문이 PAID로 저장되고 OrderPaid가 발행된다")
    void handle_MarksOrderPaid() {
        // given
        Order order = OrderFixtures.awaitingPaymentOrder();
        orderRepository.save(order);

        // when
        handler.handle(message(order.getId(), "payment-1"));

        // then
        Order saved = orderRepository.findById(order.getId()).orElseThrow();
        assertThat(saved.getStatus()).isEqualTo(OrderStatus.PAID);
        assertThat(saved.getPaymentId()).isEqualTo("payment-1");
        assertThat(eventPublisher.count(DomainEventType.ORDER_PAID)).isEqualTo(1);
    }

    @Test
    @DisplayName("같은 결제 승인이 두 번 도착해도 OrderPaid는 한 번만 발행된다")
    void handle_DuplicateDelivery_PublishesOnce() {
        // given
        Order order = OrderFixtures.awaitingPaymentOrder();
        orderRepository.save(order);

        // when
        handler.handle(message(order.getId(), "payment-1"));
        handler.handle(message(order.getId(), "payment-1"));

        // then
        assertThat(eventPublisher.count(DomainEventType.ORDER_PAID)).isEqualTo(1);
        assertThat(orderRepository.findById(order.getId()).orElseThrow().getProcessedPaymentIds())
                .containsExactly("payment-1");
    }

    @Test
    @DisplayName("주문이 없으면 경고만 남기고 끝난다")
    void handle_OrderNotFound_Ignored() {
        assertThatCode(() -> handler.handle(message(OrderId.generate(), "payment-1")))
                .doesNotThrowAnyException();
        assertThat(eventPublisher.getPublished()).isEmpty();
    }

    @Test
    @DisplayName("취소된 주문에 결제 승인이 오면 예외가 전파되고 주문은 변하지 않는다")
    void handle_CancelledOrder_Throws() {
        // given
        Order order = OrderFixtures.awaitingPaymentOrder();
        order.cancel("고객 요청");
        order.pullDomainEvents();
        orderRepository.save(order);

        // when & then
        assertThatThrownBy(() -> handler.handle(message(order.getId(), "payment-1")))
                .isInstanceOf(InvalidOrderStateTransitionException.class);

        Order saved = orderRepository.findById(order.getId()).orElseThrow();
        assertThat(saved.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(saved.getPaymentId()).isNull();
        assertThat(eventPublisher.getPublished()).isEmpty();
    }
}
