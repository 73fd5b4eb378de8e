package com.hhplus.ordering.infrastructure.consumer;

import com.hhplus.ordering.application.integration.IntegrationMessage;
import com.hhplus.ordering.application.integration.IntegrationTopics;
import com.hhplus.ordering.application.integration.MessageBus;
import com.hhplus.ordering.application.integration.payload.OrderCancelledPayload;
import com.hhplus.ordering.application.integration.payload.OrderPlacedPayload;
import com.hhplus.ordering.application.integration.payload.PaymentApprovedPayload;
import com.hhplus.ordering.config.properties.OrderingProperties;
import com.hhplus.ordering.domain.enums.OrderStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 결제 컨텍스트 (시뮬레이션)
 *
 * - order.placed: 일정 시간 후 결제를 승인하고 payment.approved 발행
 * - order.cancelled: 결제가 끝난 주문(PAID, STOCK_RESERVED)이면 환불 처리
 *
 * 주문 컨텍스트와는 통합 메시지로만 통신합니다.
 * 승인/환불 이력은 시뮬레이션용 메모리 상태이며 지우지 않으므로 처리한 주문 수만큼 계속 늘어납니다.
 */
@Slf4j
@Component
public class PaymentsConsumer {

    private final MessageBus messageBus;
    private final OrderingProperties properties;

    private final Map<String, String> approvedPayments = new ConcurrentHashMap<>();
    private final Set<String> refundedOrderIds = ConcurrentHashMap.newKeySet();

    public PaymentsConsumer(MessageBus messageBus, OrderingProperties properties) {
        this.messageBus = messageBus;
        this.properties = properties;
    }

    public void handleOrderPlaced(IntegrationMessage<OrderPlacedPayload> message) throws InterruptedException {
        OrderPlacedPayload order = message.payload();
        log.info("[결제] 주문 수신, 결제 진행: orderId={}, amount={} {}",
                order.orderId(), order.totalAmount(), order.currency());

        Thread.sleep(properties.getSimulation().getPaymentDelayMillis());

        String paymentId = "payment-" + UUID.randomUUID();
        approvedPayments.put(order.orderId(), paymentId);

        messageBus.publish(IntegrationTopics.PAYMENT_APPROVED, new PaymentApprovedPayload(
                order.orderId(),
                paymentId,
                order.totalAmount(),
                order.currency(),
                LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
        ));

        log.info("[결제] 결제 승인: orderId={}, paymentId={}", order.orderId(), paymentId);
    }

    public void handleOrderCancelled(IntegrationMessage<OrderCancelledPayload> message) {
        OrderCancelledPayload cancelled = message.payload();
        OrderStatus previousStatus = OrderStatus.valueOf(cancelled.previousStatus());

        if (!previousStatus.isPaidOrLater()) {
            log.info("[결제] 결제 전 취소, 환불 불필요: orderId={}, previousStatus={}",
                    cancelled.orderId(), previousStatus);
            return;
        }

        if (!refundedOrderIds.add(cancelled.orderId())) {
            log.info("[결제] 이미 환불된 주문: orderId={}", cancelled.orderId());
            return;
        }

        log.info("[결제] 환불 처리: orderId={}, paymentId={}, reason={}",
                cancelled.orderId(), approvedPayments.get(cancelled.orderId()), cancelled.reason());
    }

    public Optional<String> findApprovedPaymentId(String orderId) {
        return Optional.ofNullable(approvedPayments.get(orderId));
    }

    public boolean isRefunded(String orderId) {
        return refundedOrderIds.contains(orderId);
    }
}
