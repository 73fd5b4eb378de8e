package com.hhplus.ordering.infrastructure.event;

import com.hhplus.ordering.application.integration.IntegrationMessage;
import com.hhplus.ordering.application.integration.MessageHandler;
import com.hhplus.ordering.application.integration.payload.PaymentApprovedPayload;
import com.hhplus.ordering.domain.entity.Order;
import com.hhplus.ordering.domain.event.publisher.EventPublisher;
import com.hhplus.ordering.domain.repository.OrderRepository;
import com.hhplus.ordering.domain.vo.OrderId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 결제 승인 이벤트 핸들러
 *
 * payment.approved 수신 → 주문 결제 완료 처리 → 저장 → 도메인 이벤트 발행
 *
 * 중복 메시지는 Order가 processedPaymentIds로 걸러내므로 여기서는 별도 확인을 하지 않습니다.
 * 주문을 찾을 수 없으면 경고 로그만 남기고 메시지를 버립니다.
 */
@Slf4j
@Component
public class PaymentApprovedEventHandler implements MessageHandler<PaymentApprovedPayload> {

    private final OrderRepository orderRepository;
    private final EventPublisher eventPublisher;

    public PaymentApprovedEventHandler(OrderRepository orderRepository, EventPublisher eventPublisher) {
        this.orderRepository = orderRepository;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void handle(IntegrationMessage<PaymentApprovedPayload> message) {
        PaymentApprovedPayload payload = message.payload();
        OrderId orderId = OrderId.from(payload.orderId());

        log.info("[주문] 결제 승인 수신: orderId={}, paymentId={}, amount={} {}",
                orderId, payload.paymentId(), payload.approvedAmount(), payload.currency());

        Optional<Order> found = orderRepository.findById(orderId);
        if (found.isEmpty()) {
            log.warn("[주문] 결제 승인 대상 주문 없음, 메시지 무시: orderId={}, paymentId={}",
                    orderId, payload.paymentId());
            return;
        }

        Order order = found.get();
        order.markAsPaid(payload.paymentId());
        orderRepository.save(order);
        eventPublisher.publishAll(order.pullDomainEvents());

        log.info("[주문] 결제 완료 반영: orderId={}, status={}", orderId, order.getStatus());
    }
}
