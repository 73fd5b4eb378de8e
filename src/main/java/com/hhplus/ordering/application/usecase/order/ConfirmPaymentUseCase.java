package com.hhplus.ordering.application.usecase.order;

import com.hhplus.ordering.application.command.ConfirmPaymentCommand;
import com.hhplus.ordering.domain.entity.Order;
import com.hhplus.ordering.domain.event.publisher.EventPublisher;
import com.hhplus.ordering.domain.exception.OrderNotFoundException;
import com.hhplus.ordering.domain.exception.PaymentDeclinedException;
import com.hhplus.ordering.domain.gateway.PaymentGateway;
import com.hhplus.ordering.domain.gateway.PaymentGateway.PaymentResult;
import com.hhplus.ordering.domain.repository.OrderRepository;
import com.hhplus.ordering.domain.vo.OrderId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 수동 결제 확정 UseCase
 *
 * User Story: "고객이 주문 금액을 직접 결제한다"
 *
 * 자동 결제(order.placed 구독)를 끈 환경에서 결제 게이트웨이를 직접 호출합니다.
 * 승인되면 자동 결제와 같은 markAsPaid 경로를 타므로 order.paid 이후 흐름은 동일합니다.
 */
@Slf4j
@Service
public class ConfirmPaymentUseCase {

    private final OrderRepository orderRepository;
    private final PaymentGateway paymentGateway;
    private final EventPublisher eventPublisher;

    public ConfirmPaymentUseCase(OrderRepository orderRepository,
                                 PaymentGateway paymentGateway,
                                 EventPublisher eventPublisher) {
        this.orderRepository = orderRepository;
        this.paymentGateway = paymentGateway;
        this.eventPublisher = eventPublisher;
    }

    /**
     * @throws OrderNotFoundException 주문이 없는 경우
     * @throws PaymentDeclinedException 결제가 거절된 경우 (주문은 그대로 AWAITING_PAYMENT)
     * @throws com.hhplus.ordering.domain.exception.InvalidOrderStateTransitionException 결제를 받을 수 없는 상태인 경우
     */
    public Order execute(ConfirmPaymentCommand command) {
        OrderId orderId = OrderId.from(command.orderId());
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        PaymentResult result = paymentGateway.processPayment(order.getId(), order.getTotalAmount());
        if (!result.success()) {
            log.warn("[결제] 결제 거절: orderId={}, amount={}, reason={}",
                    orderId, order.getTotalAmount(), result.reason());
            throw new PaymentDeclinedException(result.reason());
        }

        order.markAsPaid(result.paymentId());
        orderRepository.save(order);
        eventPublisher.publishAll(order.pullDomainEvents());

        log.info("[결제] 수동 결제 확정: orderId={}, paymentId={}", orderId, result.paymentId());
        return order;
    }
}
