package com.hhplus.ordering.application.usecase.order;

import com.hhplus.ordering.application.command.CancelOrderCommand;
import com.hhplus.ordering.domain.entity.Order;
import com.hhplus.ordering.domain.event.publisher.EventPublisher;
import com.hhplus.ordering.domain.exception.OrderNotFoundException;
import com.hhplus.ordering.domain.repository.OrderRepository;
import com.hhplus.ordering.domain.vo.OrderId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 주문 취소 UseCase
 *
 * User Story: "고객이 주문을 취소한다"
 *
 * 취소 이벤트(order.cancelled)에는 취소 직전 상태가 담기며,
 * 결제/재고 컨텍스트는 이 값을 보고 환불과 재고 해제를 진행합니다.
 */
@Slf4j
@Service
public class CancelOrderUseCase {

    private final OrderRepository orderRepository;
    private final EventPublisher eventPublisher;

    public CancelOrderUseCase(OrderRepository orderRepository, EventPublisher eventPublisher) {
        this.orderRepository = orderRepository;
        this.eventPublisher = eventPublisher;
    }

    public Order execute(CancelOrderCommand command) {
        OrderId orderId = OrderId.from(command.orderId());
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        order.cancel(command.reason());
        orderRepository.save(order);
        eventPublisher.publishAll(order.pullDomainEvents());

        log.info("[주문] 주문 취소: orderId={}, reason={}", orderId, command.reason());
        return order;
    }
}
