package com.hhplus.ordering.infrastructure.event;

import com.hhplus.ordering.application.integration.IntegrationMessage;
import com.hhplus.ordering.application.integration.MessageHandler;
import com.hhplus.ordering.application.integration.payload.StockReservedPayload;
import com.hhplus.ordering.domain.entity.Order;
import com.hhplus.ordering.domain.event.publisher.EventPublisher;
import com.hhplus.ordering.domain.repository.OrderRepository;
import com.hhplus.ordering.domain.vo.OrderId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 재고 예약 이벤트 핸들러
 *
 * stock.reserved 수신 → 주문 재고 예약 완료 처리 → 저장 → 도메인 이벤트 발행
 */
@Slf4j
@Component
public class StockReservedEventHandler implements MessageHandler<StockReservedPayload> {

    private final OrderRepository orderRepository;
    private final EventPublisher eventPublisher;

    public StockReservedEventHandler(OrderRepository orderRepository, EventPublisher eventPublisher) {
        this.orderRepository = orderRepository;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void handle(IntegrationMessage<StockReservedPayload> message) {
        StockReservedPayload payload = message.payload();
        OrderId orderId = OrderId.from(payload.orderId());

        log.info("[주문] 재고 예약 수신: orderId={}, reservationId={}, items={}",
                orderId, payload.reservationId(), payload.items().size());

        Optional<Order> found = orderRepository.findById(orderId);
        if (found.isEmpty()) {
            log.warn("[주문] 재고 예약 대상 주문 없음, 메시지 무시: orderId={}, reservationId={}",
                    orderId, payload.reservationId());
            return;
        }

        Order order = found.get();
        order.reserveStock(payload.reservationId());
        orderRepository.save(order);
        eventPublisher.publishAll(order.pullDomainEvents());

        log.info("[주문] 재고 예약 반영: orderId={}, status={}", orderId, order.getStatus());
    }
}
