package com.hhplus.ordering.infrastructure.event;

import com.hhplus.ordering.application.integration.IntegrationTopics;
import com.hhplus.ordering.application.integration.MessageBus;
import com.hhplus.ordering.application.integration.payload.OrderCancelledPayload;
import com.hhplus.ordering.application.integration.payload.OrderPaidPayload;
import com.hhplus.ordering.application.integration.payload.OrderPlacedPayload;
import com.hhplus.ordering.domain.entity.OrderItem;
import com.hhplus.ordering.domain.event.DomainEvent;
import com.hhplus.ordering.domain.event.DomainEventType;
import com.hhplus.ordering.domain.event.OrderCancelledEvent;
import com.hhplus.ordering.domain.event.OrderPaidEvent;
import com.hhplus.ordering.domain.event.OrderPlacedEvent;
import com.hhplus.ordering.domain.event.publisher.EventPublisher;
import com.hhplus.ordering.domain.vo.ShippingAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * 도메인 이벤트 → 통합 메시지 발행기
 *
 * 매핑 테이블에 등록된 이벤트만 통합 메시지로 바꿔 버스에 올립니다.
 * 등록되지 않은 이벤트(ORDER_STOCK_RESERVED 등)는 발행하지 않습니다.
 *
 * | 도메인 이벤트     | 토픽             |
 * |------------------|-----------------|
 * | ORDER_PLACED     | order.placed    |
 * | ORDER_PAID       | order.paid      |
 * | ORDER_CANCELLED  | order.cancelled |
 */
@Slf4j
@Component
public class DomainEventPublisher implements EventPublisher {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private final MessageBus messageBus;
    private final Map<DomainEventType, TopicMapping<?>> mappings = new EnumMap<>(DomainEventType.class);

    public DomainEventPublisher(MessageBus messageBus) {
        this.messageBus = messageBus;

        mappings.put(DomainEventType.ORDER_PLACED, new TopicMapping<>(
                IntegrationTopics.ORDER_PLACED, OrderPlacedEvent.class, this::toOrderPlacedPayload));
        mappings.put(DomainEventType.ORDER_PAID, new TopicMapping<>(
                IntegrationTopics.ORDER_PAID, OrderPaidEvent.class, this::toOrderPaidPayload));
        mappings.put(DomainEventType.ORDER_CANCELLED, new TopicMapping<>(
                IntegrationTopics.ORDER_CANCELLED, OrderCancelledEvent.class, this::toOrderCancelledPayload));
    }

    @Override
    public <T extends DomainEvent> void publish(T event) {
        TopicMapping<?> mapping = mappings.get(event.type());
        if (mapping == null) {
            log.debug("[주문] 통합 메시지 대상이 아닌 이벤트: type={}, orderId={}", event.type(), event.orderId());
            return;
        }

        messageBus.publish(mapping.topic(), mapping.toPayload(event));

        log.info("[주문] 도메인 이벤트 발행: type={}, topic={}, orderId={}, eventId={}",
                event.type(), mapping.topic(), event.orderId(), event.eventId());
    }

    public boolean isMapped(DomainEventType type) {
        return mappings.containsKey(type);
    }

    private OrderPlacedPayload toOrderPlacedPayload(OrderPlacedEvent event) {
        ShippingAddress address = event.shippingAddress();
        return new OrderPlacedPayload(
                event.orderId().getValue(),
                event.customerId().getValue(),
                event.cartId().getValue(),
                event.items().stream().map(this::toItem).toList(),
                event.totalAmount().getAmount(),
                event.totalAmount().getCurrency(),
                new OrderPlacedPayload.Address(
                        address.getStreet(),
                        address.getCity(),
                        address.getStateOrProvince(),
                        address.getPostalCode(),
                        address.getCountry()
                ),
                event.occurredAt().format(TIMESTAMP_FORMAT)
        );
    }

    private OrderPlacedPayload.Item toItem(OrderItem item) {
        return new OrderPlacedPayload.Item(
                item.getProductId().getValue(),
                item.getQuantity().getValue(),
                item.getUnitPrice().getAmount()
        );
    }

    private OrderPaidPayload toOrderPaidPayload(OrderPaidEvent event) {
        return new OrderPaidPayload(
                event.orderId().getValue(),
                event.paymentId(),
                event.amount().getAmount(),
                event.amount().getCurrency(),
                event.occurredAt().format(TIMESTAMP_FORMAT)
        );
    }

    private OrderCancelledPayload toOrderCancelledPayload(OrderCancelledEvent event) {
        return new OrderCancelledPayload(
                event.orderId().getValue(),
                event.reason(),
                event.previousStatus().name(),
                event.occurredAt().format(TIMESTAMP_FORMAT)
        );
    }

    private record TopicMapping<E extends DomainEvent>(
        String topic,
        Class<E> eventType,
        Function<E, Object> mapper
    ) {
        Object toPayload(DomainEvent event) {
            return mapper.apply(eventType.cast(event));
        }
    }
}
