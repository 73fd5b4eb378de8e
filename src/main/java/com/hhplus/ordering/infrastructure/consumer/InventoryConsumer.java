package com.hhplus.ordering.infrastructure.consumer;

import com.hhplus.ordering.application.integration.IntegrationMessage;
import com.hhplus.ordering.application.integration.IntegrationTopics;
import com.hhplus.ordering.application.integration.MessageBus;
import com.hhplus.ordering.application.integration.payload.OrderCancelledPayload;
import com.hhplus.ordering.application.integration.payload.OrderPaidPayload;
import com.hhplus.ordering.application.integration.payload.OrderPlacedPayload;
import com.hhplus.ordering.application.integration.payload.StockReservedPayload;
import com.hhplus.ordering.application.integration.payload.StockReservedPayload.StockItem;
import com.hhplus.ordering.config.properties.OrderingProperties;
import com.hhplus.ordering.domain.enums.OrderStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 재고 컨텍스트 (시뮬레이션)
 *
 * - order.placed: 주문 상품 목록을 기억
 * - order.paid: 일정 시간 후 재고를 예약하고 stock.reserved 발행
 * - order.cancelled: 재고가 예약된 주문(STOCK_RESERVED)이면 예약 해제
 *
 * 주문 상품 기록은 예약하거나 취소되면 지웁니다. 예약/해제 이력은 시뮬레이션용이라 지우지 않으므로
 * 처리한 주문 수만큼 계속 늘어납니다.
 */
@Slf4j
@Component
public class InventoryConsumer {

    private final MessageBus messageBus;
    private final OrderingProperties properties;

    private final Map<String, List<StockItem>> orderedItems = new ConcurrentHashMap<>();
    private final Map<String, String> reservations = new ConcurrentHashMap<>();
    private final Set<String> releasedOrderIds = ConcurrentHashMap.newKeySet();

    public InventoryConsumer(MessageBus messageBus, OrderingProperties properties) {
        this.messageBus = messageBus;
        this.properties = properties;
    }

    public void handleOrderPlaced(IntegrationMessage<OrderPlacedPayload> message) {
        OrderPlacedPayload order = message.payload();
        List<StockItem> items = order.items().stream()
                .map(item -> new StockItem(item.productId(), item.quantity()))
                .toList();
        orderedItems.put(order.orderId(), items);

        log.debug("[재고] 주문 상품 기록: orderId={}, items={}", order.orderId(), items.size());
    }

    public void handleOrderPaid(IntegrationMessage<OrderPaidPayload> message) throws InterruptedException {
        OrderPaidPayload paid = message.payload();
        List<StockItem> items = orderedItems.getOrDefault(paid.orderId(), List.of());
        if (items.isEmpty()) {
            log.warn("[재고] 주문 상품 정보 없음, 빈 목록으로 예약: orderId={}", paid.orderId());
        }

        Thread.sleep(properties.getSimulation().getStockDelayMillis());

        String reservationId = "reservation-" + UUID.randomUUID();
        reservations.put(paid.orderId(), reservationId);

        messageBus.publish(IntegrationTopics.STOCK_RESERVED, new StockReservedPayload(
                paid.orderId(),
                reservationId,
                items,
                LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
        ));

        orderedItems.remove(paid.orderId());

        log.info("[재고] 재고 예약: orderId={}, reservationId={}, items={}", paid.orderId(), reservationId, items.size());
    }

    public void handleOrderCancelled(IntegrationMessage<OrderCancelledPayload> message) {
        OrderCancelledPayload cancelled = message.payload();
        OrderStatus previousStatus = OrderStatus.valueOf(cancelled.previousStatus());
        orderedItems.remove(cancelled.orderId());

        if (previousStatus != OrderStatus.STOCK_RESERVED) {
            log.info("[재고] 예약된 재고 없음, 해제 불필요: orderId={}, previousStatus={}",
                    cancelled.orderId(), previousStatus);
            return;
        }

        String reservationId = reservations.remove(cancelled.orderId());
        releasedOrderIds.add(cancelled.orderId());

        log.info("[재고] 재고 예약 해제: orderId={}, reservationId={}, reason={}",
                cancelled.orderId(), reservationId, cancelled.reason());
    }

    public Optional<String> findReservationId(String orderId) {
        return Optional.ofNullable(reservations.get(orderId));
    }

    public boolean hasOrderedItems(String orderId) {
        return orderedItems.containsKey(orderId);
    }

    public boolean isReleased(String orderId) {
        return releasedOrderIds.contains(orderId);
    }
}
