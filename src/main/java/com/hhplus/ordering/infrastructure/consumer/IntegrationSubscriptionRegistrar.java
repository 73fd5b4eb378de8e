package com.hhplus.ordering.infrastructure.consumer;

import com.hhplus.ordering.application.integration.IntegrationTopics;
import com.hhplus.ordering.application.integration.MessageBus;
import com.hhplus.ordering.application.integration.payload.OrderCancelledPayload;
import com.hhplus.ordering.application.integration.payload.OrderPaidPayload;
import com.hhplus.ordering.application.integration.payload.OrderPlacedPayload;
import com.hhplus.ordering.application.integration.payload.PaymentApprovedPayload;
import com.hhplus.ordering.application.integration.payload.StockReservedPayload;
import com.hhplus.ordering.config.properties.OrderingProperties;
import com.hhplus.ordering.infrastructure.event.PaymentApprovedEventHandler;
import com.hhplus.ordering.infrastructure.event.StockReservedEventHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

/**
 * 토픽 구독 등록
 *
 * 모든 빈이 만들어진 뒤 한 번 구독을 등록합니다.
 *
 * | 토픽              | 구독자                                     |
 * |------------------|-------------------------------------------|
 * | order.placed     | 결제(승인), 재고(상품 기록)                   |
 * | order.paid       | 재고(예약)                                  |
 * | order.cancelled  | 결제(환불), 재고(예약 해제)                   |
 * | payment.approved | 주문(PaymentApprovedEventHandler)          |
 * | stock.reserved   | 주문(StockReservedEventHandler)            |
 *
 * ordering.simulation.automatic-payment=false이면 결제 컨텍스트의 order.placed 구독을 등록하지 않습니다.
 * 이때 결제는 ConfirmPaymentUseCase로만 확정됩니다.
 */
@Slf4j
@Component
public class IntegrationSubscriptionRegistrar implements SmartInitializingSingleton {

    private final MessageBus messageBus;
    private final PaymentsConsumer paymentsConsumer;
    private final InventoryConsumer inventoryConsumer;
    private final PaymentApprovedEventHandler paymentApprovedEventHandler;
    private final StockReservedEventHandler stockReservedEventHandler;
    private final OrderingProperties properties;

    public IntegrationSubscriptionRegistrar(MessageBus messageBus,
                                            PaymentsConsumer paymentsConsumer,
                                            InventoryConsumer inventoryConsumer,
                                            PaymentApprovedEventHandler paymentApprovedEventHandler,
                                            StockReservedEventHandler stockReservedEventHandler,
                                            OrderingProperties properties) {
        this.messageBus = messageBus;
        this.paymentsConsumer = paymentsConsumer;
        this.inventoryConsumer = inventoryConsumer;
        this.paymentApprovedEventHandler = paymentApprovedEventHandler;
        this.stockReservedEventHandler = stockReservedEventHandler;
        this.properties = properties;
    }

    @Override
    public void afterSingletonsInstantiated() {
        // 결제 컨텍스트
        if (properties.getSimulation().isAutomaticPayment()) {
            messageBus.subscribe(IntegrationTopics.ORDER_PLACED, OrderPlacedPayload.class, paymentsConsumer::handleOrderPlaced);
        } else {
            log.info("[결제] 자동 결제 비활성화, 수동 결제 확정만 사용");
        }
        messageBus.subscribe(IntegrationTopics.ORDER_CANCELLED, OrderCancelledPayload.class, paymentsConsumer::handleOrderCancelled);

        // 재고 컨텍스트
        messageBus.subscribe(IntegrationTopics.ORDER_PLACED, OrderPlacedPayload.class, inventoryConsumer::handleOrderPlaced);
        messageBus.subscribe(IntegrationTopics.ORDER_PAID, OrderPaidPayload.class, inventoryConsumer::handleOrderPaid);
        messageBus.subscribe(IntegrationTopics.ORDER_CANCELLED, OrderCancelledPayload.class, inventoryConsumer::handleOrderCancelled);

        // 주문 컨텍스트
        messageBus.subscribe(IntegrationTopics.PAYMENT_APPROVED, PaymentApprovedPayload.class, paymentApprovedEventHandler);
        messageBus.subscribe(IntegrationTopics.STOCK_RESERVED, StockReservedPayload.class, stockReservedEventHandler);

        log.info("[메시지버스] 통합 메시지 구독 등록 완료");
    }
}
