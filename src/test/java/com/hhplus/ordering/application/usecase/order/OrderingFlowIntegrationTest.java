package com.hhplus.ordering.application.usecase.order;

import com.hhplus.ordering.BaseIntegrationTest;
import com.hhplus.ordering.application.command.AddToCartCommand;
import com.hhplus.ordering.application.command.CancelOrderCommand;
import com.hhplus.ordering.application.command.CheckoutCommand;
import com.hhplus.ordering.application.command.CreateCartCommand;
import com.hhplus.ordering.application.command.ShippingAddressCommand;
import com.hhplus.ordering.application.query.GetOrderQuery;
import com.hhplus.ordering.application.usecase.cart.AddToCartUseCase;
import com.hhplus.ordering.application.usecase.cart.CreateCartUseCase;
import com.hhplus.ordering.domain.entity.Order;
import com.hhplus.ordering.domain.enums.OrderStatus;
import com.hhplus.ordering.domain.exception.OrderNotFoundException;
import com.hhplus.ordering.domain.vo.Money;
import com.hhplus.ordering.domain.vo.OrderId;
import com.hhplus.ordering.infrastructure.consumer.InventoryConsumer;
import com.hhplus.ordering.infrastructure.consumer.PaymentsConsumer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * 주문 처리 전체 흐름 통합 테스트
 *
 * 장바구니 → 주문 → (비동기) 결제 승인 → 재고 예약까지 실제 스프링 컨텍스트에서 검증합니다.
 */
class OrderingFlowIntegrationTest extends BaseIntegrationTest {

    private static final ShippingAddressCommand ADDRESS =
            new ShippingAddressCommand("123 Main St", "Apt 4", "Springfield", "IL", "62701", "US", null);

    @Autowired
    private CreateCartUseCase createCartUseCase;

    @Autowired
    private AddToCartUseCase addToCartUseCase;

    @Autowired
    private CheckoutUseCase checkoutUseCase;

    @Autowired
    private GetOrderUseCase getOrderUseCase;

    @Autowired
    private CancelOrderUseCase cancelOrderUseCase;

    @Autowired
    private PaymentsConsumer paymentsConsumer;

    @Autowired
    private InventoryConsumer inventoryConsumer;

    private Order placeOrder() {
        String cartId = createCartUseCase.execute(new CreateCartCommand("customer-1")).getValue();
        addToCartUseCase.execute(new AddToCartCommand(cartId, "COFFEE-COL-001", 3));
        addToCartUseCase.execute(new AddToCartCommand(cartId, "GRINDER-BURR-001", 1));
        return checkoutUseCase.execute(new CheckoutCommand(cartId, ADDRESS));
    }

    private OrderStatus statusOf(Order order) {
        return getOrderUseCase.execute(new GetOrderQuery(order.getId().getValue())).getStatus();
    }

    @Test
    @DisplayName("주문 후 결제 승인과 재고 예약이 비동기로 진행되어 STOCK_RESERVED가 된다")
    void checkout_EventuallyStockReserved() {
        // when
        Order order = placeOrder();

        // then
        assertThat(order.getTotalAmount()).isEqualTo(Money.of("147.46", "USD"));
        assertThat(order.getOrderLevelDiscount()).isEqualTo(Money.of("10.00", "USD"));

        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(statusOf(order)).isEqualTo(OrderStatus.STOCK_RESERVED));

        Order reserved = getOrderUseCase.execute(new GetOrderQuery(order.getId().getValue()));
        assertThat(reserved.getPaymentId()).startsWith("payment-");
        assertThat(reserved.getProcessedReservationIds()).hasSize(1);
    }

    @Test
    @DisplayName("재고 예약 후 취소하면 결제 환불과 재고 해제가 진행된다")
    void cancel_AfterStockReserved_Compensates() {
        // given
        Order order = placeOrder();
        String orderId = order.getId().getValue();
        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(statusOf(order)).isEqualTo(OrderStatus.STOCK_RESERVED));

        // when
        Order cancelled = cancelOrderUseCase.execute(new CancelOrderCommand(orderId, "고객 요청"));

        // then
        assertThat(cancelled.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> {
                    assertThat(paymentsConsumer.isRefunded(orderId)).isTrue();
                    assertThat(inventoryConsumer.isReleased(orderId)).isTrue();
                });
    }

    @Test
    @DisplayName("없는 주문은 조회와 취소 모두 OrderNotFoundException")
    void unknownOrder_NotFound() {
        String unknown = OrderId.generate().getValue();

        assertThatThrownBy(() -> getOrderUseCase.execute(new GetOrderQuery(unknown)))
                .isInstanceOf(OrderNotFoundException.class);
        assertThatThrownBy(() -> cancelOrderUseCase.execute(new CancelOrderCommand(unknown, "고객 요청")))
                .isInstanceOf(OrderNotFoundException.class);
    }
}
