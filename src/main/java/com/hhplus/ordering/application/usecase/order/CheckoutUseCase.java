package com.hhplus.ordering.application.usecase.order;

import com.hhplus.ordering.application.command.CheckoutCommand;
import com.hhplus.ordering.domain.entity.Order;
import com.hhplus.ordering.domain.entity.ShoppingCart;
import com.hhplus.ordering.domain.event.publisher.EventPublisher;
import com.hhplus.ordering.domain.exception.CartNotFoundException;
import com.hhplus.ordering.domain.exception.EmptyCartException;
import com.hhplus.ordering.domain.exception.InvalidCartOperationException;
import com.hhplus.ordering.domain.repository.OrderRepository;
import com.hhplus.ordering.domain.repository.ShoppingCartRepository;
import com.hhplus.ordering.domain.service.OrderPricingService;
import com.hhplus.ordering.domain.service.OrderPricingService.PricedOrder;
import com.hhplus.ordering.domain.vo.CartId;
import com.hhplus.ordering.domain.vo.OrderId;
import com.hhplus.ordering.domain.vo.ShippingAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 주문(체크아웃) UseCase
 *
 * User Story: "고객이 장바구니를 주문으로 전환한다"
 *
 * 1. 장바구니 조회 (이미 주문으로 전환된 장바구니면 기존 주문 반환)
 * 2. 배송지 검증
 * 3. 가격 계산 (카탈로그 + 가격 컨텍스트)
 * 4. 주문 생성 및 저장
 * 5. 장바구니 전환 표시
 * 6. 저장이 끝난 뒤 도메인 이벤트 발행 (order.placed)
 *
 * 결제와 재고 예약은 이후 통합 메시지로 비동기 진행되므로, 반환되는 주문은 AWAITING_PAYMENT 상태입니다.
 */
@Slf4j
@Service
public class CheckoutUseCase {

    private final ShoppingCartRepository cartRepository;
    private final OrderRepository orderRepository;
    private final OrderPricingService pricingService;
    private final EventPublisher eventPublisher;

    public CheckoutUseCase(ShoppingCartRepository cartRepository,
                           OrderRepository orderRepository,
                           OrderPricingService pricingService,
                           EventPublisher eventPublisher) {
        this.cartRepository = cartRepository;
        this.orderRepository = orderRepository;
        this.pricingService = pricingService;
        this.eventPublisher = eventPublisher;
    }

    /**
     * @throws CartNotFoundException 장바구니가 없는 경우
     * @throws EmptyCartException 빈 장바구니인 경우
     * @throws com.hhplus.ordering.domain.exception.GatewayUnavailableException 가격/카탈로그 조회 실패
     */
    public Order execute(CheckoutCommand command) {
        CartId cartId = CartId.from(command.cartId());
        ShoppingCart cart = cartRepository.findById(cartId)
                .orElseThrow(() -> new CartNotFoundException(cartId));

        Optional<Order> existing = orderRepository.findByCartId(cartId);
        if (existing.isPresent()) {
            log.info("[주문] 이미 주문으로 전환된 장바구니, 기존 주문 반환: cartId={}, orderId={}",
                    cartId, existing.get().getId());
            if (!cart.isConverted()) {
                cart.markAsConverted();
                cartRepository.save(cart);
            }
            return existing.get();
        }
        if (cart.isConverted()) {
            throw new InvalidCartOperationException("주문으로 전환되었지만 주문을 찾을 수 없는 장바구니입니다: cartId=" + cartId);
        }
        if (cart.isEmpty()) {
            throw new EmptyCartException(cartId);
        }

        if (command.shippingAddress() == null) {
            throw new IllegalArgumentException("배송지는 필수입니다.");
        }
        ShippingAddress shippingAddress = command.shippingAddress().toShippingAddress();

        PricedOrder priced = pricingService.price(cart.getItems());

        Order order = Order.create(
                OrderId.generate(),
                cartId,
                cart.getCustomerId(),
                priced.items(),
                shippingAddress,
                priced.orderLevelDiscount(),
                priced.orderTotal()
        );
        orderRepository.save(order);

        cart.markAsConverted();
        cartRepository.save(cart);

        eventPublisher.publishAll(order.pullDomainEvents());

        log.info("[주문] 주문 생성 완료: orderId={}, cartId={}, customerId={}, totalAmount={}",
                order.getId(), cartId, order.getCustomerId(), order.getTotalAmount());

        return order;
    }
}
