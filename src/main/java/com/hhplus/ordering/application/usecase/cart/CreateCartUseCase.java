package com.hhplus.ordering.application.usecase.cart;

import com.hhplus.ordering.application.command.CreateCartCommand;
import com.hhplus.ordering.domain.entity.ShoppingCart;
import com.hhplus.ordering.domain.repository.ShoppingCartRepository;
import com.hhplus.ordering.domain.vo.CartId;
import com.hhplus.ordering.domain.vo.CustomerId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 장바구니 생성 UseCase
 *
 * User Story: "고객이 새 장바구니를 만든다"
 */
@Slf4j
@Service
public class CreateCartUseCase {

    private final ShoppingCartRepository cartRepository;

    public CreateCartUseCase(ShoppingCartRepository cartRepository) {
        this.cartRepository = cartRepository;
    }

    public CartId execute(CreateCartCommand command) {
        ShoppingCart cart = ShoppingCart.create(CartId.generate(), CustomerId.of(command.customerId()));
        cartRepository.save(cart);

        log.info("[주문] 장바구니 생성: cartId={}, customerId={}", cart.getCartId(), cart.getCustomerId());
        return cart.getCartId();
    }
}
