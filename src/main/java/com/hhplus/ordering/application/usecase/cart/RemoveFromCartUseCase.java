package com.hhplus.ordering.application.usecase.cart;

import com.hhplus.ordering.application.command.RemoveFromCartCommand;
import com.hhplus.ordering.domain.entity.ShoppingCart;
import com.hhplus.ordering.domain.exception.CartNotFoundException;
import com.hhplus.ordering.domain.repository.ShoppingCartRepository;
import com.hhplus.ordering.domain.vo.CartId;
import com.hhplus.ordering.domain.vo.ProductId;
import org.springframework.stereotype.Service;

/**
 * 장바구니 상품 삭제 UseCase
 *
 * User Story: "고객이 장바구니에서 상품을 뺀다"
 */
@Service
public class RemoveFromCartUseCase {

    private final ShoppingCartRepository cartRepository;

    public RemoveFromCartUseCase(ShoppingCartRepository cartRepository) {
        this.cartRepository = cartRepository;
    }

    public ShoppingCart execute(RemoveFromCartCommand command) {
        CartId cartId = CartId.from(command.cartId());
        ShoppingCart cart = cartRepository.findById(cartId)
                .orElseThrow(() -> new CartNotFoundException(cartId));

        cart.removeItem(ProductId.of(command.productId()));
        return cartRepository.save(cart);
    }
}
