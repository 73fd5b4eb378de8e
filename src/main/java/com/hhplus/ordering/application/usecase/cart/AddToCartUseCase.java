package com.hhplus.ordering.application.usecase.cart;

import com.hhplus.ordering.application.command.AddToCartCommand;
import com.hhplus.ordering.domain.entity.ShoppingCart;
import com.hhplus.ordering.domain.exception.CartNotFoundException;
import com.hhplus.ordering.domain.repository.ShoppingCartRepository;
import com.hhplus.ordering.domain.vo.CartId;
import com.hhplus.ordering.domain.vo.ProductId;
import com.hhplus.ordering.domain.vo.Quantity;
import org.springframework.stereotype.Service;

/**
 * 장바구니에 상품 추가 UseCase
 *
 * User Story: "고객이 상품을 장바구니에 담는다"
 *
 * 이미 담긴 상품이면 수량이 합산됩니다.
 */
@Service
public class AddToCartUseCase {

    private final ShoppingCartRepository cartRepository;

    public AddToCartUseCase(ShoppingCartRepository cartRepository) {
        this.cartRepository = cartRepository;
    }

    public ShoppingCart execute(AddToCartCommand command) {
        CartId cartId = CartId.from(command.cartId());
        ShoppingCart cart = cartRepository.findById(cartId)
                .orElseThrow(() -> new CartNotFoundException(cartId));

        cart.addItem(ProductId.of(command.productId()), Quantity.of(command.quantity()));
        return cartRepository.save(cart);
    }
}
