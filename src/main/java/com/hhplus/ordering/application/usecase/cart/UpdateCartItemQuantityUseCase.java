package com.hhplus.ordering.application.usecase.cart;

import com.hhplus.ordering.application.command.UpdateCartItemQuantityCommand;
import com.hhplus.ordering.domain.entity.ShoppingCart;
import com.hhplus.ordering.domain.exception.CartNotFoundException;
import com.hhplus.ordering.domain.repository.ShoppingCartRepository;
import com.hhplus.ordering.domain.vo.CartId;
import com.hhplus.ordering.domain.vo.ProductId;
import com.hhplus.ordering.domain.vo.Quantity;
import org.springframework.stereotype.Service;

/**
 * 장바구니 상품 수량 변경 UseCase
 */
@Service
public class UpdateCartItemQuantityUseCase {

    private final ShoppingCartRepository cartRepository;

    public UpdateCartItemQuantityUseCase(ShoppingCartRepository cartRepository) {
        this.cartRepository = cartRepository;
    }

    public ShoppingCart execute(UpdateCartItemQuantityCommand command) {
        CartId cartId = CartId.from(command.cartId());
        ShoppingCart cart = cartRepository.findById(cartId)
                .orElseThrow(() -> new CartNotFoundException(cartId));

        cart.updateItemQuantity(ProductId.of(command.productId()), Quantity.of(command.quantity()));
        return cartRepository.save(cart);
    }
}
