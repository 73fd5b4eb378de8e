package com.hhplus.ordering.application.usecase.cart;

import com.hhplus.ordering.application.query.GetCartQuery;
import com.hhplus.ordering.domain.entity.ShoppingCart;
import com.hhplus.ordering.domain.exception.CartNotFoundException;
import com.hhplus.ordering.domain.repository.ShoppingCartRepository;
import com.hhplus.ordering.domain.vo.CartId;
import org.springframework.stereotype.Service;

@Service
public class GetCartUseCase {

    private final ShoppingCartRepository cartRepository;

    public GetCartUseCase(ShoppingCartRepository cartRepository) {
        this.cartRepository = cartRepository;
    }

    public ShoppingCart execute(GetCartQuery query) {
        CartId cartId = CartId.from(query.cartId());
        return cartRepository.findById(cartId)
                .orElseThrow(() -> new CartNotFoundException(cartId));
    }
}
