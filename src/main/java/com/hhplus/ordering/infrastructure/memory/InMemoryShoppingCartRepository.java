package com.hhplus.ordering.infrastructure.memory;

import com.hhplus.ordering.domain.entity.ShoppingCart;
import com.hhplus.ordering.domain.repository.ShoppingCartRepository;
import com.hhplus.ordering.domain.vo.CartId;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryShoppingCartRepository implements ShoppingCartRepository {

    private final Map<CartId, ShoppingCart> store = new ConcurrentHashMap<>();

    @Override
    public ShoppingCart save(ShoppingCart cart) {
        store.put(cart.getCartId(), cart);
        return cart;
    }

    @Override
    public Optional<ShoppingCart> findById(CartId cartId) {
        return Optional.ofNullable(store.get(cartId));
    }
}
