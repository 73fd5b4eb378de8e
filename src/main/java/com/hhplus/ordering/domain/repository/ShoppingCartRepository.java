package com.hhplus.ordering.domain.repository;

import com.hhplus.ordering.domain.entity.ShoppingCart;
import com.hhplus.ordering.domain.vo.CartId;

import java.util.Optional;

public interface ShoppingCartRepository {

    ShoppingCart save(ShoppingCart cart);

    Optional<ShoppingCart> findById(CartId cartId);
}
