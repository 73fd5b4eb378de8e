package com.hhplus.ordering.domain.exception;

import com.hhplus.ordering.domain.vo.CartId;

public class CartNotFoundException extends ResourceNotFoundException {

    public CartNotFoundException(CartId cartId) {
        super("장바구니를 찾을 수 없습니다: " + cartId);
    }
}
