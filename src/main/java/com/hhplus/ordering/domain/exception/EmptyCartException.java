package com.hhplus.ordering.domain.exception;

import com.hhplus.ordering.domain.vo.CartId;

public class EmptyCartException extends InvalidCartOperationException {

    public EmptyCartException(CartId cartId) {
        super("빈 장바구니는 주문으로 전환할 수 없습니다: " + cartId);
    }
}
