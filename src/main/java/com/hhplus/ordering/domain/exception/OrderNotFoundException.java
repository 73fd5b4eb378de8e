package com.hhplus.ordering.domain.exception;

import com.hhplus.ordering.domain.vo.OrderId;

public class OrderNotFoundException extends ResourceNotFoundException {

    public OrderNotFoundException(OrderId orderId) {
        super("주문을 찾을 수 없습니다: " + orderId);
    }
}
