package com.hhplus.ordering.domain.repository;

import com.hhplus.ordering.domain.entity.Order;
import com.hhplus.ordering.domain.vo.CartId;
import com.hhplus.ordering.domain.vo.OrderId;

import java.util.Optional;

public interface OrderRepository {

    /**
     * 주문 저장 (멱등성 처리 이력 포함)
     */
    void save(Order order);

    /**
     * 조회할 때마다 저장된 상태로부터 새로 복원한 주문을 돌려줍니다.
     */
    Optional<Order> findById(OrderId orderId);

    Optional<Order> findByCartId(CartId cartId);
}
