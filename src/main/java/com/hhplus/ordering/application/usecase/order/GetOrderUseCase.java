package com.hhplus.ordering.application.usecase.order;

import com.hhplus.ordering.application.query.GetOrderQuery;
import com.hhplus.ordering.domain.entity.Order;
import com.hhplus.ordering.domain.exception.OrderNotFoundException;
import com.hhplus.ordering.domain.repository.OrderRepository;
import com.hhplus.ordering.domain.vo.OrderId;
import org.springframework.stereotype.Service;

/**
 * 주문 상세 조회 UseCase
 *
 * User Story: "고객이 주문 상태를 조회한다"
 */
@Service
public class GetOrderUseCase {

    private final OrderRepository orderRepository;

    public GetOrderUseCase(OrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    public Order execute(GetOrderQuery query) {
        OrderId orderId = OrderId.from(query.orderId());
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }
}
