package com.hhplus.ordering.application.query;

/**
 * 주문 조회 Query
 */
public record GetOrderQuery(
        String orderId
) {
}
