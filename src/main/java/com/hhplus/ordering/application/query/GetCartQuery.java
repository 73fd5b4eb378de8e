package com.hhplus.ordering.application.query;

/**
 * 장바구니 조회 Query
 */
public record GetCartQuery(
        String cartId
) {
}
