package com.hhplus.ordering.application.command;

/**
 * 장바구니 추가 Command
 */
public record AddToCartCommand(
        String cartId,
        String productId,
        Integer quantity
) {
}
