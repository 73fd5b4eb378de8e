package com.hhplus.ordering.application.command;

/**
 * 장바구니 수량 변경 Command
 */
public record UpdateCartItemQuantityCommand(
        String cartId,
        String productId,
        Integer quantity
) {
}
