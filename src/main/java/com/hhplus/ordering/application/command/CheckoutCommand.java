package com.hhplus.ordering.application.command;

/**
 * 주문(체크아웃) Command
 */
public record CheckoutCommand(
        String cartId,
        ShippingAddressCommand shippingAddress
) {
}
