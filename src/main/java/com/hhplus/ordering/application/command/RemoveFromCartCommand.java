package com.hhplus.ordering.application.command;

public record RemoveFromCartCommand(
        String cartId,
        String productId
) {
}
