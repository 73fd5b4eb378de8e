package com.hhplus.ordering.application.command;

/**
 * 주문 취소 Command
 */
public record CancelOrderCommand(
        String orderId,
        String reason
) {
}
