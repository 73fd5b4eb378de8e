package com.hhplus.ordering.application.command;

/**
 * 수동 결제 확정 Command
 */
public record ConfirmPaymentCommand(
        String orderId
) {
}
