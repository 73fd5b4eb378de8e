package com.hhplus.ordering.application.command;

/**
 * 장바구니 생성 Command
 */
public record CreateCartCommand(
        String customerId
) {
}
