package com.hhplus.ordering.application.integration.payload;

/**
 * order.cancelled
 *
 * previousStatus로 환불/재고 해제 필요 여부를 판단합니다.
 */
public record OrderCancelledPayload(
    String orderId,
    String reason,
    String previousStatus,
    String timestamp
) {}
