package com.hhplus.ordering.application.integration.payload;

import java.math.BigDecimal;

/**
 * order.paid
 */
public record OrderPaidPayload(
    String orderId,
    String paymentId,
    BigDecimal amount,
    String currency,
    String timestamp
) {}
