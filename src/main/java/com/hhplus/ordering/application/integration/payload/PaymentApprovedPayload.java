package com.hhplus.ordering.application.integration.payload;

import java.math.BigDecimal;

/**
 * payment.approved (결제 컨텍스트 → 주문 컨텍스트)
 */
public record PaymentApprovedPayload(
    String orderId,
    String paymentId,
    BigDecimal approvedAmount,
    String currency,
    String timestamp
) {}
