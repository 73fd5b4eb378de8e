package com.hhplus.ordering.application.integration;

/**
 * 통합 메시지 토픽
 */
public final class IntegrationTopics {

    public static final String ORDER_PLACED = "order.placed";
    public static final String ORDER_PAID = "order.paid";
    public static final String ORDER_CANCELLED = "order.cancelled";
    public static final String PAYMENT_APPROVED = "payment.approved";
    public static final String STOCK_RESERVED = "stock.reserved";

    private IntegrationTopics() {
    }
}
