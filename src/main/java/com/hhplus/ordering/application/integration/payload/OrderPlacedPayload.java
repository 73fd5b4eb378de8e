package com.hhplus.ordering.application.integration.payload;

import java.math.BigDecimal;
import java.util.List;

/**
 * order.placed
 */
public record OrderPlacedPayload(
    String orderId,
    String customerId,
    String cartId,
    List<Item> items,
    BigDecimal totalAmount,
    String currency,
    Address shippingAddress,
    String timestamp
) {
    public record Item(
        String productId,
        int quantity,
        BigDecimal unitPrice
    ) {}

    public record Address(
        String street,
        String city,
        String state,
        String zipCode,
        String country
    ) {}
}
