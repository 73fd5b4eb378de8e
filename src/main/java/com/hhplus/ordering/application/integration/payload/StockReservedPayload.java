package com.hhplus.ordering.application.integration.payload;

import java.util.List;

/**
 * stock.reserved (재고 컨텍스트 → 주문 컨텍스트)
 */
public record StockReservedPayload(
    String orderId,
    String reservationId,
    List<StockItem> items,
    String timestamp
) {
    public StockReservedPayload {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public record StockItem(
        String productId,
        int quantity
    ) {}
}
