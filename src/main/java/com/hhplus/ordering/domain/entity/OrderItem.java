package com.hhplus.ordering.domain.entity;

import com.hhplus.ordering.domain.vo.Money;
import com.hhplus.ordering.domain.vo.ProductId;
import com.hhplus.ordering.domain.vo.ProductSnapshot;
import com.hhplus.ordering.domain.vo.Quantity;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * 주문 항목
 *
 * 주문 생성 이후에는 변경되지 않습니다.
 */
@Getter
@EqualsAndHashCode
public final class OrderItem {

    private final ProductId productId;
    private final ProductSnapshot productSnapshot;
    private final Quantity quantity;
    private final Money unitPrice;
    private final Money itemDiscount;

    private OrderItem(ProductId productId, ProductSnapshot productSnapshot, Quantity quantity,
                      Money unitPrice, Money itemDiscount) {
        this.productId = Objects.requireNonNull(productId, "productId");
        this.productSnapshot = Objects.requireNonNull(productSnapshot, "productSnapshot");
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.unitPrice = Objects.requireNonNull(unitPrice, "unitPrice");
        this.itemDiscount = Objects.requireNonNull(itemDiscount, "itemDiscount");

        if (!unitPrice.isSameCurrency(itemDiscount)) {
            throw new IllegalArgumentException(
                    "단가와 할인 금액의 통화가 다릅니다: " + unitPrice.getCurrency() + ", " + itemDiscount.getCurrency());
        }
        // 할인 금액이 소계를 넘으면 Money.subtract에서 거부됩니다.
        getLineTotal();
    }

    public static OrderItem create(ProductId productId, ProductSnapshot productSnapshot, Quantity quantity,
                                   Money unitPrice, Money itemDiscount) {
        return new OrderItem(productId, productSnapshot, quantity, unitPrice, itemDiscount);
    }

    /**
     * 단가 × 수량 - 항목 할인
     */
    public Money getLineTotal() {
        return quantity.multiply(unitPrice).subtract(itemDiscount);
    }

    public String getCurrency() {
        return unitPrice.getCurrency();
    }
}
