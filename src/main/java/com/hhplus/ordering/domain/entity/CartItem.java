package com.hhplus.ordering.domain.entity;

import com.hhplus.ordering.domain.vo.ProductId;
import com.hhplus.ordering.domain.vo.Quantity;
import lombok.Getter;

import java.util.Objects;

/**
 * 장바구니 항목
 */
@Getter
public class CartItem {

    private final ProductId productId;
    private Quantity quantity;

    private CartItem(ProductId productId, Quantity quantity) {
        this.productId = Objects.requireNonNull(productId, "productId");
        this.quantity = Objects.requireNonNull(quantity, "quantity");
    }

    public static CartItem create(ProductId productId, Quantity quantity) {
        return new CartItem(productId, quantity);
    }

    /**
     * 같은 상품을 다시 담으면 수량을 합칩니다. 합계가 최대 수량을 넘으면 예외가 발생합니다.
     */
    public void addQuantity(Quantity additional) {
        this.quantity = this.quantity.add(additional);
    }

    public void updateQuantity(Quantity quantity) {
        this.quantity = Objects.requireNonNull(quantity, "quantity");
    }
}
