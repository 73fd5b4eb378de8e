package com.hhplus.ordering.domain.entity;

import com.hhplus.ordering.domain.enums.CartStatus;
import com.hhplus.ordering.domain.exception.EmptyCartException;
import com.hhplus.ordering.domain.exception.InvalidCartOperationException;
import com.hhplus.ordering.domain.vo.CartId;
import com.hhplus.ordering.domain.vo.CustomerId;
import com.hhplus.ordering.domain.vo.ProductId;
import com.hhplus.ordering.domain.vo.Quantity;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 장바구니 애그리거트
 *
 * - 서로 다른 상품은 최대 20종까지 담을 수 있습니다.
 * - 상품별 수량은 1 ~ 10개입니다 (같은 상품을 다시 담으면 합산).
 * - 주문으로 전환된 장바구니는 더 이상 수정할 수 없습니다.
 */
@Getter
public class ShoppingCart {

    public static final int MAX_PRODUCTS = 20;

    private final CartId cartId;
    private final CustomerId customerId;

    @Getter(AccessLevel.NONE)
    private final Map<ProductId, CartItem> items = new LinkedHashMap<>();

    private CartStatus status;

    private ShoppingCart(CartId cartId, CustomerId customerId) {
        this.cartId = Objects.requireNonNull(cartId, "cartId");
        this.customerId = Objects.requireNonNull(customerId, "customerId");
        this.status = CartStatus.ACTIVE;
    }

    public static ShoppingCart create(CartId cartId, CustomerId customerId) {
        return new ShoppingCart(cartId, customerId);
    }

    public void addItem(ProductId productId, Quantity quantity) {
        ensureNotConverted();

        CartItem existing = items.get(productId);
        if (existing != null) {
            existing.addQuantity(quantity);
            return;
        }
        if (items.size() >= MAX_PRODUCTS) {
            throw new InvalidCartOperationException(
                    "장바구니에는 최대 " + MAX_PRODUCTS + "종의 상품만 담을 수 있습니다: cartId=" + cartId);
        }
        items.put(productId, CartItem.create(productId, quantity));
    }

    public void updateItemQuantity(ProductId productId, Quantity quantity) {
        ensureNotConverted();
        getExistingItem(productId).updateQuantity(quantity);
    }

    public void removeItem(ProductId productId) {
        ensureNotConverted();
        getExistingItem(productId);
        items.remove(productId);
    }

    /**
     * 주문 전환 완료 표시. 이후 장바구니는 잠깁니다.
     */
    public void markAsConverted() {
        if (items.isEmpty()) {
            throw new EmptyCartException(cartId);
        }
        this.status = CartStatus.CONVERTED;
    }

    public List<CartItem> getItems() {
        return List.copyOf(items.values());
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean isConverted() {
        return status == CartStatus.CONVERTED;
    }

    public int getItemCount() {
        return items.size();
    }

    private CartItem getExistingItem(ProductId productId) {
        CartItem item = items.get(productId);
        if (item == null) {
            throw new InvalidCartOperationException("장바구니에 없는 상품입니다: productId=" + productId);
        }
        return item;
    }

    private void ensureNotConverted() {
        if (isConverted()) {
            throw new InvalidCartOperationException("이미 주문으로 전환된 장바구니는 수정할 수 없습니다: cartId=" + cartId);
        }
    }
}
