package com.hhplus.ordering.domain.vo;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 상품 식별자
 */
@Getter
@EqualsAndHashCode
public final class ProductId {

    private static final int MAX_LENGTH = 100;

    private final String value;

    private ProductId(String value) {
        this.value = value;
    }

    public static ProductId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("상품 ID는 비어 있을 수 없습니다.");
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("상품 ID는 " + MAX_LENGTH + "자를 초과할 수 없습니다.");
        }
        return new ProductId(trimmed);
    }

    @Override
    public String toString() {
        return value;
    }
}
