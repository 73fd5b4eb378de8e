package com.hhplus.ordering.domain.vo;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 주문 시점의 상품 정보 스냅샷
 *
 * 카탈로그의 상품 정보가 이후에 바뀌더라도 주문에는 주문 당시의 값이 남습니다.
 */
@Getter
@EqualsAndHashCode
public final class ProductSnapshot {

    private static final int MAX_NAME_LENGTH = 200;
    private static final int MAX_DESCRIPTION_LENGTH = 1000;
    private static final int MAX_SKU_LENGTH = 50;

    private final String name;
    private final String description;
    private final String sku;

    public ProductSnapshot(String name, String description, String sku) {
        this.name = requireText(name, "상품명", MAX_NAME_LENGTH);
        this.description = description == null ? "" : limit(description.trim(), "상품 설명", MAX_DESCRIPTION_LENGTH);
        this.sku = requireText(sku, "SKU", MAX_SKU_LENGTH);
    }

    private static String requireText(String value, String label, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(label + "은(는) 비어 있을 수 없습니다.");
        }
        return limit(value.trim(), label, maxLength);
    }

    private static String limit(String value, String label, int maxLength) {
        if (value.length() > maxLength) {
            throw new IllegalArgumentException(label + "은(는) " + maxLength + "자를 초과할 수 없습니다.");
        }
        return value;
    }
}
