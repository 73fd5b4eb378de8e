package com.hhplus.ordering.domain.vo;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.UUID;

/**
 * 장바구니 식별자 (UUID 문자열)
 */
@Getter
@EqualsAndHashCode
public final class CartId {

    private final String value;

    private CartId(String value) {
        this.value = value;
    }

    public static CartId generate() {
        return new CartId(UUID.randomUUID().toString());
    }

    public static CartId from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("장바구니 ID는 비어 있을 수 없습니다.");
        }
        try {
            return new CartId(UUID.fromString(value.trim()).toString());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("장바구니 ID 형식이 올바르지 않습니다: " + value, e);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
