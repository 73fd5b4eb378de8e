package com.hhplus.ordering.domain.vo;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.UUID;

/**
 * 주문 식별자 (UUID 문자열)
 */
@Getter
@EqualsAndHashCode
public final class OrderId {

    private final String value;

    private OrderId(String value) {
        this.value = value;
    }

    public static OrderId generate() {
        return new OrderId(UUID.randomUUID().toString());
    }

    public static OrderId from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("주문 ID는 비어 있을 수 없습니다.");
        }
        try {
            return new OrderId(UUID.fromString(value.trim()).toString());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("주문 ID 형식이 올바르지 않습니다: " + value, e);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
