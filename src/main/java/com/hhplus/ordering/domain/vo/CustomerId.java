package com.hhplus.ordering.domain.vo;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 고객 식별자
 */
@Getter
@EqualsAndHashCode
public final class CustomerId {

    private static final int MAX_LENGTH = 100;

    private final String value;

    private CustomerId(String value) {
        this.value = value;
    }

    public static CustomerId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("고객 ID는 비어 있을 수 없습니다.");
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("고객 ID는 " + MAX_LENGTH + "자를 초과할 수 없습니다.");
        }
        return new CustomerId(trimmed);
    }

    @Override
    public String toString() {
        return value;
    }
}
