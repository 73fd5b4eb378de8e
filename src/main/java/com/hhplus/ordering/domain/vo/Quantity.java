package com.hhplus.ordering.domain.vo;

import com.hhplus.ordering.domain.exception.InvalidQuantityException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 수량 Value Object (1 ~ 10)
 */
@Getter
@EqualsAndHashCode
public final class Quantity {

    public static final int MIN_VALUE = 1;
    public static final int MAX_VALUE = 10;

    private final int value;

    private Quantity(Integer value) {
        validateValue(value);
        this.value = value;
    }

    public static Quantity of(Integer value) {
        return new Quantity(value);
    }

    private void validateValue(Integer value) {
        if (value == null) {
            throw new InvalidQuantityException("수량은 null일 수 없습니다.");
        }
        if (value < MIN_VALUE || value > MAX_VALUE) {
            throw new InvalidQuantityException(
                    "수량은 " + MIN_VALUE + " 이상 " + MAX_VALUE + " 이하이어야 합니다: " + value);
        }
    }

    public Quantity add(Quantity other) {
        return new Quantity(this.value + other.value);
    }

    public Money multiply(Money unitPrice) {
        return unitPrice.multiply(value);
    }

    @Override
    public String toString() {
        return value + "개";
    }
}
