package com.hhplus.ordering.domain.exception;

/**
 * 주문 항목 없이 주문을 만들려고 할 때 발생합니다.
 */
public class EmptyOrderException extends IllegalArgumentException {

    public EmptyOrderException() {
        super("주문에는 최소 1개 이상의 주문 항목이 있어야 합니다.");
    }
}
