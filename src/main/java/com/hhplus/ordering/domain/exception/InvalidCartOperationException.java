package com.hhplus.ordering.domain.exception;

/**
 * 장바구니 규칙(상품 종류 수 제한, 전환 후 수정 금지 등)을 위반했을 때 발생합니다.
 */
public class InvalidCartOperationException extends IllegalStateException {

    public InvalidCartOperationException(String message) {
        super(message);
    }
}
