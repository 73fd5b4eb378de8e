package com.hhplus.ordering.domain.exception;

import lombok.Getter;

/**
 * 결제 게이트웨이가 결제를 거절했을 때 발생합니다. 주문 상태는 바뀌지 않습니다.
 */
@Getter
public class PaymentDeclinedException extends RuntimeException {

    private final String reason;

    public PaymentDeclinedException(String reason) {
        super("결제가 거절되었습니다: " + reason);
        this.reason = reason;
    }
}
