package com.hhplus.ordering.domain.gateway;

import com.hhplus.ordering.domain.vo.Money;
import com.hhplus.ordering.domain.vo.OrderId;

/**
 * 결제 컨텍스트 게이트웨이 (수동 결제 확정용)
 *
 * 거절은 예외가 아니라 {@link PaymentResult}의 사유로 돌려줍니다.
 * 호출 자체가 실패하거나 제한 시간을 넘기면
 * {@link com.hhplus.ordering.domain.exception.GatewayUnavailableException}이 발생합니다.
 */
public interface PaymentGateway {

    PaymentResult processPayment(OrderId orderId, Money amount);

    record PaymentResult(
        boolean success,
        String paymentId,
        String reason
    ) {
        public static PaymentResult approved(String paymentId) {
            return new PaymentResult(true, paymentId, null);
        }

        public static PaymentResult declined(String reason) {
            return new PaymentResult(false, null, reason);
        }
    }
}
