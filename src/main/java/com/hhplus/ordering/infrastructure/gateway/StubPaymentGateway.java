package com.hhplus.ordering.infrastructure.gateway;

import com.hhplus.ordering.config.properties.OrderingProperties;
import com.hhplus.ordering.domain.gateway.PaymentGateway;
import com.hhplus.ordering.domain.vo.Money;
import com.hhplus.ordering.domain.vo.OrderId;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * 결제 컨텍스트 스텁
 *
 * 거절 규칙 (위에서부터 먼저 맞는 규칙 적용):
 * - 금액 0.01 미만: "Invalid amount"
 * - 금액 10000 초과: "Fraud check failed"
 * - 주문 ID 마지막 글자 '5': "Insufficient funds"
 * - 주문 ID 마지막 글자 '9': "Card declined"
 * 그 외에는 승인하며 paymentId는 "PAY-{orderId}"입니다.
 */
@Component
public class StubPaymentGateway implements PaymentGateway {

    private static final BigDecimal MIN_AMOUNT = new BigDecimal("0.01");
    private static final BigDecimal FRAUD_THRESHOLD = new BigDecimal("10000");

    private final GatewayCallExecutor callExecutor;
    private final OrderingProperties properties;

    public StubPaymentGateway(GatewayCallExecutor callExecutor, OrderingProperties properties) {
        this.callExecutor = callExecutor;
        this.properties = properties;
    }

    @Override
    public PaymentResult processPayment(OrderId orderId, Money amount) {
        return callExecutor.call("결제", () -> {
            GatewayCallExecutor.simulateLatency(properties.getGateway().getPaymentLatencyMillis());
            return decide(orderId.getValue(), amount.getAmount());
        });
    }

    private PaymentResult decide(String orderId, BigDecimal amount) {
        if (amount.compareTo(MIN_AMOUNT) < 0) {
            return PaymentResult.declined("Invalid amount");
        }
        if (amount.compareTo(FRAUD_THRESHOLD) > 0) {
            return PaymentResult.declined("Fraud check failed");
        }

        char lastChar = orderId.charAt(orderId.length() - 1);
        if (lastChar == '5') {
            return PaymentResult.declined("Insufficient funds");
        }
        if (lastChar == '9') {
            return PaymentResult.declined("Card declined");
        }

        return PaymentResult.approved("PAY-" + orderId);
    }
}
