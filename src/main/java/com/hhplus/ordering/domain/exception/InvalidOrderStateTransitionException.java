package com.hhplus.ordering.domain.exception;

import com.hhplus.ordering.domain.enums.OrderStatus;
import lombok.Getter;

/**
 * 현재 주문 상태에서 허용되지 않는 명령이 들어왔을 때 발생합니다.
 *
 * 취소 후 도착한 결제 승인, 결제 전 재고 예약, 이미 다른 결제로 처리된 주문에 대한 결제 승인 등이 해당됩니다.
 */
@Getter
public class InvalidOrderStateTransitionException extends IllegalStateException {

    private final OrderStatus currentStatus;

    public InvalidOrderStateTransitionException(OrderStatus currentStatus, String message) {
        super(message + " (현재 상태: " + currentStatus + ")");
        this.currentStatus = currentStatus;
    }
}
