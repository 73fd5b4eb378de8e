package com.hhplus.ordering.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum OrderStatus {
    AWAITING_PAYMENT("결제 대기", 0),
    PAID("결제 완료", 1),
    STOCK_RESERVED("재고 예약 완료", 2),
    CANCELLED("취소됨", -1);  // 어느 상태에서든 진입 가능한 종료 상태

    private final String description;
    private final int step;

    /**
     * 결제 완료 이후 단계인지 여부 (취소 상태는 제외)
     */
    public boolean isPaidOrLater() {
        return step >= PAID.step;
    }
}
