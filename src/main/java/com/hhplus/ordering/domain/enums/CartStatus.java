package com.hhplus.ordering.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CartStatus {
    ACTIVE("사용 중"),
    CONVERTED("주문 전환됨");

    private final String description;
}
