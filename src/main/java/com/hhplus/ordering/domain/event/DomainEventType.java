package com.hhplus.ordering.domain.event;

/**
 * 도메인 이벤트 종류
 *
 * 이벤트 발행기는 클래스 타입이 아니라 이 값으로 분기합니다.
 */
public enum DomainEventType {
    ORDER_PLACED,
    ORDER_PAID,
    ORDER_STOCK_RESERVED,
    ORDER_CANCELLED
}
