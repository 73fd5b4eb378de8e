package com.hhplus.ordering.domain.exception;

/**
 * 외부 컨텍스트(가격, 카탈로그, 결제) 호출이 실패하거나 제한 시간을 넘겼을 때 발생합니다.
 */
public class GatewayUnavailableException extends RuntimeException {

    public GatewayUnavailableException(String message) {
        super(message);
    }

    public GatewayUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
