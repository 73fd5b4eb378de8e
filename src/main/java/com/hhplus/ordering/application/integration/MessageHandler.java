package com.hhplus.ordering.application.integration;

/**
 * 토픽 구독 핸들러
 *
 * 핸들러에서 던진 예외는 메시지 버스가 잡아 로그를 남기고 버립니다 (재시도 없음).
 */
@FunctionalInterface
public interface MessageHandler<T> {

    void handle(IntegrationMessage<T> message) throws Exception;
}
