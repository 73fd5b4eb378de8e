package com.hhplus.ordering.application.integration;

/**
 * 토픽 기반 발행/구독 메시지 버스
 *
 * 전달 보장:
 * - 최대 1회 전달, 재시도 없음, 순서 보장 없음
 * - 구독자가 없는 토픽으로 발행하면 메시지는 조용히 버려집니다.
 * - 핸들러는 발행 호출 스택 안에서 실행되지 않고, 구독자마다 독립된 비동기 작업으로 실행됩니다.
 * - 한 핸들러의 실패는 발행자나 다른 핸들러에 영향을 주지 않습니다.
 */
public interface MessageBus {

    /**
     * 메시지를 발행합니다. 전달 작업이 예약되면 바로 반환하며, 전달 결과는 알려주지 않습니다.
     */
    <T> void publish(String topic, T payload);

    /**
     * 토픽을 구독합니다. 한 토픽에 여러 핸들러를 등록할 수 있고, 구독 해제는 없습니다.
     *
     * @param payloadType 핸들러가 받을 payload 타입 (구독자마다 별도로 변환된 사본을 받습니다)
     */
    <T> void subscribe(String topic, Class<T> payloadType, MessageHandler<T> handler);
}
