package com.hhplus.ordering.application.integration;

import java.time.LocalDateTime;

/**
 * 컨텍스트 간에 주고받는 통합 메시지 봉투
 *
 * 발행자가 아니라 메시지 버스가 발행 시점에 만듭니다. 저장되지 않으며 messageId 외의 식별성은 없습니다.
 *
 * @param messageId 발행 호출마다 새로 생성되는 ID
 * @param correlationId payload의 orderId(문자열)가 있으면 그 값, 없으면 새로 생성한 ID
 */
public record IntegrationMessage<T>(
    String messageId,
    String topic,
    LocalDateTime timestamp,
    T payload,
    String correlationId
) {

    public <U> IntegrationMessage<U> withPayload(U newPayload) {
        return new IntegrationMessage<>(messageId, topic, timestamp, newPayload, correlationId);
    }
}
