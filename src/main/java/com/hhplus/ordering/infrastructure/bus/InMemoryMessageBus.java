package com.hhplus.ordering.infrastructure.bus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hhplus.ordering.application.integration.IntegrationMessage;
import com.hhplus.ordering.application.integration.MessageBus;
import com.hhplus.ordering.application.integration.MessageHandler;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 인메모리 메시지 버스
 *
 * 발행 시 구독자마다 전달 작업 하나를 Executor에 넣고 바로 반환합니다.
 * 각 구독자는 구독 시 지정한 타입으로 변환된 payload 사본을 받습니다.
 *
 * 핸들러 예외는 topic/messageId/correlationId와 함께 로그만 남기고 버립니다.
 */
@Slf4j
public class InMemoryMessageBus implements MessageBus {

    public static final String MDC_MESSAGE_ID = "messageId";
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_TOPIC = "topic";

    private final Map<String, List<Subscription<?>>> subscriptions = new ConcurrentHashMap<>();
    private final Executor executor;
    private final ObjectMapper objectMapper;

    public InMemoryMessageBus(Executor executor, ObjectMapper objectMapper) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public <T> void publish(String topic, T payload) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");

        List<Subscription<?>> subscribers = subscriptions.getOrDefault(topic, List.of());
        if (subscribers.isEmpty()) {
            log.debug("[메시지버스] 구독자 없음, 메시지 폐기: topic={}", topic);
            return;
        }

        IntegrationMessage<Object> message = new IntegrationMessage<>(
                UUID.randomUUID().toString(),
                topic,
                LocalDateTime.now(),
                payload,
                resolveCorrelationId(payload)
        );

        log.debug("[메시지버스] 메시지 발행: topic={}, messageId={}, correlationId={}, subscribers={}",
                topic, message.messageId(), message.correlationId(), subscribers.size());

        for (Subscription<?> subscription : subscribers) {
            try {
                executor.execute(() -> deliver(subscription, message));
            } catch (RejectedExecutionException e) {
                log.warn("[메시지버스] 전달 작업 예약 실패, 메시지 폐기: topic={}, messageId={}, handler={}",
                        topic, message.messageId(), subscription.handlerName(), e);
            }
        }
    }

    @Override
    public <T> void subscribe(String topic, Class<T> payloadType, MessageHandler<T> handler) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payloadType, "payloadType");
        Objects.requireNonNull(handler, "handler");

        subscriptions.computeIfAbsent(topic, key -> new CopyOnWriteArrayList<>())
                .add(new Subscription<>(payloadType, handler));

        log.info("[메시지버스] 구독 등록: topic={}, payloadType={}", topic, payloadType.getSimpleName());
    }

    public int subscriberCount(String topic) {
        return subscriptions.getOrDefault(topic, List.of()).size();
    }

    private <T> void deliver(Subscription<T> subscription, IntegrationMessage<Object> message) {
        MDC.put(MDC_MESSAGE_ID, message.messageId());
        MDC.put(MDC_CORRELATION_ID, message.correlationId());
        MDC.put(MDC_TOPIC, message.topic());
        try {
            T payload = objectMapper.convertValue(message.payload(), subscription.payloadType());
            subscription.handler().handle(message.withPayload(payload));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[메시지버스] 핸들러 인터럽트, 메시지 폐기: topic={}, messageId={}, correlationId={}",
                    message.topic(), message.messageId(), message.correlationId());
        } catch (Exception e) {
            log.error("[메시지버스] 핸들러 처리 실패, 메시지 폐기: topic={}, messageId={}, correlationId={}, handler={}",
                    message.topic(), message.messageId(), message.correlationId(), subscription.handlerName(), e);
        } finally {
            MDC.remove(MDC_MESSAGE_ID);
            MDC.remove(MDC_CORRELATION_ID);
            MDC.remove(MDC_TOPIC);
        }
    }

    private String resolveCorrelationId(Object payload) {
        try {
            JsonNode orderId = objectMapper.valueToTree(payload).get("orderId");
            if (orderId != null && orderId.isTextual()) {
                return orderId.asText();
            }
        } catch (IllegalArgumentException e) {
            log.debug("[메시지버스] payload에서 orderId를 읽을 수 없음: type={}", payload.getClass().getSimpleName());
        }
        return UUID.randomUUID().toString();
    }

    private record Subscription<T>(Class<T> payloadType, MessageHandler<T> handler) {

        String handlerName() {
            return handler.getClass().getSimpleName();
        }
    }
}
