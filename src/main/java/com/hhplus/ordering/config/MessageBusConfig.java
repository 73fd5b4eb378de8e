package com.hhplus.ordering.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hhplus.ordering.application.integration.MessageBus;
import com.hhplus.ordering.infrastructure.bus.InMemoryMessageBus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * 메시지 버스 설정
 *
 * 버스는 전역 싱글톤이 아니라 컨테이너가 관리하는 빈으로, 필요한 곳에 주입됩니다.
 */
@Configuration
public class MessageBusConfig {

    @Bean
    public MessageBus messageBus(@Qualifier("messageBusExecutor") Executor messageBusExecutor,
                                 ObjectMapper objectMapper) {
        return new InMemoryMessageBus(messageBusExecutor, objectMapper);
    }
}
