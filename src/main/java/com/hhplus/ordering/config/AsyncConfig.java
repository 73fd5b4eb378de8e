package com.hhplus.ordering.config;

import com.hhplus.ordering.config.properties.OrderingProperties;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;

/**
 * 비동기 작업 설정
 *
 * 스레드 풀 구성:
 * - messageBusExecutor: 워커 1개 + 무제한 큐. 메시지 버스의 협력적 작업 큐 역할
 *   (발행 호출은 작업을 넣기만 하고, 핸들러는 발행 스택이 끝난 뒤 큐 순서대로 실행)
 * - gatewayExecutor: 카탈로그/가격/결제 컨텍스트 호출용. 호출 시간 상한을 걸기 위해 별도 풀에서 실행
 *
 * MDC 전파:
 * - TaskDecorator를 통해 발행한 스레드의 MDC를 복사하여 전달
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "messageBusExecutor")
    public ThreadPoolTaskExecutor messageBusExecutor(OrderingProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        // 단일 워커
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);

        executor.setThreadNamePrefix(properties.getBus().getThreadNamePrefix());
        executor.setTaskDecorator(new MdcTaskDecorator());

        // 종료 시 대기 중인 메시지 전달 완료
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getBus().getAwaitTerminationSeconds());

        executor.initialize();

        log.info("[메시지버스] Executor 초기화 완료 - Core: {}, Max: {}, Queue: {}",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), executor.getQueueCapacity());

        return executor;
    }

    @Bean(name = "gatewayExecutor")
    public ThreadPoolTaskExecutor gatewayExecutor(OrderingProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getGateway().getPoolSize());
        executor.setMaxPoolSize(properties.getGateway().getPoolSize());
        executor.setThreadNamePrefix("gateway-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();

        log.info("게이트웨이 Executor 초기화 완료 - Pool: {}, Timeout: {}ms",
                executor.getCorePoolSize(), properties.getGateway().getTimeoutMillis());

        return executor;
    }

    /**
     * MDC 전파를 위한 TaskDecorator
     *
     * 비동기 작업 실행 전에 부모 스레드의 MDC를 복사하여
     * 자식 스레드에 전달합니다.
     */
    public static class MdcTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();

            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }
}
