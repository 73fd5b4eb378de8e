package com.hhplus.ordering.infrastructure.gateway;

import com.hhplus.ordering.config.properties.OrderingProperties;
import com.hhplus.ordering.domain.exception.GatewayUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 외부 컨텍스트 호출 실행기
 *
 * 호출을 게이트웨이 전용 풀에서 실행하고 ordering.gateway.timeout-millis 안에 끝나지 않으면
 * {@link GatewayUnavailableException}으로 실패시킵니다.
 * 시간을 넘긴 호출은 실행 중인 스레드를 인터럽트해서 풀에 돌려줍니다.
 */
@Slf4j
@Component
public class GatewayCallExecutor {

    private final AsyncTaskExecutor gatewayExecutor;
    private final OrderingProperties properties;

    public GatewayCallExecutor(@Qualifier("gatewayExecutor") AsyncTaskExecutor gatewayExecutor,
                               OrderingProperties properties) {
        this.gatewayExecutor = gatewayExecutor;
        this.properties = properties;
    }

    public <T> T call(String gatewayName, Supplier<T> call) {
        long timeoutMillis = properties.getGateway().getTimeoutMillis();
        Callable<T> task = call::get;
        Future<T> future = gatewayExecutor.submit(task);

        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[주문] {} 응답 시간 초과: timeout={}ms", gatewayName, timeoutMillis);
            throw new GatewayUnavailableException(gatewayName + " 응답 시간 초과 (" + timeoutMillis + "ms)", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GatewayUnavailableException unavailable) {
                throw unavailable;
            }
            throw new GatewayUnavailableException(gatewayName + " 호출 실패: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayUnavailableException(gatewayName + " 호출 중 인터럽트 발생", e);
        }
    }

    static void simulateLatency(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayUnavailableException("외부 컨텍스트 호출이 중단되었습니다.", e);
        }
    }
}
