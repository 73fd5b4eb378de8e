package com.hhplus.ordering.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "ordering")
public class OrderingProperties {

    private Bus bus = new Bus();
    private Gateway gateway = new Gateway();
    private Simulation simulation = new Simulation();

    @Getter
    @Setter
    public static class Bus {
        private String threadNamePrefix = "message-bus-";
        private int awaitTerminationSeconds = 5;
    }

    @Getter
    @Setter
    public static class Gateway {
        private long timeoutMillis = 2000L;          // 외부 컨텍스트 호출 상한
        private int poolSize = 4;
        private long catalogLatencyMillis = 100L;
        private long pricingLatencyMillis = 150L;
        private long paymentLatencyMillis = 500L;
    }

    @Getter
    @Setter
    public static class Simulation {
        private long paymentDelayMillis = 10L;      // 결제 승인까지 걸리는 시간
        private long stockDelayMillis = 10L;        // 재고 예약까지 걸리는 시간
        private boolean automaticPayment = true;    // false면 order.placed 자동 결제를 끄고 수동 결제 확정만 사용
    }
}
