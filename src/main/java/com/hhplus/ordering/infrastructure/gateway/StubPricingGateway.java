package com.hhplus.ordering.infrastructure.gateway;

import com.hhplus.ordering.config.properties.OrderingProperties;
import com.hhplus.ordering.domain.exception.GatewayUnavailableException;
import com.hhplus.ordering.domain.gateway.PricingGateway;
import com.hhplus.ordering.domain.vo.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * 가격 컨텍스트 스텁
 *
 * 할인 규칙:
 * - 수량 3개 이상인 항목: 항목 소계의 10% 할인
 * - 항목 합계가 100.00 초과: 주문 단위 10.00 할인
 */
@Component
public class StubPricingGateway implements PricingGateway {

    private static final String CURRENCY = "USD";
    private static final int BULK_QUANTITY = 3;
    private static final BigDecimal BULK_DISCOUNT_RATE = new BigDecimal("0.10");
    private static final Money ORDER_DISCOUNT_THRESHOLD = Money.of("100.00", CURRENCY);
    private static final Money ORDER_DISCOUNT = Money.of("10.00", CURRENCY);

    private static final Map<String, Money> UNIT_PRICES = Map.of(
            "COFFEE-COL-001", Money.of("24.99", CURRENCY),
            "TEA-EARL-001", Money.of("12.99", CURRENCY),
            "MUG-CERAMIC-001", Money.of("15.99", CURRENCY),
            "GRINDER-BURR-001", Money.of("89.99", CURRENCY)
    );

    private final GatewayCallExecutor callExecutor;
    private final OrderingProperties properties;

    public StubPricingGateway(GatewayCallExecutor callExecutor, OrderingProperties properties) {
        this.callExecutor = callExecutor;
        this.properties = properties;
    }

    @Override
    public PricingResult calculatePricing(List<PricingInput> items) {
        return callExecutor.call("가격", () -> {
            GatewayCallExecutor.simulateLatency(properties.getGateway().getPricingLatencyMillis());
            return price(items);
        });
    }

    private PricingResult price(List<PricingInput> items) {
        if (items.isEmpty()) {
            throw new GatewayUnavailableException("빈 장바구니는 가격을 계산할 수 없습니다.");
        }

        List<ItemPricing> pricings = items.stream()
                .map(this::priceItem)
                .toList();

        Money subtotal = pricings.stream()
                .map(ItemPricing::lineTotal)
                .reduce(Money.zero(CURRENCY), Money::add);

        Money orderLevelDiscount = subtotal.isGreaterThan(ORDER_DISCOUNT_THRESHOLD)
                ? ORDER_DISCOUNT
                : Money.zero(CURRENCY);

        return new PricingResult(pricings, orderLevelDiscount, subtotal.subtract(orderLevelDiscount));
    }

    private ItemPricing priceItem(PricingInput input) {
        Money unitPrice = UNIT_PRICES.get(input.productId().getValue());
        if (unitPrice == null) {
            throw new GatewayUnavailableException("가격 정보가 없는 상품입니다: productId=" + input.productId());
        }

        Money itemSubtotal = input.quantity().multiply(unitPrice);
        Money itemDiscount = input.quantity().getValue() >= BULK_QUANTITY
                ? Money.of(itemSubtotal.getAmount().multiply(BULK_DISCOUNT_RATE), CURRENCY)
                : Money.zero(CURRENCY);

        return new ItemPricing(input.productId(), unitPrice, itemDiscount, itemSubtotal.subtract(itemDiscount));
    }
}
