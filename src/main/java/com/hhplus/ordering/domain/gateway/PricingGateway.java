package com.hhplus.ordering.domain.gateway;

import com.hhplus.ordering.domain.vo.Money;
import com.hhplus.ordering.domain.vo.ProductId;
import com.hhplus.ordering.domain.vo.Quantity;

import java.util.List;

/**
 * 가격 컨텍스트 게이트웨이
 *
 * 계산 규칙:
 * - lineTotal = unitPrice × quantity - itemDiscount
 * - orderTotal = sum(lineTotal) - orderLevelDiscount
 *
 * 호출은 제한 시간(기본 2초) 안에 끝나야 하며, 실패하거나 시간을 넘기면
 * {@link com.hhplus.ordering.domain.exception.GatewayUnavailableException}이 발생합니다.
 */
public interface PricingGateway {

    PricingResult calculatePricing(List<PricingInput> items);

    record PricingInput(
        ProductId productId,
        Quantity quantity
    ) {}

    record ItemPricing(
        ProductId productId,
        Money unitPrice,
        Money itemDiscount,
        Money lineTotal
    ) {}

    record PricingResult(
        List<ItemPricing> items,
        Money orderLevelDiscount,
        Money orderTotal
    ) {
        public PricingResult {
            items = List.copyOf(items);
        }
    }
}
