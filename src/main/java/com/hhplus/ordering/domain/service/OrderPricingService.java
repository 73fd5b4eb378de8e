package com.hhplus.ordering.domain.service;

import com.hhplus.ordering.domain.entity.CartItem;
import com.hhplus.ordering.domain.entity.OrderItem;
import com.hhplus.ordering.domain.exception.GatewayUnavailableException;
import com.hhplus.ordering.domain.gateway.CatalogGateway;
import com.hhplus.ordering.domain.gateway.PricingGateway;
import com.hhplus.ordering.domain.gateway.PricingGateway.ItemPricing;
import com.hhplus.ordering.domain.gateway.PricingGateway.PricingInput;
import com.hhplus.ordering.domain.gateway.PricingGateway.PricingResult;
import com.hhplus.ordering.domain.vo.Money;
import com.hhplus.ordering.domain.vo.ProductId;
import com.hhplus.ordering.domain.vo.ProductSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 주문 가격 계산 도메인 서비스
 *
 * 1. 카탈로그에서 상품별 스냅샷 조회
 * 2. 가격 컨텍스트에 전체 항목 가격 계산 요청 (1회)
 * 3. 스냅샷 + 가격 정보를 합쳐 OrderItem 생성
 */
@Slf4j
@Service
public class OrderPricingService {

    private final CatalogGateway catalogGateway;
    private final PricingGateway pricingGateway;

    public OrderPricingService(CatalogGateway catalogGateway, PricingGateway pricingGateway) {
        this.catalogGateway = catalogGateway;
        this.pricingGateway = pricingGateway;
    }

    /**
     * 장바구니 항목의 가격을 계산합니다.
     *
     * @throws GatewayUnavailableException 카탈로그/가격 조회 실패 또는 일부 상품의 가격 누락
     */
    public PricedOrder price(List<CartItem> cartItems) {
        Map<ProductId, ProductSnapshot> snapshots = new LinkedHashMap<>();
        for (CartItem cartItem : cartItems) {
            CatalogGateway.ProductData data = catalogGateway.getProductData(cartItem.getProductId());
            snapshots.put(cartItem.getProductId(), new ProductSnapshot(data.name(), data.description(), data.sku()));
        }

        List<PricingInput> inputs = cartItems.stream()
                .map(item -> new PricingInput(item.getProductId(), item.getQuantity()))
                .toList();
        PricingResult pricing = pricingGateway.calculatePricing(inputs);

        Map<ProductId, ItemPricing> pricingByProduct = pricing.items().stream()
                .collect(Collectors.toMap(ItemPricing::productId, Function.identity(), (first, second) -> first));

        List<OrderItem> orderItems = cartItems.stream()
                .map(cartItem -> {
                    ItemPricing itemPricing = pricingByProduct.get(cartItem.getProductId());
                    if (itemPricing == null) {
                        throw new GatewayUnavailableException(
                                "가격 정보를 찾을 수 없습니다: productId=" + cartItem.getProductId());
                    }
                    return OrderItem.create(
                            cartItem.getProductId(),
                            snapshots.get(cartItem.getProductId()),
                            cartItem.getQuantity(),
                            itemPricing.unitPrice(),
                            itemPricing.itemDiscount()
                    );
                })
                .toList();

        log.info("[주문] 가격 계산 완료: items={}, orderLevelDiscount={}, orderTotal={}",
                orderItems.size(), pricing.orderLevelDiscount(), pricing.orderTotal());

        return new PricedOrder(orderItems, pricing.orderLevelDiscount(), pricing.orderTotal());
    }

    public record PricedOrder(
        List<OrderItem> items,
        Money orderLevelDiscount,
        Money orderTotal
    ) {}
}
