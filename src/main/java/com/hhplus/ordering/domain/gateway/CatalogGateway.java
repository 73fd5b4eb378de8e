package com.hhplus.ordering.domain.gateway;

import com.hhplus.ordering.domain.vo.ProductId;

/**
 * 상품 카탈로그 컨텍스트 게이트웨이
 *
 * 외부 카탈로그의 상품 구조를 주문 도메인의 {@link ProductData}로 바꿔 돌려줍니다.
 * 호출은 제한 시간(기본 2초) 안에 끝나야 하며, 실패하거나 시간을 넘기면
 * {@link com.hhplus.ordering.domain.exception.GatewayUnavailableException}이 발생합니다.
 */
public interface CatalogGateway {

    ProductData getProductData(ProductId productId);

    record ProductData(
        String name,
        String description,
        String sku
    ) {}
}
