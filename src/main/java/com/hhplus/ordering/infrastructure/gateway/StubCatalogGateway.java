package com.hhplus.ordering.infrastructure.gateway;

import com.hhplus.ordering.config.properties.OrderingProperties;
import com.hhplus.ordering.domain.exception.GatewayUnavailableException;
import com.hhplus.ordering.domain.gateway.CatalogGateway;
import com.hhplus.ordering.domain.vo.ProductId;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 카탈로그 컨텍스트 스텁
 *
 * 고정된 상품 4종을 돌려주며, 네트워크 지연(ordering.gateway.catalog-latency-millis)을 흉내 냅니다.
 */
@Component
public class StubCatalogGateway implements CatalogGateway {

    private static final Map<String, ProductData> PRODUCTS = Map.of(
            "COFFEE-COL-001", new ProductData(
                    "Premium Coffee Beans", "Single-origin Arabica beans from Colombia, medium roast", "COFFEE-COL-001"),
            "TEA-EARL-001", new ProductData(
                    "Earl Grey Tea", "Classic black tea with bergamot oil, 20 tea bags", "TEA-EARL-001"),
            "MUG-CERAMIC-001", new ProductData(
                    "Ceramic Coffee Mug", "Handcrafted ceramic mug, 12oz capacity", "MUG-CERAMIC-001"),
            "GRINDER-BURR-001", new ProductData(
                    "Burr Coffee Grinder", "Professional burr grinder with 15 grind settings", "GRINDER-BURR-001")
    );

    private final GatewayCallExecutor callExecutor;
    private final OrderingProperties properties;

    public StubCatalogGateway(GatewayCallExecutor callExecutor, OrderingProperties properties) {
        this.callExecutor = callExecutor;
        this.properties = properties;
    }

    @Override
    public ProductData getProductData(ProductId productId) {
        return callExecutor.call("카탈로그", () -> {
            GatewayCallExecutor.simulateLatency(properties.getGateway().getCatalogLatencyMillis());

            ProductData product = PRODUCTS.get(productId.getValue());
            if (product == null) {
                throw new GatewayUnavailableException("카탈로그에 없는 상품입니다: productId=" + productId);
            }
            return product;
        });
    }
}
