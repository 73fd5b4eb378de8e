package com.hhplus.ordering.domain.vo;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Optional;

/**
 * 배송지 Value Object
 *
 * 주문 시점의 배송지를 그대로 보관합니다. 모든 값은 앞뒤 공백을 제거해 저장하고,
 * 선택 항목(addressLine2, deliveryInstructions)이 공백뿐이면 없는 것으로 취급합니다.
 */
@Getter
@EqualsAndHashCode
public final class ShippingAddress {

    private final String street;
    private final String addressLine2;
    private final String city;
    private final String stateOrProvince;
    private final String postalCode;
    private final String country;
    private final String deliveryInstructions;

    public ShippingAddress(String street, String addressLine2, String city, String stateOrProvince,
                           String postalCode, String country, String deliveryInstructions) {
        this.street = required(street, "도로명 주소", 200);
        this.addressLine2 = optional(addressLine2, "상세 주소", 200);
        this.city = required(city, "도시", 100);
        this.stateOrProvince = required(stateOrProvince, "주/도", 100);
        this.postalCode = required(postalCode, "우편번호", 20);
        this.country = required(country, "국가", 100);
        this.deliveryInstructions = optional(deliveryInstructions, "배송 요청사항", 500);

        if (this.country.length() < 2) {
            throw new IllegalArgumentException("국가는 2자 이상이어야 합니다.");
        }
    }

    public static ShippingAddress of(String street, String city, String stateOrProvince,
                                     String postalCode, String country) {
        return new ShippingAddress(street, null, city, stateOrProvince, postalCode, country, null);
    }

    public Optional<String> getAddressLine2() {
        return Optional.ofNullable(addressLine2);
    }

    public Optional<String> getDeliveryInstructions() {
        return Optional.ofNullable(deliveryInstructions);
    }

    private static String required(String value, String label, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(label + "은(는) 비어 있을 수 없습니다.");
        }
        return checkLength(value.trim(), label, maxLength);
    }

    private static String optional(String value, String label, int maxLength) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return checkLength(value.trim(), label, maxLength);
    }

    private static String checkLength(String value, String label, int maxLength) {
        if (value.length() > maxLength) {
            throw new IllegalArgumentException(label + "은(는) " + maxLength + "자를 초과할 수 없습니다.");
        }
        return value;
    }
}
