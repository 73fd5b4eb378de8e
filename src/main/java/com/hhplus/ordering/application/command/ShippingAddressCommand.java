package com.hhplus.ordering.application.command;

import com.hhplus.ordering.domain.vo.ShippingAddress;

/**
 * 배송지 입력
 *
 * addressLine2, deliveryInstructions는 선택 항목입니다.
 */
public record ShippingAddressCommand(
        String street,
        String addressLine2,
        String city,
        String stateOrProvince,
        String postalCode,
        String country,
        String deliveryInstructions
) {

    public ShippingAddress toShippingAddress() {
        return new ShippingAddress(street, addressLine2, city, stateOrProvince, postalCode, country, deliveryInstructions);
    }
}
