package com.hhplus.ordering.domain.vo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MoneyTest {

    @Test
    @DisplayName("금액은 소수점 둘째 자리로 반올림되고 통화는 대문자로 저장된다")
    void of_ScaleAndCurrency() {
        Money money = Money.of(new BigDecimal("10.005"), "usd");

        assertThat(money.getAmount()).isEqualByComparingTo("10.01");
        assertThat(money.getAmount().scale()).isEqualTo(2);
        assertThat(money.getCurrency()).isEqualTo("USD");
        assertThat(money).hasToString("10.01 USD");
    }

    @Test
    @DisplayName("음수 금액과 잘못된 통화 코드는 허용되지 않는다")
    void of_Invalid_Throws() {
        assertThatThrownBy(() -> Money.of("-1.00", "USD")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Money.of("1.00", "XYZ1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Money.of("1.00", " ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("더하기, 빼기, 곱하기")
    void arithmetic() {
        Money price = Money.of("24.99", "USD");

        assertThat(price.multiply(3)).isEqualTo(Money.of("74.97", "USD"));
        assertThat(price.add(Money.of("0.01", "USD"))).isEqualTo(Money.of("25.00", "USD"));
        assertThat(price.subtract(Money.of("4.99", "USD"))).isEqualTo(Money.of("20.00", "USD"));
        assertThat(price.isGreaterThan(Money.of("24.98", "USD"))).isTrue();
    }

    @Test
    @DisplayName("차감 결과가 음수이면 예외가 발생한다")
    void subtract_Negative_Throws() {
        assertThatThrownBy(() -> Money.of("1.00", "USD").subtract(Money.of("2.00", "USD")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("통화가 다른 금액끼리는 연산할 수 없다")
    void currencyMismatch_Throws() {
        assertThatThrownBy(() -> Money.of("1.00", "USD").add(Money.of("1.00", "EUR")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
