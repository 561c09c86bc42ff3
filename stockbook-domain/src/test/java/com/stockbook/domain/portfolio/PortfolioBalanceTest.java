package com.stockbook.domain.portfolio;

import com.stockbook.domain.ValidationException;
import com.stockbook.domain.money.CurrencyCode;
import com.stockbook.domain.money.CurrencyMismatchException;
import com.stockbook.domain.money.Money;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PortfolioBalanceTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    @Test
    void missingFlowsDefaultToZero() {
        PortfolioBalance b = new PortfolioBalance(1, DAY, null, null, Money.of(1000, CurrencyCode.USD), null);
        assertThat(b.withdrawals()).isEqualTo(Money.zero(CurrencyCode.USD));
        assertThat(b.hadDeposits()).isFalse();
        assertThat(b.indexChange()).isNull();
    }

    @Test
    void netFlowMayBeNegative() {
        PortfolioBalance b = new PortfolioBalance(1, DAY, Money.of(300, CurrencyCode.USD),
                Money.of(100, CurrencyCode.USD), Money.of(1000, CurrencyCode.USD), new BigDecimal("1.5"));
        assertThat(b.netFlow()).isEqualTo(Money.of(-200, CurrencyCode.USD));
    }

    @Test
    void currenciesMustMatch() {
        assertThatThrownBy(() -> new PortfolioBalance(1, DAY, Money.of(1, CurrencyCode.EUR), null,
                Money.of(1000, CurrencyCode.USD), null))
                .isInstanceOf(CurrencyMismatchException.class);
    }

    @Test
    void indexChangeIsAPercentage() {
        assertThatThrownBy(() -> new PortfolioBalance(1, DAY, null, null, Money.of(1, CurrencyCode.USD),
                new BigDecimal("100.01")))
                .isInstanceOf(ValidationException.class);
    }
}
