package com.stockbook.domain.trade;

import com.stockbook.domain.ValidationException;
import com.stockbook.domain.money.CurrencyCode;
import com.stockbook.domain.money.Money;
import com.stockbook.domain.money.Quantity;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StockTransactionTest {

    private static final Money PRICE = Money.of("12.50", CurrencyCode.USD);

    @Test
    void totalValueIsPriceTimesQuantity() {
        StockTransaction t = StockTransaction.buy(1, 2, Quantity.of(10), PRICE, LocalDate.now());
        assertThat(t.totalValue()).isEqualTo(Money.of("125.00", CurrencyCode.USD));
        assertThat(t.isBuy()).isTrue();
        assertThat(t.type().code()).isEqualTo("buy");
    }

    @Test
    void quantityAndPriceMustBePositive() {
        LocalDate today = LocalDate.now();
        assertThatThrownBy(() -> StockTransaction.buy(1, 2, Quantity.zero(), PRICE, today))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> StockTransaction.sell(1, 2, Quantity.of(1), Money.zero(CurrencyCode.USD), today))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void dateCannotBeInTheFuture() {
        assertThatThrownBy(() -> StockTransaction.buy(1, 2, Quantity.of(1), PRICE, LocalDate.now().plusDays(1)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("future");
    }

    @Test
    void parsesTypeCodes() {
        assertThat(TransactionType.fromCode(" SELL ")).isEqualTo(TransactionType.SELL);
        assertThatThrownBy(() -> TransactionType.fromCode("short")).isInstanceOf(ValidationException.class);
    }
}
