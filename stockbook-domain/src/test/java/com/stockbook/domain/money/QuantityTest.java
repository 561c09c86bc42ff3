package com.stockbook.domain.money;

import com.stockbook.domain.ValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuantityTest {

    @Test
    void negativeQuantityIsRejectedByDefault() {
        assertThatThrownBy(() -> Quantity.of(-1)).isInstanceOf(ValidationException.class);
        assertThat(Quantity.signed(-5).isNegative()).isTrue();
    }

    @Test
    void subtractBelowZeroNeedsSignedQuantity() {
        assertThatThrownBy(() -> Quantity.of(5).subtract(Quantity.of(6)))
                .isInstanceOf(NegativeResultException.class);
        assertThat(Quantity.signed(5).subtract(Quantity.of(6))).isEqualTo(Quantity.signed(-1));
        assertThatThrownBy(() -> Quantity.of(5).negate()).isInstanceOf(NegativeResultException.class);
    }

    @Test
    void normalisedValueAndEquality() {
        assertThat(Quantity.of(100)).hasToString("100");
        assertThat(Quantity.of("10.50")).hasToString("10.5");
        assertThat(Quantity.of("10.00")).isEqualTo(Quantity.of(10));
        assertThat(Quantity.of("10.00").hashCode()).isEqualTo(Quantity.of(10).hashCode());
    }

    @Test
    void splitSumsBackToOriginal() {
        for (String q : List.of("0", "1", "10", "100", "7.5", "1000.01")) {
            Quantity quantity = Quantity.of(q);
            for (int n = 1; n <= 7; n++) {
                List<Quantity> parts = quantity.split(n);
                assertThat(parts).hasSize(n);
                assertThat(Quantity.sum(parts)).as("%s / %d", q, n).isEqualTo(quantity);
                assertThat(parts).noneMatch(Quantity::isNegative);
            }
        }
    }

    @Test
    void splitGivesRemainderToLastPart() {
        assertThat(Quantity.of(100).split(3))
                .containsExactly(Quantity.of("33.33"), Quantity.of("33.33"), Quantity.of("33.34"));
        assertThat(Quantity.of(10).split(1)).containsExactly(Quantity.of(10));
        assertThatThrownBy(() -> Quantity.of(10).split(0)).isInstanceOf(ValidationException.class);
    }

    @Test
    void distributeByRatio() {
        List<Quantity> parts = Quantity.of(10).distributeByRatio(List.of(1, 2));
        assertThat(parts).containsExactly(Quantity.of("3.33"), Quantity.of("6.67"));
        assertThat(Quantity.of(10).distributeByRatio(List.of())).isEmpty();
    }

    @Test
    void wholeDivision() {
        assertThat(Quantity.of(100).divideWhole(4)).isEqualTo(Quantity.of(25));
        assertThatThrownBy(() -> Quantity.of(100).divideWhole(3)).isInstanceOf(NonWholeQuantityException.class);
        assertThatThrownBy(() -> Quantity.of(100).divide(0)).isInstanceOf(DivisionByZeroException.class);
    }

    @Test
    void roundingAndPredicates() {
        Quantity q = Quantity.of("12.345");
        assertThat(q.round(2)).isEqualTo(Quantity.of("12.35"));
        assertThat(q.floor()).isEqualTo(Quantity.of(12));
        assertThat(q.ceiling()).isEqualTo(Quantity.of(13));
        assertThat(q.isWhole()).isFalse();
        assertThat(Quantity.of(12).isWhole()).isTrue();
        assertThat(Quantity.of(25).percentageOf(Quantity.of(200))).isEqualByComparingTo("12.5");
        assertThat(Quantity.of(5).isWithinRange(BigDecimal.ONE, BigDecimal.TEN)).isTrue();
        assertThat(Quantity.max(List.of(Quantity.of(1), Quantity.of(3), Quantity.of(2)))).isEqualTo(Quantity.of(3));
    }
}
