package com.stockbook.domain.portfolio;

import com.stockbook.domain.ValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PortfolioTest {

    @Test
    void nameIsRequiredAndBounded() {
        assertThatThrownBy(() -> new Portfolio("  ", null, 10, BigDecimal.ONE, true))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new Portfolio("p".repeat(101), null, 10, BigDecimal.ONE, true))
                .isInstanceOf(ValidationException.class);

        Portfolio p = new Portfolio("  Growth ", null, 10, BigDecimal.ONE, true);
        assertThat(p.name()).isEqualTo("Growth");
        assertThat(p.description()).isEmpty();
    }

    @Test
    void limitsMustBePositive() {
        assertThatThrownBy(() -> new Portfolio("Growth", null, 0, BigDecimal.ONE, true))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new Portfolio("Growth", null, 5, BigDecimal.ZERO, true))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void deactivate() {
        Portfolio p = new Portfolio("Growth", "long only", 10, new BigDecimal("2.0"), true);
        p.deactivate();
        assertThat(p.isActive()).isFalse();
    }
}
