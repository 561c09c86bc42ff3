package com.stockbook.domain.target;

import com.stockbook.domain.ValidationException;
import com.stockbook.domain.money.CurrencyCode;
import com.stockbook.domain.money.Money;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TargetTest {

    private static Money usd(long v) {
        return Money.of(v, CurrencyCode.USD);
    }

    @Test
    void pivotMustExceedFailure() {
        assertThatThrownBy(() -> new Target(1, 1, usd(100), usd(150), null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("pivot must exceed failure");
        assertThatThrownBy(() -> new Target(1, 1, usd(100), usd(100), null, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void defaultsToActiveAndMovesThroughStatuses() {
        Target t = new Target(1, 2, usd(150), usd(100), "breakout", null);
        assertThat(t.status()).isEqualTo(TargetStatus.ACTIVE);
        assertThat(t.isActive()).isTrue();

        t.markHit();
        assertThat(t.status()).isEqualTo(TargetStatus.HIT);
        t.cancel();
        assertThat(t.status().code()).isEqualTo("cancelled");
        assertThat(t.isActive()).isFalse();
    }

    @Test
    void statusCodes() {
        assertThat(TargetStatus.fromCode("FAILED")).isEqualTo(TargetStatus.FAILED);
        assertThat(TargetStatus.fromCode(null)).isEqualTo(TargetStatus.ACTIVE);
        assertThatThrownBy(() -> TargetStatus.fromCode("done")).isInstanceOf(ValidationException.class);
    }
}
