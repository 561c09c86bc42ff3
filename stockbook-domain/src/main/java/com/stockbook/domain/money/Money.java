package com.stockbook.domain.money;

import com.stockbook.domain.ValidationException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable monetary amount in one of the supported currencies.
 *
 * The amount is always held at 2 fractional digits (HALF_UP). Arithmetic between
 * different currencies is rejected with {@link CurrencyMismatchException}.
 */
public final class Money implements Comparable<Money> {

    public static final int SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private static final Map<String, CurrencyCode> SYMBOLS = Map.of(
            "C$", CurrencyCode.CAD,
            "$", CurrencyCode.USD,
            "€", CurrencyCode.EUR,
            "£", CurrencyCode.GBP,
            "¥", CurrencyCode.JPY
    );

    private final BigDecimal amount;
    private final CurrencyCode currency;

    private Money(BigDecimal amount, CurrencyCode currency) {
        Objects.requireNonNull(amount, "amount");
        this.currency = Objects.requireNonNull(currency, "currency");
        this.amount = amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static Money of(BigDecimal amount, CurrencyCode currency) {
        return new Money(amount, currency);
    }

    public static Money of(BigDecimal amount, String currency) {
        return new Money(amount, CurrencyCode.parse(currency));
    }

    public static Money of(String amount, String currency) {
        return new Money(parseAmount(amount), CurrencyCode.parse(currency));
    }

    public static Money of(String amount, CurrencyCode currency) {
        return new Money(parseAmount(amount), currency);
    }

    public static Money of(long amount, CurrencyCode currency) {
        return new Money(BigDecimal.valueOf(amount), currency);
    }

    public static Money zero(CurrencyCode currency) {
        return new Money(BigDecimal.ZERO, currency);
    }

    public static Money ofCents(long cents, CurrencyCode currency) {
        return new Money(BigDecimal.valueOf(cents, SCALE), currency);
    }

    /**
     * Parses "$125.50", "€99.99", "C$10" or a bare number (USD).
     */
    public static Money parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("amount", "Cannot parse money from empty text");
        }
        String v = text.trim();
        CurrencyCode currency = CurrencyCode.USD;
        // C$ must win over $
        if (v.startsWith("C$")) {
            currency = SYMBOLS.get("C$");
            v = v.substring(2);
        } else if (!v.isEmpty() && SYMBOLS.containsKey(v.substring(0, 1))) {
            currency = SYMBOLS.get(v.substring(0, 1));
            v = v.substring(1);
        }
        return new Money(parseAmount(v.trim()), currency);
    }

    /**
     * Sums a list of same-currency amounts. An empty list yields zero in {@code currency}.
     */
    public static Money sum(List<Money> values, CurrencyCode currency) {
        Objects.requireNonNull(currency, "currency");
        Money total = zero(currency);
        if (values == null) return total;
        for (Money m : values) {
            total = total.add(m);
        }
        return total;
    }

    public BigDecimal amount() { return amount; }
    public CurrencyCode currency() { return currency; }

    public Money add(Money other) {
        requireSameCurrency(other, "add");
        return new Money(amount.add(other.amount), currency);
    }

    /**
     * @throws NegativeResultException if the difference would be below zero
     */
    public Money subtract(Money other) {
        requireSameCurrency(other, "subtract");
        BigDecimal result = amount.subtract(other.amount);
        if (result.signum() < 0) {
            throw new NegativeResultException("Subtracting " + other + " from " + this + " gives a negative amount");
        }
        return new Money(result, currency);
    }

    public Money multiply(BigDecimal factor) {
        Objects.requireNonNull(factor, "factor");
        return new Money(amount.multiply(factor), currency);
    }

    public Money multiply(long factor) {
        return multiply(BigDecimal.valueOf(factor));
    }

    public Money divide(BigDecimal divisor) {
        Objects.requireNonNull(divisor, "divisor");
        if (divisor.signum() == 0) throw new DivisionByZeroException("money");
        return new Money(amount.divide(divisor, MathContext.DECIMAL64), currency);
    }

    public Money divide(long divisor) {
        return divide(BigDecimal.valueOf(divisor));
    }

    public Money negate() {
        return new Money(amount.negate(), currency);
    }

    public Money abs() {
        return new Money(amount.abs(), currency);
    }

    /** {@code percent} of this amount, e.g. percentage(15) of 200.00 is 30.00. */
    public Money percentage(BigDecimal percent) {
        Objects.requireNonNull(percent, "percent");
        return new Money(amount.multiply(percent).divide(HUNDRED, MathContext.DECIMAL64), currency);
    }

    public Money percentage(long percent) {
        return percentage(BigDecimal.valueOf(percent));
    }

    /**
     * Rounds to {@code decimalPlaces} (HALF_UP). Places beyond the currency precision keep the
     * amount as is.
     */
    public Money roundToCurrencyPrecision(int decimalPlaces) {
        if (decimalPlaces < 0) {
            throw new ValidationException("decimalPlaces", "Decimal places must be non-negative");
        }
        if (decimalPlaces >= SCALE) return this;
        return new Money(amount.setScale(decimalPlaces, RoundingMode.HALF_UP), currency);
    }

    public Money roundToCurrencyPrecision() {
        return roundToCurrencyPrecision(SCALE);
    }

    /**
     * Splits this amount proportionally to {@code ratios}.
     *
     * Every part but the last is {@code round(amount * r / sum(r))}; the last one receives
     * whatever is left, so the parts always add up to this amount exactly.
     */
    public List<Money> allocate(List<? extends Number> ratios) {
        if (ratios == null || ratios.isEmpty()) return Collections.emptyList();

        List<BigDecimal> rs = new ArrayList<>(ratios.size());
        BigDecimal totalRatio = BigDecimal.ZERO;
        for (Number n : ratios) {
            BigDecimal r = toDecimal(n);
            if (r.signum() < 0) {
                throw new ValidationException("ratios", "Allocation ratios must be non-negative: " + n);
            }
            rs.add(r);
            totalRatio = totalRatio.add(r);
        }

        List<Money> parts = new ArrayList<>(rs.size());
        if (totalRatio.signum() == 0) {
            for (int i = 0; i < rs.size(); i++) parts.add(zero(currency));
            return parts;
        }

        BigDecimal remaining = amount;
        for (int i = 0; i < rs.size() - 1; i++) {
            BigDecimal portion = amount.multiply(rs.get(i))
                    .divide(totalRatio, SCALE, RoundingMode.HALF_UP);
            parts.add(new Money(portion, currency));
            remaining = remaining.subtract(portion);
        }
        parts.add(new Money(remaining, currency));
        return parts;
    }

    public boolean isZero() { return amount.signum() == 0; }
    public boolean isPositive() { return amount.signum() > 0; }
    public boolean isNegative() { return amount.signum() < 0; }

    public boolean isGreaterThan(Money other) { return compareTo(other) > 0; }
    public boolean isGreaterThanOrEqual(Money other) { return compareTo(other) >= 0; }
    public boolean isLessThan(Money other) { return compareTo(other) < 0; }
    public boolean isLessThanOrEqual(Money other) { return compareTo(other) <= 0; }

    public long toCents() {
        return amount.movePointRight(SCALE).longValueExact();
    }

    @Override
    public int compareTo(Money other) {
        requireSameCurrency(other, "compare");
        return amount.compareTo(other.amount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Money other)) return false;
        return currency == other.currency && amount.equals(other.amount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, currency);
    }

    @Override
    public String toString() {
        return amount.toPlainString() + " " + currency;
    }

    private void requireSameCurrency(Money other, String operation) {
        Objects.requireNonNull(other, "other");
        if (currency != other.currency) {
            throw new CurrencyMismatchException(operation, currency, other.currency);
        }
    }

    private static BigDecimal parseAmount(String amount) {
        if (amount == null || amount.isBlank()) {
            throw new ValidationException("amount", "Amount cannot be empty");
        }
        try {
            return new BigDecimal(amount.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("amount", "Amount must be numeric: " + amount);
        }
    }

    static BigDecimal toDecimal(Number n) {
        Objects.requireNonNull(n, "ratio");
        if (n instanceof BigDecimal bd) return bd;
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte) {
            return BigDecimal.valueOf(n.longValue());
        }
        try {
            return new BigDecimal(n.toString());
        } catch (NumberFormatException e) {
            throw new ValidationException("ratios", "Ratio must be a finite number: " + n);
        }
    }
}
