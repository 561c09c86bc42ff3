package com.stockbook.domain.money;

import com.stockbook.domain.ValidationException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable share count.
 *
 * Non-negative by default; {@link #signed(BigDecimal)} creates an instance that tolerates
 * negative values (adjustment entries). Results inherit the sign policy of the receiver.
 */
public final class Quantity implements Comparable<Quantity> {

    private static final int PART_SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal value;
    private final boolean allowNegative;

    private Quantity(BigDecimal value, boolean allowNegative) {
        Objects.requireNonNull(value, "value");
        if (!allowNegative && value.signum() < 0) {
            throw new ValidationException("quantity", "Quantity cannot be negative: " + value.toPlainString());
        }
        this.value = normalize(value);
        this.allowNegative = allowNegative;
    }

    public static Quantity of(long value) {
        return new Quantity(BigDecimal.valueOf(value), false);
    }

    public static Quantity of(BigDecimal value) {
        return new Quantity(value, false);
    }

    public static Quantity of(String value) {
        return new Quantity(parse(value), false);
    }

    public static Quantity signed(BigDecimal value) {
        return new Quantity(value, true);
    }

    public static Quantity signed(long value) {
        return new Quantity(BigDecimal.valueOf(value), true);
    }

    public static Quantity zero() { return of(0); }
    public static Quantity one() { return of(1); }

    public static Quantity sum(List<Quantity> quantities) {
        Quantity total = zero();
        if (quantities == null) return total;
        for (Quantity q : quantities) total = total.add(q);
        return total;
    }

    public static Quantity max(List<Quantity> quantities) {
        if (quantities == null || quantities.isEmpty()) {
            throw new ValidationException("quantities", "Cannot find max of empty list");
        }
        return Collections.max(quantities);
    }

    public static Quantity min(List<Quantity> quantities) {
        if (quantities == null || quantities.isEmpty()) {
            throw new ValidationException("quantities", "Cannot find min of empty list");
        }
        return Collections.min(quantities);
    }

    public BigDecimal value() { return value; }
    public boolean allowsNegative() { return allowNegative; }

    public Quantity add(Quantity other) {
        Objects.requireNonNull(other, "other");
        return derive(value.add(other.value));
    }

    /**
     * @throws NegativeResultException when the remainder drops below zero and negatives are not enabled
     */
    public Quantity subtract(Quantity other) {
        Objects.requireNonNull(other, "other");
        BigDecimal result = value.subtract(other.value);
        if (!allowNegative && result.signum() < 0) {
            throw new NegativeResultException("Resulting quantity cannot be negative: "
                    + value.toPlainString() + " - " + other.value.toPlainString());
        }
        return derive(result);
    }

    public Quantity multiply(BigDecimal factor) {
        Objects.requireNonNull(factor, "factor");
        return derive(value.multiply(factor));
    }

    public Quantity multiply(long factor) {
        return multiply(BigDecimal.valueOf(factor));
    }

    /** Fractional division, e.g. for ratio-based allocations. */
    public Quantity divide(BigDecimal divisor) {
        Objects.requireNonNull(divisor, "divisor");
        if (divisor.signum() == 0) throw new DivisionByZeroException("quantity");
        return derive(value.divide(divisor, MathContext.DECIMAL64));
    }

    public Quantity divide(long divisor) {
        return divide(BigDecimal.valueOf(divisor));
    }

    /**
     * Division in whole units (share counts).
     *
     * @throws NonWholeQuantityException if the result has a fractional part
     */
    public Quantity divideWhole(BigDecimal divisor) {
        Objects.requireNonNull(divisor, "divisor");
        if (divisor.signum() == 0) throw new DivisionByZeroException("quantity");
        BigDecimal[] qr = value.divideAndRemainder(divisor);
        if (qr[1].signum() != 0) {
            throw new NonWholeQuantityException(value.toPlainString() + " is not divisible into whole units by "
                    + divisor.toPlainString());
        }
        return derive(qr[0]);
    }

    public Quantity divideWhole(long divisor) {
        return divideWhole(BigDecimal.valueOf(divisor));
    }

    /**
     * Splits into {@code parts} near-equal pieces. Each piece but the last is
     * {@code value / parts} truncated to 2 decimals; the last receives the remainder.
     */
    public List<Quantity> split(int parts) {
        if (parts <= 0) {
            throw new ValidationException("parts", "Number of parts must be positive");
        }
        if (parts == 1) return List.of(this);

        BigDecimal base = value.divide(BigDecimal.valueOf(parts), PART_SCALE, RoundingMode.DOWN);
        List<Quantity> out = new ArrayList<>(parts);
        BigDecimal allocated = BigDecimal.ZERO;
        for (int i = 0; i < parts - 1; i++) {
            out.add(derive(base));
            allocated = allocated.add(base);
        }
        out.add(derive(value.subtract(allocated)));
        return out;
    }

    /**
     * Distributes proportionally to {@code ratios}; last part takes the remainder so the
     * parts add up to this quantity exactly.
     */
    public List<Quantity> distributeByRatio(List<? extends Number> ratios) {
        if (ratios == null || ratios.isEmpty()) return Collections.emptyList();

        List<BigDecimal> rs = new ArrayList<>(ratios.size());
        BigDecimal total = BigDecimal.ZERO;
        for (Number n : ratios) {
            BigDecimal r = Money.toDecimal(n);
            if (r.signum() < 0) {
                throw new ValidationException("ratios", "Ratios must be non-negative: " + n);
            }
            rs.add(r);
            total = total.add(r);
        }

        List<Quantity> out = new ArrayList<>(rs.size());
        if (total.signum() == 0) {
            for (int i = 0; i < rs.size(); i++) out.add(derive(BigDecimal.ZERO));
            return out;
        }

        BigDecimal remaining = value;
        for (int i = 0; i < rs.size() - 1; i++) {
            BigDecimal portion = value.multiply(rs.get(i)).divide(total, PART_SCALE, RoundingMode.DOWN);
            out.add(derive(portion));
            remaining = remaining.subtract(portion);
        }
        out.add(derive(remaining));
        return out;
    }

    public Quantity negate() {
        if (!allowNegative) {
            throw new NegativeResultException("Negation would result in negative quantity");
        }
        return derive(value.negate());
    }

    public Quantity abs() {
        return derive(value.abs());
    }

    public Quantity round(int decimalPlaces) {
        if (decimalPlaces < 0) {
            throw new ValidationException("decimalPlaces", "Decimal places must be non-negative");
        }
        return derive(value.setScale(decimalPlaces, RoundingMode.HALF_UP));
    }

    public Quantity floor() {
        return derive(value.setScale(0, RoundingMode.FLOOR));
    }

    public Quantity ceiling() {
        return derive(value.setScale(0, RoundingMode.CEILING));
    }

    /** Percentage of {@code total} this quantity represents; zero when total is zero. */
    public BigDecimal percentageOf(Quantity total) {
        Objects.requireNonNull(total, "total");
        if (total.isZero()) return BigDecimal.ZERO;
        return value.multiply(HUNDRED).divide(total.value, MathContext.DECIMAL64);
    }

    public boolean isWithinRange(BigDecimal min, BigDecimal max) {
        return value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
    }

    public boolean isZero() { return value.signum() == 0; }
    public boolean isPositive() { return value.signum() > 0; }
    public boolean isNegative() { return value.signum() < 0; }

    public boolean isWhole() {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }

    public boolean isGreaterThan(Quantity other) { return compareTo(other) > 0; }
    public boolean isLessThan(Quantity other) { return compareTo(other) < 0; }

    @Override
    public int compareTo(Quantity other) {
        Objects.requireNonNull(other, "other");
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Quantity other)) return false;
        return value.compareTo(other.value) == 0;
    }

    @Override
    public int hashCode() {
        return value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return value.toPlainString();
    }

    private Quantity derive(BigDecimal v) {
        return new Quantity(v, allowNegative);
    }

    // strip trailing zeros but never go to exponent form for whole numbers (e.g. 100 -> 1E+2)
    private static BigDecimal normalize(BigDecimal v) {
        BigDecimal s = v.stripTrailingZeros();
        return s.scale() < 0 ? s.setScale(0, RoundingMode.UNNECESSARY) : s;
    }

    private static BigDecimal parse(String v) {
        if (v == null || v.isBlank()) {
            throw new ValidationException("quantity", "Quantity cannot be empty");
        }
        try {
            return new BigDecimal(v.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("quantity", "Quantity must be numeric: " + v);
        }
    }
}
