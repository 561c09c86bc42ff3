package com.stockbook.domain.target;

import com.stockbook.domain.ValidationException;
import com.stockbook.domain.money.Money;
import com.stockbook.domain.util.Texts;

import java.util.Objects;

/**
 * Price plan for a stock in a portfolio: buy around the pivot, give up below the failure price.
 */
public final class Target {

    public static final int MAX_NOTES = 1000;

    private Long id;
    private final long stockId;
    private final long portfolioId;
    private final Money pivotPrice;
    private final Money failurePrice;
    private String notes;
    private TargetStatus status;

    public Target(long stockId, long portfolioId, Money pivotPrice, Money failurePrice, String notes, TargetStatus status) {
        if (stockId <= 0) throw new ValidationException("stockId", "Stock id must be positive");
        if (portfolioId <= 0) throw new ValidationException("portfolioId", "Portfolio id must be positive");
        Objects.requireNonNull(pivotPrice, "pivotPrice");
        Objects.requireNonNull(failurePrice, "failurePrice");
        if (!pivotPrice.isPositive() || !failurePrice.isPositive()) {
            throw new ValidationException("Target prices must be positive");
        }
        if (!pivotPrice.isGreaterThan(failurePrice)) {
            throw new ValidationException("pivotPrice", "pivot must exceed failure");
        }
        this.stockId = stockId;
        this.portfolioId = portfolioId;
        this.pivotPrice = pivotPrice;
        this.failurePrice = failurePrice;
        this.status = status == null ? TargetStatus.ACTIVE : status;
        updateNotes(notes);
    }

    public static Target restore(long id, long stockId, long portfolioId, Money pivotPrice, Money failurePrice,
                                 String notes, TargetStatus status) {
        Target t = new Target(stockId, portfolioId, pivotPrice, failurePrice, notes, status);
        t.assignId(id);
        return t;
    }

    public void assignId(long newId) {
        if (id != null && id != newId) {
            throw new IllegalStateException("Target already has id " + id);
        }
        this.id = newId;
    }

    /** Forgets an id whose insert was rolled back, so the entity can be created again. */
    public void clearId() {
        this.id = null;
    }

    public void activate() { this.status = TargetStatus.ACTIVE; }
    public void markHit() { this.status = TargetStatus.HIT; }
    public void markFailed() { this.status = TargetStatus.FAILED; }
    public void cancel() { this.status = TargetStatus.CANCELLED; }

    public void updateNotes(String newNotes) {
        this.notes = Texts.maxLength("notes", Texts.trimToEmpty(newNotes), MAX_NOTES);
    }

    public boolean isActive() { return status == TargetStatus.ACTIVE; }

    public Long id() { return id; }
    public long stockId() { return stockId; }
    public long portfolioId() { return portfolioId; }
    public Money pivotPrice() { return pivotPrice; }
    public Money failurePrice() { return failurePrice; }
    public String notes() { return notes; }
    public TargetStatus status() { return status; }

    @Override
    public String toString() {
        return "Target(stock=" + stockId + ", pivot=" + pivotPrice + ", failure=" + failurePrice + ", " + status.code() + ")";
    }
}
