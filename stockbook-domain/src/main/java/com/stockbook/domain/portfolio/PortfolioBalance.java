package com.stockbook.domain.portfolio;

import com.stockbook.domain.ValidationException;
import com.stockbook.domain.money.CurrencyMismatchException;
import com.stockbook.domain.money.Money;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * End-of-day snapshot of a portfolio. At most one per (portfolio, date).
 */
public final class PortfolioBalance {

    private static final BigDecimal MIN_INDEX_CHANGE = BigDecimal.valueOf(-100);
    private static final BigDecimal MAX_INDEX_CHANGE = BigDecimal.valueOf(100);

    private Long id;
    private final long portfolioId;
    private final LocalDate balanceDate;
    private final Money withdrawals;
    private final Money deposits;
    private final Money finalBalance;
    private BigDecimal indexChange;

    public PortfolioBalance(long portfolioId, LocalDate balanceDate, Money withdrawals, Money deposits,
                            Money finalBalance, BigDecimal indexChange) {
        if (portfolioId <= 0) {
            throw new ValidationException("portfolioId", "Portfolio id must be positive");
        }
        this.portfolioId = portfolioId;
        this.balanceDate = Objects.requireNonNull(balanceDate, "balanceDate");
        this.finalBalance = Objects.requireNonNull(finalBalance, "finalBalance");
        this.withdrawals = withdrawals == null ? Money.zero(finalBalance.currency()) : withdrawals;
        this.deposits = deposits == null ? Money.zero(finalBalance.currency()) : deposits;
        if (this.withdrawals.currency() != finalBalance.currency()) {
            throw new CurrencyMismatchException("record", this.withdrawals.currency(), finalBalance.currency());
        }
        if (this.deposits.currency() != finalBalance.currency()) {
            throw new CurrencyMismatchException("record", this.deposits.currency(), finalBalance.currency());
        }
        if (this.withdrawals.isNegative() || this.deposits.isNegative()) {
            throw new ValidationException("Withdrawals and deposits cannot be negative");
        }
        updateIndexChange(indexChange);
    }

    public static PortfolioBalance restore(long id, long portfolioId, LocalDate balanceDate, Money withdrawals,
                                           Money deposits, Money finalBalance, BigDecimal indexChange) {
        PortfolioBalance b = new PortfolioBalance(portfolioId, balanceDate, withdrawals, deposits, finalBalance, indexChange);
        b.assignId(id);
        return b;
    }

    public void assignId(long newId) {
        if (id != null && id != newId) {
            throw new IllegalStateException("Balance " + portfolioId + "@" + balanceDate + " already has id " + id);
        }
        this.id = newId;
    }

    /** Forgets an id whose insert was rolled back, so the entity can be created again. */
    public void clearId() {
        this.id = null;
    }

    public void updateIndexChange(BigDecimal change) {
        if (change != null && (change.compareTo(MIN_INDEX_CHANGE) < 0 || change.compareTo(MAX_INDEX_CHANGE) > 0)) {
            throw new ValidationException("indexChange", "Index change must be between -100% and 100%");
        }
        this.indexChange = change;
    }

    /** Deposits minus withdrawals; may be negative. */
    public Money netFlow() {
        return deposits.add(withdrawals.negate());
    }

    public boolean hadDeposits() { return deposits.isPositive(); }
    public boolean hadWithdrawals() { return withdrawals.isPositive(); }

    public Long id() { return id; }
    public long portfolioId() { return portfolioId; }
    public LocalDate balanceDate() { return balanceDate; }
    public Money withdrawals() { return withdrawals; }
    public Money deposits() { return deposits; }
    public Money finalBalance() { return finalBalance; }
    public BigDecimal indexChange() { return indexChange; }

    @Override
    public String toString() {
        return "PortfolioBalance(" + portfolioId + "@" + balanceDate + ", " + finalBalance + ")";
    }
}
