package com.stockbook.domain.trade;

import com.stockbook.domain.ValidationException;
import com.stockbook.domain.money.Money;
import com.stockbook.domain.money.Quantity;
import com.stockbook.domain.util.Texts;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A buy or sell of one stock inside one portfolio. Immutable apart from its id and notes.
 */
public final class StockTransaction {

    public static final int MAX_NOTES = 1000;

    private Long id;
    private final long portfolioId;
    private final long stockId;
    private final TransactionType type;
    private final Quantity quantity;
    private final Money price;
    private final LocalDate transactionDate;
    private String notes;

    public StockTransaction(long portfolioId, long stockId, TransactionType type, Quantity quantity,
                            Money price, LocalDate transactionDate, String notes) {
        if (portfolioId <= 0) throw new ValidationException("portfolioId", "Portfolio id must be positive");
        if (stockId <= 0) throw new ValidationException("stockId", "Stock id must be positive");
        this.type = Objects.requireNonNull(type, "type");
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.price = Objects.requireNonNull(price, "price");
        this.transactionDate = Objects.requireNonNull(transactionDate, "transactionDate");
        if (!quantity.isPositive()) {
            throw new ValidationException("quantity", "Quantity must be positive");
        }
        if (!price.isPositive()) {
            throw new ValidationException("price", "Price must be positive");
        }
        if (transactionDate.isAfter(LocalDate.now())) {
            throw new ValidationException("transactionDate", "Transaction date cannot be in the future: " + transactionDate);
        }
        this.portfolioId = portfolioId;
        this.stockId = stockId;
        updateNotes(notes);
    }

    public static StockTransaction buy(long portfolioId, long stockId, Quantity quantity, Money price, LocalDate date) {
        return new StockTransaction(portfolioId, stockId, TransactionType.BUY, quantity, price, date, null);
    }

    public static StockTransaction sell(long portfolioId, long stockId, Quantity quantity, Money price, LocalDate date) {
        return new StockTransaction(portfolioId, stockId, TransactionType.SELL, quantity, price, date, null);
    }

    public static StockTransaction restore(long id, long portfolioId, long stockId, TransactionType type,
                                           Quantity quantity, Money price, LocalDate date, String notes) {
        StockTransaction t = new StockTransaction(portfolioId, stockId, type, quantity, price, date, notes);
        t.assignId(id);
        return t;
    }

    public void assignId(long newId) {
        if (id != null && id != newId) {
            throw new IllegalStateException("Transaction already has id " + id);
        }
        this.id = newId;
    }

    /** Forgets an id whose insert was rolled back, so the entity can be created again. */
    public void clearId() {
        this.id = null;
    }

    public void updateNotes(String newNotes) {
        this.notes = Texts.maxLength("notes", Texts.trimToEmpty(newNotes), MAX_NOTES);
    }

    /** price * quantity */
    public Money totalValue() {
        return price.multiply(quantity.value());
    }

    public boolean isBuy() { return type == TransactionType.BUY; }
    public boolean isSell() { return type == TransactionType.SELL; }

    public Long id() { return id; }
    public long portfolioId() { return portfolioId; }
    public long stockId() { return stockId; }
    public TransactionType type() { return type; }
    public Quantity quantity() { return quantity; }
    public Money price() { return price; }
    public LocalDate transactionDate() { return transactionDate; }
    public String notes() { return notes; }

    @Override
    public String toString() {
        return "StockTransaction(" + type.code() + " " + quantity + " @ " + price + " on " + transactionDate + ")";
    }
}
