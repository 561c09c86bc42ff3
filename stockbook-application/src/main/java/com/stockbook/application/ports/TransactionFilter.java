package com.stockbook.application.ports;

import com.stockbook.domain.trade.TransactionType;

import java.time.LocalDate;

/** Date bounds are inclusive. */
public record TransactionFilter(Long portfolioId, Long stockId, TransactionType type,
                                LocalDate from, LocalDate to, Integer limit, Integer offset) {

    public static TransactionFilter all() {
        return new TransactionFilter(null, null, null, null, null, null, null);
    }

    public static TransactionFilter forPosition(long portfolioId, long stockId) {
        return all().withPortfolio(portfolioId).withStock(stockId);
    }

    public TransactionFilter withPortfolio(Long v) { return new TransactionFilter(v, stockId, type, from, to, limit, offset); }
    public TransactionFilter withStock(Long v) { return new TransactionFilter(portfolioId, v, type, from, to, limit, offset); }
    public TransactionFilter withType(TransactionType v) { return new TransactionFilter(portfolioId, stockId, v, from, to, limit, offset); }
    public TransactionFilter between(LocalDate f, LocalDate t) {
        return new TransactionFilter(portfolioId, stockId, type, f, t, limit, offset);
    }
    public TransactionFilter page(Integer newLimit, Integer newOffset) {
        return new TransactionFilter(portfolioId, stockId, type, from, to, newLimit, newOffset);
    }
}
