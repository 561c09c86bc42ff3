package com.stockbook.application.ports;

import java.time.LocalDate;

/** {@code text} matches title or content as a case-insensitive substring. */
public record JournalFilter(Long portfolioId, Long stockId, Long transactionId,
                            LocalDate from, LocalDate to, String text, Integer limit, Integer offset) {

    public static JournalFilter all() {
        return new JournalFilter(null, null, null, null, null, null, null, null);
    }

    public JournalFilter withPortfolio(Long v) { return new JournalFilter(v, stockId, transactionId, from, to, text, limit, offset); }
    public JournalFilter withStock(Long v) { return new JournalFilter(portfolioId, v, transactionId, from, to, text, limit, offset); }
    public JournalFilter withTransaction(Long v) { return new JournalFilter(portfolioId, stockId, v, from, to, text, limit, offset); }
    public JournalFilter between(LocalDate f, LocalDate t) {
        return new JournalFilter(portfolioId, stockId, transactionId, f, t, text, limit, offset);
    }
    public JournalFilter containing(String v) { return new JournalFilter(portfolioId, stockId, transactionId, from, to, v, limit, offset); }
    public JournalFilter page(Integer newLimit, Integer newOffset) {
        return new JournalFilter(portfolioId, stockId, transactionId, from, to, text, newLimit, newOffset);
    }
}
