package com.stockbook.application.ports;

import java.time.LocalDate;

public record BalanceFilter(Long portfolioId, LocalDate from, LocalDate to, Integer limit, Integer offset) {

    public static BalanceFilter all() {
        return new BalanceFilter(null, null, null, null, null);
    }

    public static BalanceFilter forPortfolio(long portfolioId) {
        return all().withPortfolio(portfolioId);
    }

    public BalanceFilter withPortfolio(Long v) { return new BalanceFilter(v, from, to, limit, offset); }
    public BalanceFilter between(LocalDate f, LocalDate t) { return new BalanceFilter(portfolioId, f, t, limit, offset); }
    public BalanceFilter page(Integer newLimit, Integer newOffset) {
        return new BalanceFilter(portfolioId, from, to, newLimit, newOffset);
    }
}
