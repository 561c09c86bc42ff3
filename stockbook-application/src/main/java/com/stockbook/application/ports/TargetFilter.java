package com.stockbook.application.ports;

import com.stockbook.domain.target.TargetStatus;

public record TargetFilter(Long portfolioId, Long stockId, TargetStatus status, Integer limit, Integer offset) {

    public static TargetFilter all() {
        return new TargetFilter(null, null, null, null, null);
    }

    public TargetFilter withPortfolio(Long v) { return new TargetFilter(v, stockId, status, limit, offset); }
    public TargetFilter withStock(Long v) { return new TargetFilter(portfolioId, v, status, limit, offset); }
    public TargetFilter withStatus(TargetStatus v) { return new TargetFilter(portfolioId, stockId, v, limit, offset); }
    public TargetFilter page(Integer newLimit, Integer newOffset) {
        return new TargetFilter(portfolioId, stockId, status, newLimit, newOffset);
    }
}
