package com.stockbook.application.ports;

public record PortfolioFilter(String name, Boolean active, Integer limit, Integer offset) {

    public static PortfolioFilter all() {
        return new PortfolioFilter(null, null, null, null);
    }

    public static PortfolioFilter activeOnly() {
        return all().withActive(true);
    }

    public PortfolioFilter withName(String v) { return new PortfolioFilter(v, active, limit, offset); }
    public PortfolioFilter withActive(Boolean v) { return new PortfolioFilter(name, v, limit, offset); }
    public PortfolioFilter page(Integer newLimit, Integer newOffset) {
        return new PortfolioFilter(name, active, newLimit, newOffset);
    }
}
