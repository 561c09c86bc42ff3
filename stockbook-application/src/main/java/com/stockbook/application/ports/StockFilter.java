package com.stockbook.application.ports;

import com.stockbook.domain.stock.Grade;

/**
 * Stock search criteria. Null fields are ignored; text fields match case-insensitive substrings.
 */
public record StockFilter(String symbol, String name, String industryGroup, Grade grade,
                          Integer limit, Integer offset) {

    public static StockFilter all() {
        return new StockFilter(null, null, null, null, null, null);
    }

    public StockFilter withSymbol(String v) { return new StockFilter(v, name, industryGroup, grade, limit, offset); }
    public StockFilter withName(String v) { return new StockFilter(symbol, v, industryGroup, grade, limit, offset); }
    public StockFilter withIndustryGroup(String v) { return new StockFilter(symbol, name, v, grade, limit, offset); }
    public StockFilter withGrade(Grade v) { return new StockFilter(symbol, name, industryGroup, v, limit, offset); }
    public StockFilter page(Integer newLimit, Integer newOffset) {
        return new StockFilter(symbol, name, industryGroup, grade, newLimit, newOffset);
    }
}
