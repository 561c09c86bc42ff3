package com.stockbook.domain.money;

import com.stockbook.domain.DomainException;

public final class CurrencyMismatchException extends DomainException {

    private final CurrencyCode left;
    private final CurrencyCode right;

    public CurrencyMismatchException(String operation, CurrencyCode left, CurrencyCode right) {
        super("Cannot " + operation + " money with different currencies: " + left + " and " + right);
        this.left = left;
        this.right = right;
    }

    public CurrencyCode left() { return left; }
    public CurrencyCode right() { return right; }
}
