package com.stockbook.domain.money;

import com.stockbook.domain.DomainException;

public final class NonWholeQuantityException extends DomainException {

    public NonWholeQuantityException(String message) {
        super(message);
    }
}
