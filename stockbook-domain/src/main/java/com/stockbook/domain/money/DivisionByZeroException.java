package com.stockbook.domain.money;

import com.stockbook.domain.DomainException;

public final class DivisionByZeroException extends DomainException {

    public DivisionByZeroException(String what) {
        super("Cannot divide " + what + " by zero");
    }
}
