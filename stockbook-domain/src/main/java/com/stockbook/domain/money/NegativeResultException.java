package com.stockbook.domain.money;

import com.stockbook.domain.DomainException;

/**
 * Raised when subtraction would leave a value below zero where negatives are not allowed.
 */
public final class NegativeResultException extends DomainException {

    public NegativeResultException(String message) {
        super(message);
    }
}
