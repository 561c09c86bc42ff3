package com.stockbook.application.ports;

/** Creates one coordinator per logical transaction. */
public interface UnitOfWorkFactory {
    UnitOfWork create();
}
