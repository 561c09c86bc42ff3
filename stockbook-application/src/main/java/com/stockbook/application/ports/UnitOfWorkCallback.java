package com.stockbook.application.ports;

@FunctionalInterface
public interface UnitOfWorkCallback<T> {
    T apply(UnitOfWork uow);
}
