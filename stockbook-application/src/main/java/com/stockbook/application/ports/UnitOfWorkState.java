package com.stockbook.application.ports;

public enum UnitOfWorkState {
    IDLE,
    ACTIVE,
    COMMITTED,
    ROLLED_BACK
}
