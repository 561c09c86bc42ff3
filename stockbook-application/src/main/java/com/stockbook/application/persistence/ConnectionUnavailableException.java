package com.stockbook.application.persistence;

public class ConnectionUnavailableException extends PersistenceException {

    public ConnectionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
