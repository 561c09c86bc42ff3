package com.stockbook.infrastructure.db;

import java.util.Objects;

public final class StandaloneConnectionHandle implements ConnectionHandle {

    private final Database database;

    public StandaloneConnectionHandle(Database database) {
        this.database = Objects.requireNonNull(database, "database");
    }

    @Override
    public <T> T execute(String operation, SqlWork<T> work) {
        return database.withinTransaction(operation, work);
    }

    @Override
    public boolean isTransactional() {
        return false;
    }

    @Override
    public void onRollback(Runnable undo) {
        // committed already
    }
}
