package com.stockbook.infrastructure.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Runs work on a connection borrowed from a unit of work. {@code beforeWork} lets the owner
 * check that its scope is still open and track that something was written or read;
 * {@code rollbackHooks} receives the undo actions of inserts made on this connection.
 */
public final class TransactionalConnectionHandle implements ConnectionHandle {

    private final Connection connection;
    private final Runnable beforeWork;
    private final Consumer<Runnable> rollbackHooks;

    public TransactionalConnectionHandle(Connection connection, Runnable beforeWork, Consumer<Runnable> rollbackHooks) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.beforeWork = beforeWork == null ? () -> { } : beforeWork;
        this.rollbackHooks = Objects.requireNonNull(rollbackHooks, "rollbackHooks");
    }

    @Override
    public <T> T execute(String operation, SqlWork<T> work) {
        beforeWork.run();
        try {
            return work.apply(connection);
        } catch (SQLException e) {
            throw SqlErrors.translate(operation, e);
        }
    }

    @Override
    public boolean isTransactional() {
        return true;
    }

    @Override
    public void onRollback(Runnable undo) {
        rollbackHooks.accept(undo);
    }
}
