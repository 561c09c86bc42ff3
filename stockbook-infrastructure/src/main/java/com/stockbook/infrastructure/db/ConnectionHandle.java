package com.stockbook.infrastructure.db;

/**
 * What a repository runs its SQL through.
 *
 * <p>A standalone handle gives every call its own short transaction. A transactional handle
 * runs on a connection owned by a unit of work and never commits, rolls back or closes it.
 * Either way, SQL failures come out as {@link com.stockbook.application.persistence.PersistenceException}.
 */
public interface ConnectionHandle {

    <T> T execute(String operation, SqlWork<T> work);

    boolean isTransactional();

    /**
     * Registers {@code undo} to run if the work done so far is rolled back. Standalone handles
     * have already committed when {@link #execute} returns and ignore it.
     */
    void onRollback(Runnable undo);
}
