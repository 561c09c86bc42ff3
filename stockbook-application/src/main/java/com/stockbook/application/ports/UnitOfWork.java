package com.stockbook.application.ports;

import java.util.function.Consumer;

/**
 * Binds one database transaction to the six repositories.
 *
 * <p>A scope is opened with {@link #enter()} and closed with {@link #exit(Throwable)}; scopes nest
 * and share the outermost transaction. The outermost exit commits when no error was reported in
 * any of the nested scopes, and rolls back otherwise.
 *
 * <p>Inside a scope every accessor returns the same repository instance, bound to the scope's
 * connection. Outside a scope the accessors return repositories that run each call in its own
 * short transaction.
 *
 * <p>Instances are not thread-safe; use one per logical transaction.
 */
public interface UnitOfWork {

    StockRepository stocks();

    PortfolioRepository portfolios();

    StockTransactionRepository transactions();

    TargetRepository targets();

    PortfolioBalanceRepository balances();

    JournalRepository journal();

    void enter();

    /**
     * Leaves the current scope. {@code error} is the failure that ended the scope, or null.
     */
    void exit(Throwable error);

    /**
     * Runs {@code work} inside a scope: commit on return, rollback and rethrow on any exception.
     */
    default <T> T execute(UnitOfWorkCallback<T> work) {
        enter();
        T result;
        try {
            result = work.apply(this);
        } catch (RuntimeException | Error e) {
            exit(e);
            throw e;
        }
        exit(null);
        return result;
    }

    default void run(Consumer<UnitOfWork> work) {
        execute(uow -> {
            work.accept(uow);
            return null;
        });
    }

    /** Commits pending work. A second call with nothing pending, or a call outside a scope, is a no-op. */
    void commit();

    /**
     * Discards pending work; entities inserted since the last commit lose their ids. A no-op
     * outside a scope or when nothing is pending.
     */
    void rollback();

    UnitOfWorkState state();

    /** Current nesting level; 0 when idle. */
    int depth();
}
