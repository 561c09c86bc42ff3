package com.stockbook.infrastructure.uow;

import com.stockbook.application.config.BusinessRules;
import com.stockbook.application.persistence.TransactionException;
import com.stockbook.application.ports.JournalRepository;
import com.stockbook.application.ports.PortfolioBalanceRepository;
import com.stockbook.application.ports.PortfolioRepository;
import com.stockbook.application.ports.StockRepository;
import com.stockbook.application.ports.StockTransactionRepository;
import com.stockbook.application.ports.TargetRepository;
import com.stockbook.application.ports.UnitOfWork;
import com.stockbook.application.ports.UnitOfWorkState;
import com.stockbook.domain.money.CurrencyCode;
import com.stockbook.infrastructure.db.ConnectionHandle;
import com.stockbook.infrastructure.db.Database;
import com.stockbook.infrastructure.db.SqlErrors;
import com.stockbook.infrastructure.db.SqliteJournalRepository;
import com.stockbook.infrastructure.db.SqlitePortfolioBalanceRepository;
import com.stockbook.infrastructure.db.SqlitePortfolioRepository;
import com.stockbook.infrastructure.db.SqliteStockRepository;
import com.stockbook.infrastructure.db.SqliteStockTransactionRepository;
import com.stockbook.infrastructure.db.SqliteTargetRepository;
import com.stockbook.infrastructure.db.StandaloneConnectionHandle;
import com.stockbook.infrastructure.db.TransactionalConnectionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Unit of work over one SQLite connection.
 *
 * <p>The outermost {@link #enter()} acquires the connection and starts a transaction; nested
 * entries only bump the depth. The outermost {@link #exit(Throwable)} commits, or rolls back
 * when an error was reported at any depth, then closes the connection and drops the scoped
 * repositories.
 *
 * <p>After an explicit {@link #commit()} or {@link #rollback()} the scope stays open: the next
 * repository call starts a new transaction on the same connection.
 *
 * <p>Entities inserted in a transaction that is rolled back lose their ids again, so the same
 * instance can be created later. Outside a scope {@link #commit()} and {@link #rollback()} do nothing.
 *
 * <p>Not thread-safe.
 */
public class SqliteUnitOfWork implements UnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(SqliteUnitOfWork.class);

    private final Database database;
    private final CurrencyCode currency;
    private final ConnectionHandle standalone;

    private Connection connection;
    private int depth;
    private UnitOfWorkState state = UnitOfWorkState.IDLE;
    private boolean rollbackOnly;
    private final List<Runnable> uncommittedInserts = new ArrayList<>();

    private StockRepository stocks;
    private PortfolioRepository portfolios;
    private StockTransactionRepository transactions;
    private TargetRepository targets;
    private PortfolioBalanceRepository balances;
    private JournalRepository journal;

    public SqliteUnitOfWork(Database database, BusinessRules rules) {
        this.database = Objects.requireNonNull(database, "database");
        this.currency = Objects.requireNonNull(rules, "rules").currency();
        this.standalone = new StandaloneConnectionHandle(database);
    }

    // ------------------------------------------------------------------ repositories

    @Override
    public StockRepository stocks() {
        if (depth == 0) return new SqliteStockRepository(standalone, currency);
        if (stocks == null) stocks = scoped(h -> new SqliteStockRepository(h, currency));
        return stocks;
    }

    @Override
    public PortfolioRepository portfolios() {
        if (depth == 0) return new SqlitePortfolioRepository(standalone, currency);
        if (portfolios == null) portfolios = scoped(h -> new SqlitePortfolioRepository(h, currency));
        return portfolios;
    }

    @Override
    public StockTransactionRepository transactions() {
        if (depth == 0) return new SqliteStockTransactionRepository(standalone, currency);
        if (transactions == null) transactions = scoped(h -> new SqliteStockTransactionRepository(h, currency));
        return transactions;
    }

    @Override
    public TargetRepository targets() {
        if (depth == 0) return new SqliteTargetRepository(standalone, currency);
        if (targets == null) targets = scoped(h -> new SqliteTargetRepository(h, currency));
        return targets;
    }

    @Override
    public PortfolioBalanceRepository balances() {
        if (depth == 0) return new SqlitePortfolioBalanceRepository(standalone, currency);
        if (balances == null) balances = scoped(h -> new SqlitePortfolioBalanceRepository(h, currency));
        return balances;
    }

    @Override
    public JournalRepository journal() {
        if (depth == 0) return new SqliteJournalRepository(standalone, currency);
        if (journal == null) journal = scoped(h -> new SqliteJournalRepository(h, currency));
        return journal;
    }

    private <R> R scoped(Function<ConnectionHandle, R> factory) {
        Connection owned = connection;
        return factory.apply(new TransactionalConnectionHandle(owned, () -> beforeScopedWork(owned), uncommittedInserts::add));
    }

    private void beforeScopedWork(Connection owned) {
        if (connection == null || connection != owned) {
            throw new IllegalStateException("Repository used after its unit of work scope ended");
        }
        if (state != UnitOfWorkState.ACTIVE) {
            // auto-commit is still off, so the driver opens the next transaction by itself
            log.debug("New transaction after {}", state);
            state = UnitOfWorkState.ACTIVE;
        }
    }

    // ------------------------------------------------------------------ scope

    @Override
    public void enter() {
        if (depth == 0) {
            Connection c = database.acquire();
            try {
                c.setAutoCommit(false);
            } catch (SQLException e) {
                RuntimeException ex = SqlErrors.translate("begin transaction", e);
                closeConnection(c, ex);
                throw ex;
            }
            connection = c;
            state = UnitOfWorkState.ACTIVE;
            rollbackOnly = false;
            log.debug("Transaction started");
        }
        depth++;
    }

    @Override
    public void exit(Throwable error) {
        if (depth == 0) {
            throw new IllegalStateException("exit() without matching enter()");
        }
        if (error != null) {
            rollbackOnly = true;
        }
        depth--;
        if (depth > 0) return;

        try {
            if (state == UnitOfWorkState.ACTIVE) {
                if (rollbackOnly) {
                    doRollback();
                    if (error == null) {
                        throw new TransactionException("Transaction rolled back: a nested scope failed");
                    }
                } else {
                    doCommit();
                }
            }
        } catch (TransactionException e) {
            if (error == null) throw e;
            error.addSuppressed(e);
        } finally {
            Connection c = connection;
            connection = null;
            closeConnection(c, error);
            // anything not committed by now is gone with the connection
            undoInserts();
            clearRepositories();
            state = UnitOfWorkState.IDLE;
            rollbackOnly = false;
        }
    }

    // ------------------------------------------------------------------ explicit control

    /**
     * Commits now. A no-op when nothing ran since the last commit or rollback.
     *
     * @throws TransactionException when a nested scope failed; the transaction is rolled back instead
     */
    @Override
    public void commit() {
        if (!inScope("commit")) return;
        if (state != UnitOfWorkState.ACTIVE) {
            log.debug("commit() ignored, transaction already {}", state);
            return;
        }
        if (rollbackOnly) {
            doRollback();
            throw new TransactionException("Transaction is rollback-only: a nested scope failed");
        }
        doCommit();
    }

    @Override
    public void rollback() {
        if (!inScope("rollback")) return;
        if (state != UnitOfWorkState.ACTIVE) {
            log.debug("rollback() ignored, transaction already {}", state);
            return;
        }
        doRollback();
    }

    @Override
    public UnitOfWorkState state() {
        return state;
    }

    @Override
    public int depth() {
        return depth;
    }

    private void doCommit() {
        try {
            connection.commit();
            uncommittedInserts.clear();
            state = UnitOfWorkState.COMMITTED;
            log.debug("Transaction committed");
        } catch (SQLException e) {
            throw new TransactionException("Commit failed: " + e.getMessage(), e);
        }
    }

    private void doRollback() {
        try {
            connection.rollback();
            state = UnitOfWorkState.ROLLED_BACK;
            rollbackOnly = false;
            log.debug("Transaction rolled back");
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
            throw new TransactionException("Rollback failed: " + e.getMessage(), e);
        } finally {
            undoInserts();
        }
    }

    private boolean inScope(String op) {
        if (depth == 0 || connection == null) {
            log.debug("{}() ignored, no unit of work scope is open", op);
            return false;
        }
        return true;
    }

    private void undoInserts() {
        for (Runnable undo : uncommittedInserts) undo.run();
        uncommittedInserts.clear();
    }

    private void clearRepositories() {
        stocks = null;
        portfolios = null;
        transactions = null;
        targets = null;
        balances = null;
        journal = null;
    }

    private static void closeConnection(Connection c, Throwable primary) {
        if (c == null) return;
        try {
            c.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection: {}", e.getMessage());
            if (primary != null) primary.addSuppressed(e);
        }
    }
}
