package com.stockbook.infrastructure.db;

import com.stockbook.application.persistence.PersistenceException;
import com.stockbook.application.ports.TransactionFilter;
import com.stockbook.domain.money.CurrencyCode;
import com.stockbook.domain.money.CurrencyMismatchException;
import com.stockbook.domain.money.Money;
import com.stockbook.domain.money.Quantity;
import com.stockbook.domain.portfolio.Portfolio;
import com.stockbook.domain.stock.Stock;
import com.stockbook.domain.trade.StockTransaction;
import com.stockbook.domain.trade.TransactionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqliteStockTransactionRepositoryTest {

    @TempDir
    Path dir;

    private SqliteStockTransactionRepository repo;
    private long portfolioId;
    private long appleId;
    private long msftId;

    @BeforeEach
    void setUp() {
        Database db = new Database(dir.resolve("tx.db"));
        db.initSchema();
        ConnectionHandle h = new StandaloneConnectionHandle(db);
        portfolioId = new SqlitePortfolioRepository(h, CurrencyCode.USD)
                .create(new Portfolio("Main", null, 10, BigDecimal.ONE, true));
        SqliteStockRepository stocks = new SqliteStockRepository(h, CurrencyCode.USD);
        appleId = stocks.create(Stock.of("AAPL", "Apple"));
        msftId = stocks.create(Stock.of("MSFT", "Microsoft"));
        repo = new SqliteStockTransactionRepository(h, CurrencyCode.USD);
    }

    private StockTransaction tx(long stockId, TransactionType type, String qty, String price, LocalDate date) {
        return new StockTransaction(portfolioId, stockId, type, Quantity.of(qty), Money.of(price, CurrencyCode.USD), date, null);
    }

    @Test
    void exactDecimalsSurviveRoundTrip() {
        long id = repo.create(tx(appleId, TransactionType.BUY, "12.3456", "187.25", LocalDate.of(2024, 1, 5)));

        StockTransaction loaded = repo.getById(id).orElseThrow();
        assertThat(loaded.quantity()).isEqualTo(Quantity.of("12.3456"));
        assertThat(loaded.price()).isEqualTo(Money.of("187.25", CurrencyCode.USD));
        assertThat(loaded.type()).isEqualTo(TransactionType.BUY);
        assertThat(loaded.transactionDate()).isEqualTo(LocalDate.of(2024, 1, 5));
    }

    @Test
    void listFiltersByStockTypeAndDateRangeInDateOrder() {
        repo.create(tx(appleId, TransactionType.BUY, "10", "100", LocalDate.of(2024, 3, 1)));
        repo.create(tx(appleId, TransactionType.SELL, "5", "120", LocalDate.of(2024, 2, 1)));
        repo.create(tx(msftId, TransactionType.BUY, "3", "400", LocalDate.of(2024, 1, 1)));

        assertThat(repo.list(TransactionFilter.all())).extracting(StockTransaction::transactionDate)
                .containsExactly(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1), LocalDate.of(2024, 3, 1));
        assertThat(repo.list(TransactionFilter.forPosition(portfolioId, appleId))).hasSize(2);
        assertThat(repo.list(TransactionFilter.all().withType(TransactionType.SELL))).hasSize(1);
        assertThat(repo.list(TransactionFilter.all().between(LocalDate.of(2024, 1, 15), LocalDate.of(2024, 3, 1))))
                .extracting(StockTransaction::stockId)
                .containsExactly(appleId, appleId);
    }

    @Test
    void unknownStockViolatesForeignKey() {
        assertThatThrownBy(() -> repo.create(tx(999, TransactionType.BUY, "1", "1", LocalDate.of(2024, 1, 1))))
                .isInstanceOf(PersistenceException.class);
    }

    @Test
    void foreignCurrencyCannotBeStored() {
        StockTransaction cad = new StockTransaction(portfolioId, appleId, TransactionType.BUY, Quantity.of(1),
                Money.of(10, CurrencyCode.CAD), LocalDate.of(2024, 1, 1), null);
        assertThatThrownBy(() -> repo.create(cad)).isInstanceOf(CurrencyMismatchException.class);
    }

    @Test
    void updateAndDelete() {
        long id = repo.create(tx(appleId, TransactionType.BUY, "10", "100", LocalDate.of(2024, 3, 1)));
        StockTransaction changed = tx(appleId, TransactionType.BUY, "11", "99.50", LocalDate.of(2024, 3, 2));

        assertThat(repo.update(id, changed)).isTrue();
        assertThat(repo.getById(id).orElseThrow().quantity()).isEqualTo(Quantity.of(11));
        assertThat(repo.update(id + 100, changed)).isFalse();
        assertThat(repo.delete(id)).isTrue();
    }
}
