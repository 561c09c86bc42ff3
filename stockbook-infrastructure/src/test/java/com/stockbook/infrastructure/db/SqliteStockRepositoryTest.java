package com.stockbook.infrastructure.db;

import com.stockbook.application.persistence.DuplicateKeyException;
import com.stockbook.application.ports.StockFilter;
import com.stockbook.domain.money.CurrencyCode;
import com.stockbook.domain.stock.Grade;
import com.stockbook.domain.stock.Stock;
import com.stockbook.domain.stock.Symbol;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqliteStockRepositoryTest {

    @TempDir
    Path dir;

    private SqliteStockRepository repo;

    @BeforeEach
    void setUp() {
        Database db = new Database(dir.resolve("stocks.db"));
        db.initSchema();
        repo = new SqliteStockRepository(new StandaloneConnectionHandle(db), CurrencyCode.USD);
    }

    @Test
    void createAssignsIdAndStoresNormalisedSymbol() {
        Stock apple = Stock.of("aapl ", "Apple Inc.");
        long id = repo.create(apple);

        assertThat(apple.id()).isEqualTo(id);
        Stock loaded = repo.getById(id).orElseThrow();
        assertThat(loaded.symbol().value()).isEqualTo("AAPL");
        assertThat(loaded.name()).isEqualTo("Apple Inc.");
        assertThat(repo.getBySymbol(" aapl")).isPresent();
        assertThat(repo.existsBySymbol("AAPL")).isTrue();
        assertThat(repo.existsBySymbol("MSFT")).isFalse();
    }

    @Test
    void duplicateSymbolIsRejected() {
        repo.create(Stock.of("aapl ", "Apple"));

        assertThatThrownBy(() -> repo.create(Stock.of("AAPL", "Apple again")))
                .isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    void listFiltersAndOrdersBySymbol() {
        repo.create(new Stock(Symbol.of("MSFT"), "Microsoft", "Software", Grade.A, null));
        repo.create(new Stock(Symbol.of("AAPL"), "Apple", "Hardware", Grade.A, null));
        repo.create(new Stock(Symbol.of("ADBE"), "Adobe", "Software", Grade.B, null));

        assertThat(repo.list(StockFilter.all())).extracting(s -> s.symbol().value())
                .containsExactly("AAPL", "ADBE", "MSFT");
        assertThat(repo.list(StockFilter.all().withIndustryGroup("soft"))).extracting(s -> s.symbol().value())
                .containsExactly("ADBE", "MSFT");
        assertThat(repo.list(StockFilter.all().withIndustryGroup("soft").withGrade(Grade.A)))
                .extracting(s -> s.symbol().value())
                .containsExactly("MSFT");
        assertThat(repo.list(StockFilter.all().withName("APP"))).hasSize(1);
        assertThat(repo.list(StockFilter.all().page(2, 1))).extracting(s -> s.symbol().value())
                .containsExactly("ADBE", "MSFT");
    }

    @Test
    void likeWildcardsAreMatchedLiterally() {
        repo.create(Stock.of("AAPL", "Apple"));
        assertThat(repo.list(StockFilter.all().withName("%"))).isEmpty();
    }

    @Test
    void updateAndDelete() {
        Stock s = Stock.of("NVDA", "Nvidia");
        long id = repo.create(s);
        s.changeGrade(Grade.A);
        s.updateNotes("leader");

        assertThat(repo.update(id, s)).isTrue();
        Stock loaded = repo.getById(id).orElseThrow();
        assertThat(loaded.grade()).isEqualTo(Grade.A);
        assertThat(loaded.notes()).isEqualTo("leader");

        assertThat(repo.update(9999, s)).isFalse();
        assertThat(repo.delete(id)).isTrue();
        assertThat(repo.delete(id)).isFalse();
        assertThat(repo.getById(id)).isEmpty();
    }
}
