package com.stockbook.infrastructure.db;

import com.stockbook.application.ports.JournalFilter;
import com.stockbook.domain.journal.JournalEntry;
import com.stockbook.domain.money.CurrencyCode;
import com.stockbook.domain.portfolio.Portfolio;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SqliteJournalRepositoryTest {

    @TempDir
    Path dir;

    private Database db;
    private SqliteJournalRepository repo;
    private long portfolioId;

    @BeforeEach
    void setUp() {
        db = new Database(dir.resolve("journal.db"));
        db.initSchema();
        ConnectionHandle h = new StandaloneConnectionHandle(db);
        portfolioId = new SqlitePortfolioRepository(h, CurrencyCode.USD)
                .create(new Portfolio("Main", null, 10, BigDecimal.ONE, true));
        repo = new SqliteJournalRepository(h, CurrencyCode.USD);
    }

    @Test
    void tagsArePersistedAsJsonArray() {
        JournalEntry e = new JournalEntry(portfolioId, null, null, LocalDate.of(2024, 2, 2), "Review",
                "Cut losers early", List.of("discipline", "review"));
        long id = repo.create(e);

        JournalEntry loaded = repo.getById(id).orElseThrow();
        assertThat(loaded.tags()).containsExactly("discipline", "review");
        assertThat(loaded.portfolioId()).isEqualTo(portfolioId);
        assertThat(loaded.stockId()).isNull();

        String raw = db.withinTransaction("raw tags", c -> {
            try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT tags FROM journal_entry")) {
                rs.next();
                return rs.getString(1);
            }
        });
        assertThat(raw).isEqualTo("[\"discipline\",\"review\"]");
    }

    @Test
    void textSearchMatchesTitleOrContent() {
        repo.create(new JournalEntry(null, null, null, LocalDate.of(2024, 1, 1), "Earnings", "Beat estimates", null));
        repo.create(new JournalEntry(null, null, null, LocalDate.of(2024, 1, 2), null, "Market breadth improving", null));
        repo.create(new JournalEntry(null, null, null, LocalDate.of(2024, 1, 3), "Plan", "Wait for EARNINGS", null));

        assertThat(repo.list(JournalFilter.all().containing("earnings"))).extracting(JournalEntry::entryDate)
                .containsExactly(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 3));
    }

    @Test
    void recentIsNewestFirst() {
        for (int day = 1; day <= 5; day++) {
            repo.create(JournalEntry.note(LocalDate.of(2024, 1, day), "day " + day));
        }

        assertThat(repo.recent(3)).extracting(JournalEntry::content).containsExactly("day 5", "day 4", "day 3");
    }

    @Test
    void updateMissingReturnsFalse() {
        assertThat(repo.update(5, JournalEntry.note(LocalDate.of(2024, 1, 1), "x"))).isFalse();
    }
}
