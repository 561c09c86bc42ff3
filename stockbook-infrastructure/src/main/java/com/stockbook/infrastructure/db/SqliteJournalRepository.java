package com.stockbook.infrastructure.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockbook.application.persistence.PersistenceException;
import com.stockbook.application.ports.JournalFilter;
import com.stockbook.application.ports.JournalRepository;
import com.stockbook.domain.journal.JournalEntry;
import com.stockbook.domain.money.CurrencyCode;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Journal entries; tags are kept as a JSON array in a single column.
 */
public class SqliteJournalRepository extends SqliteRepository implements JournalRepository {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<List<String>> TAGS = new TypeReference<>() {};

    private static final String SELECT = """
            SELECT id,portfolio_id,stock_id,transaction_id,entry_date,title,content,tags
            FROM journal_entry""";

    public SqliteJournalRepository(ConnectionHandle handle, CurrencyCode currency) {
        super(handle, currency);
    }

    @Override
    public long create(JournalEntry e) {
        requireNew(e.id(), "Journal entry");
        String now = now();
        String tags = tagsJson(e.tags());
        long id = handle.execute("create journal entry", c -> insert(c, """
                INSERT INTO journal_entry(portfolio_id, stock_id, transaction_id, entry_date, title, content, tags,
                                          created_at, updated_at)
                VALUES(?,?,?,?,?,?,?,?,?)
                """,
                e.portfolioId(), e.stockId(), e.transactionId(), text(e.entryDate()), e.title(), e.content(), tags,
                now, now));
        assigned(id, e::assignId, e::clearId);
        return id;
    }

    @Override
    public Optional<JournalEntry> getById(long id) {
        return queryOne("get journal entry", SELECT + " WHERE id=?", SqliteJournalRepository::map, id);
    }

    @Override
    public List<JournalEntry> list(JournalFilter filter) {
        JournalFilter f = filter == null ? JournalFilter.all() : filter;
        SqlWhere where = new SqlWhere()
                .eq("portfolio_id", f.portfolioId())
                .eq("stock_id", f.stockId())
                .eq("transaction_id", f.transactionId())
                .onOrAfter("entry_date", f.from())
                .onOrBefore("entry_date", f.to())
                .containsAny(f.text(), "title", "content");
        return queryList("list journal", SELECT, where, "entry_date, id", f.limit(), f.offset(),
                SqliteJournalRepository::map);
    }

    @Override
    public List<JournalEntry> recent(int limit) {
        return queryList("recent journal", SELECT, new SqlWhere(), "entry_date DESC, id DESC",
                limit > 0 ? limit : 10, null, SqliteJournalRepository::map);
    }

    @Override
    public boolean update(long id, JournalEntry e) {
        String tags = tagsJson(e.tags());
        return change("update journal entry " + id, """
                UPDATE journal_entry
                SET portfolio_id=?, stock_id=?, transaction_id=?, entry_date=?, title=?, content=?, tags=?, updated_at=?
                WHERE id=?
                """,
                e.portfolioId(), e.stockId(), e.transactionId(), text(e.entryDate()), e.title(), e.content(), tags,
                now(), id);
    }

    @Override
    public boolean delete(long id) {
        return change("delete journal entry " + id, "DELETE FROM journal_entry WHERE id=?", id);
    }

    private static String tagsJson(List<String> tags) {
        try {
            return JSON.writeValueAsString(tags == null ? List.of() : tags);
        } catch (JsonProcessingException ex) {
            throw new PersistenceException("Failed to serialize journal tags", ex);
        }
    }

    private static List<String> parseTags(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return JSON.readValue(json, TAGS);
        } catch (JsonProcessingException ex) {
            throw new PersistenceException("Corrupt journal tags: " + json, ex);
        }
    }

    private static JournalEntry map(ResultSet rs) throws SQLException {
        return JournalEntry.restore(
                rs.getLong("id"),
                nullableLong(rs, "portfolio_id"),
                nullableLong(rs, "stock_id"),
                nullableLong(rs, "transaction_id"),
                date(rs, "entry_date"),
                rs.getString("title"),
                rs.getString("content"),
                parseTags(rs.getString("tags"))
        );
    }
}
