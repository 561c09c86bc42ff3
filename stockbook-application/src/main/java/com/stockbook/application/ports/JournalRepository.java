package com.stockbook.application.ports;

import com.stockbook.domain.journal.JournalEntry;

import java.util.List;
import java.util.Optional;

public interface JournalRepository {

    long create(JournalEntry entry);

    Optional<JournalEntry> getById(long id);

    List<JournalEntry> list(JournalFilter filter);

    /** Newest first. */
    List<JournalEntry> recent(int limit);

    boolean update(long id, JournalEntry entry);

    boolean delete(long id);
}
