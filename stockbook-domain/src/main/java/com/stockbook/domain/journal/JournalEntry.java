package com.stockbook.domain.journal;

import com.stockbook.domain.ValidationException;
import com.stockbook.domain.util.Texts;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Free-form note, optionally linked to a portfolio, a stock and/or a transaction.
 */
public final class JournalEntry {

    public static final int MAX_CONTENT = 10_000;
    public static final int MAX_TITLE = 200;
    public static final int MAX_TAG = 50;

    private Long id;
    private final Long portfolioId;
    private final Long stockId;
    private final Long transactionId;
    private final LocalDate entryDate;
    private String title;
    private String content;
    private List<String> tags;

    public JournalEntry(Long portfolioId, Long stockId, Long transactionId, LocalDate entryDate,
                        String title, String content, List<String> tags) {
        this.portfolioId = positiveOrNull("portfolioId", portfolioId);
        this.stockId = positiveOrNull("stockId", stockId);
        this.transactionId = positiveOrNull("transactionId", transactionId);
        this.entryDate = Objects.requireNonNull(entryDate, "entryDate");
        retitle(title);
        updateContent(content);
        retag(tags);
    }

    public static JournalEntry note(LocalDate date, String content) {
        return new JournalEntry(null, null, null, date, null, content, null);
    }

    public static JournalEntry restore(long id, Long portfolioId, Long stockId, Long transactionId, LocalDate entryDate,
                                       String title, String content, List<String> tags) {
        JournalEntry e = new JournalEntry(portfolioId, stockId, transactionId, entryDate, title, content, tags);
        e.assignId(id);
        return e;
    }

    public void assignId(long newId) {
        if (id != null && id != newId) {
            throw new IllegalStateException("Journal entry already has id " + id);
        }
        this.id = newId;
    }

    /** Forgets an id whose insert was rolled back, so the entity can be created again. */
    public void clearId() {
        this.id = null;
    }

    public void updateContent(String newContent) {
        this.content = Texts.required("content", newContent, MAX_CONTENT);
    }

    public void retitle(String newTitle) {
        this.title = Texts.maxLength("title", Texts.trimToNull(newTitle), MAX_TITLE);
    }

    /** Tags are trimmed, de-duplicated and kept in insertion order. */
    public void retag(List<String> newTags) {
        if (newTags == null || newTags.isEmpty()) {
            this.tags = List.of();
            return;
        }
        Set<String> clean = new LinkedHashSet<>();
        for (String t : newTags) {
            String v = Texts.trimToNull(t);
            if (v == null) continue;
            clean.add(Texts.maxLength("tag", v, MAX_TAG));
        }
        this.tags = Collections.unmodifiableList(new ArrayList<>(clean));
    }

    /** First {@code maxLength} characters of the content, with "..." when truncated. */
    public String preview(int maxLength) {
        if (content.length() <= maxLength) return content;
        return content.substring(0, maxLength) + "...";
    }

    public Long id() { return id; }
    public Long portfolioId() { return portfolioId; }
    public Long stockId() { return stockId; }
    public Long transactionId() { return transactionId; }
    public LocalDate entryDate() { return entryDate; }
    public String title() { return title; }
    public String content() { return content; }
    public List<String> tags() { return tags; }

    @Override
    public String toString() {
        return "JournalEntry(" + entryDate + ", " + preview(30) + ")";
    }

    private static Long positiveOrNull(String field, Long value) {
        if (value != null && value <= 0) {
            throw new ValidationException(field, field + " must be positive when set");
        }
        return value;
    }
}
