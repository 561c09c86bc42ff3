package com.stockbook.domain.stock;

import com.stockbook.domain.util.Texts;

import java.util.Objects;

/**
 * A tracked security.
 *
 * Business identity is the {@link Symbol}: two stocks with the same symbol are equal
 * whether or not either has been persisted yet.
 */
public final class Stock {

    public static final int MAX_NAME = 200;
    public static final int MAX_INDUSTRY_GROUP = 100;
    public static final int MAX_NOTES = 1000;

    private Long id;
    private final Symbol symbol;
    private String name;
    private String industryGroup;
    private Grade grade;
    private String notes;

    public Stock(Symbol symbol, String name, String industryGroup, Grade grade, String notes) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        rename(name);
        changeIndustryGroup(industryGroup);
        this.grade = grade;
        updateNotes(notes);
    }

    public static Stock of(String symbol, String name) {
        return new Stock(Symbol.of(symbol), name, null, null, null);
    }

    /** Rehydrates a persisted row. */
    public static Stock restore(long id, Symbol symbol, String name, String industryGroup, Grade grade, String notes) {
        Stock s = new Stock(symbol, name, industryGroup, grade, notes);
        s.assignId(id);
        return s;
    }

    public void assignId(long newId) {
        if (id != null && id != newId) {
            throw new IllegalStateException("Stock " + symbol + " already has id " + id);
        }
        this.id = newId;
    }

    /** Forgets an id whose insert was rolled back, so the entity can be created again. */
    public void clearId() {
        this.id = null;
    }

    public void rename(String newName) {
        this.name = Texts.maxLength("name", Texts.trimToEmpty(newName), MAX_NAME);
    }

    public void changeIndustryGroup(String group) {
        this.industryGroup = Texts.maxLength("industryGroup", Texts.trimToNull(group), MAX_INDUSTRY_GROUP);
    }

    public void changeGrade(Grade newGrade) {
        this.grade = newGrade;
    }

    public void updateNotes(String newNotes) {
        this.notes = Texts.maxLength("notes", Texts.trimToEmpty(newNotes), MAX_NOTES);
    }

    public Long id() { return id; }
    public Symbol symbol() { return symbol; }
    public String name() { return name; }
    public String industryGroup() { return industryGroup; }
    public Grade grade() { return grade; }
    public String notes() { return notes; }

    public boolean hasNotes() {
        return !notes.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Stock other)) return false;
        return symbol.equals(other.symbol);
    }

    @Override
    public int hashCode() {
        return symbol.hashCode();
    }

    @Override
    public String toString() {
        return "Stock(" + symbol + ", " + name + ")";
    }
}
