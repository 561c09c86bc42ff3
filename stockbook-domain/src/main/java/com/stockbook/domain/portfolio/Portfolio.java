package com.stockbook.domain.portfolio;

import com.stockbook.domain.ValidationException;
import com.stockbook.domain.util.Texts;

import java.math.BigDecimal;
import java.util.Objects;

public final class Portfolio {

    public static final int MAX_NAME = 100;
    public static final int MAX_DESCRIPTION = 1000;

    private Long id;
    private String name;
    private String description;
    private int maxPositions;
    private BigDecimal maxRiskPerTrade;
    private boolean active;

    public Portfolio(String name, String description, int maxPositions, BigDecimal maxRiskPerTrade, boolean active) {
        rename(name);
        updateDescription(description);
        changeLimits(maxPositions, maxRiskPerTrade);
        this.active = active;
    }

    public static Portfolio restore(long id, String name, String description, int maxPositions,
                                    BigDecimal maxRiskPerTrade, boolean active) {
        Portfolio p = new Portfolio(name, description, maxPositions, maxRiskPerTrade, active);
        p.assignId(id);
        return p;
    }

    public void assignId(long newId) {
        if (id != null && id != newId) {
            throw new IllegalStateException("Portfolio '" + name + "' already has id " + id);
        }
        this.id = newId;
    }

    /** Forgets an id whose insert was rolled back, so the entity can be created again. */
    public void clearId() {
        this.id = null;
    }

    public void rename(String newName) {
        this.name = Texts.required("name", newName, MAX_NAME);
    }

    public void updateDescription(String newDescription) {
        this.description = Texts.maxLength("description", Texts.trimToEmpty(newDescription), MAX_DESCRIPTION);
    }

    public void changeLimits(int newMaxPositions, BigDecimal newMaxRiskPerTrade) {
        if (newMaxPositions <= 0) {
            throw new ValidationException("maxPositions", "Max positions must be positive");
        }
        Objects.requireNonNull(newMaxRiskPerTrade, "maxRiskPerTrade");
        if (newMaxRiskPerTrade.signum() <= 0) {
            throw new ValidationException("maxRiskPerTrade", "Max risk per trade must be positive");
        }
        this.maxPositions = newMaxPositions;
        this.maxRiskPerTrade = newMaxRiskPerTrade;
    }

    public void activate() { this.active = true; }
    public void deactivate() { this.active = false; }

    public Long id() { return id; }
    public String name() { return name; }
    public String description() { return description; }
    public int maxPositions() { return maxPositions; }
    public BigDecimal maxRiskPerTrade() { return maxRiskPerTrade; }
    public boolean isActive() { return active; }

    @Override
    public String toString() {
        return "Portfolio(" + id + ", " + name + (active ? "" : ", inactive") + ")";
    }
}
