package com.stockbook.application.ports;

import com.stockbook.domain.portfolio.PortfolioBalance;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * One balance row per (portfolio, date).
 */
public interface PortfolioBalanceRepository {

    /**
     * Inserts or replaces the balance for its (portfolio, date) and returns the row id.
     * A replaced row keeps its id.
     */
    long create(PortfolioBalance balance);

    Optional<PortfolioBalance> getById(long id);

    Optional<PortfolioBalance> getByPortfolioAndDate(long portfolioId, LocalDate date);

    List<PortfolioBalance> list(BalanceFilter filter);

    /** Newest first. */
    List<PortfolioBalance> history(long portfolioId, int limit);

    Optional<PortfolioBalance> latest(long portfolioId);

    boolean update(long id, PortfolioBalance balance);

    boolean delete(long id);
}
