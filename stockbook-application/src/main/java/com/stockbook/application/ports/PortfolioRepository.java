package com.stockbook.application.ports;

import com.stockbook.domain.portfolio.Portfolio;

import java.util.List;
import java.util.Optional;

public interface PortfolioRepository {

    long create(Portfolio portfolio);

    Optional<Portfolio> getById(long id);

    List<Portfolio> list(PortfolioFilter filter);

    List<Portfolio> listActive();

    boolean update(long id, Portfolio portfolio);

    /** Soft delete: clears the active flag. */
    boolean deactivate(long id);

    boolean delete(long id);
}
