package com.stockbook.application.ports;

import com.stockbook.domain.stock.Stock;

import java.util.List;
import java.util.Optional;

/**
 * Stocks keyed by id and by their unique symbol. Lists are ordered by symbol.
 */
public interface StockRepository {

    /**
     * Persists a new stock and assigns its id.
     *
     * @throws com.stockbook.application.persistence.DuplicateKeyException if the symbol is taken
     */
    long create(Stock stock);

    Optional<Stock> getById(long id);

    /** Symbol is normalised before lookup, so "aapl " finds AAPL. */
    Optional<Stock> getBySymbol(String symbol);

    boolean existsBySymbol(String symbol);

    List<Stock> list(StockFilter filter);

    /** @return false when no stock has this id */
    boolean update(long id, Stock stock);

    boolean delete(long id);
}
