package com.stockbook.application.ports;

import com.stockbook.domain.trade.StockTransaction;

import java.util.List;
import java.util.Optional;

/** Lists are ordered by transaction date, then id. */
public interface StockTransactionRepository {

    long create(StockTransaction transaction);

    Optional<StockTransaction> getById(long id);

    List<StockTransaction> list(TransactionFilter filter);

    boolean update(long id, StockTransaction transaction);

    boolean delete(long id);
}
