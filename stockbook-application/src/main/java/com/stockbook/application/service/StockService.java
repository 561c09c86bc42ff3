package com.stockbook.application.service;

import com.stockbook.application.persistence.DuplicateKeyException;
import com.stockbook.application.ports.StockFilter;
import com.stockbook.application.ports.UnitOfWorkFactory;
import com.stockbook.domain.stock.Grade;
import com.stockbook.domain.stock.Stock;
import com.stockbook.domain.stock.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Stock use cases. Writes run in their own Unit of Work; reads go through standalone repositories.
 */
public class StockService {

    private static final Logger log = LoggerFactory.getLogger(StockService.class);

    private final UnitOfWorkFactory uowFactory;

    public StockService(UnitOfWorkFactory uowFactory) {
        this.uowFactory = Objects.requireNonNull(uowFactory, "uowFactory");
    }

    /**
     * @throws DuplicateKeyException if a stock with the same (normalised) symbol exists
     */
    public Stock register(String symbol, String name, String industryGroup, Grade grade, String notes) {
        Symbol sym = Symbol.of(symbol);
        Stock stock = new Stock(sym, name, industryGroup, grade, notes);

        return uowFactory.create().execute(uow -> {
            if (uow.stocks().existsBySymbol(sym.value())) {
                throw new DuplicateKeyException("Stock with symbol " + sym + " already exists");
            }
            uow.stocks().create(stock);
            log.info("Registered stock {} (id={})", sym, stock.id());
            return stock;
        });
    }

    public Optional<Stock> findBySymbol(String symbol) {
        return uowFactory.create().stocks().getBySymbol(Symbol.normalize(symbol));
    }

    public boolean exists(String symbol) {
        return uowFactory.create().stocks().existsBySymbol(Symbol.normalize(symbol));
    }

    public List<Stock> search(StockFilter filter) {
        return uowFactory.create().stocks().list(filter == null ? StockFilter.all() : filter);
    }

    /**
     * Replaces the editable details of a stock. Null arguments leave the field unchanged.
     *
     * @return the updated stock, empty when no stock has this id
     */
    public Optional<Stock> updateDetails(long id, String name, String industryGroup, Grade grade, String notes) {
        return uowFactory.create().execute(uow -> {
            Optional<Stock> found = uow.stocks().getById(id);
            if (found.isEmpty()) return Optional.<Stock>empty();

            Stock stock = found.get();
            if (name != null) stock.rename(name);
            if (industryGroup != null) stock.changeIndustryGroup(industryGroup);
            if (grade != null) stock.changeGrade(grade);
            if (notes != null) stock.updateNotes(notes);

            uow.stocks().update(id, stock);
            log.debug("Updated stock {}", stock.symbol());
            return Optional.of(stock);
        });
    }
}
